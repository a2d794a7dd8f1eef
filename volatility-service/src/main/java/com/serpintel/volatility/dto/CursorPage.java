package com.serpintel.volatility.dto;

import java.util.List;

/**
 * One page of a cursor-paginated listing.
 */
public record CursorPage<T>(List<T> items, int limit, String nextCursor) {

    public boolean hasMore() {
        return nextCursor != null;
    }
}
