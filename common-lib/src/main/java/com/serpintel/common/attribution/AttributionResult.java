package com.serpintel.common.attribution;

import java.util.List;

/**
 * @param urlCount distinct URLs before the topN cut
 * @param urls     at most topN entries, highest total shift first
 */
public record AttributionResult(int sampleSize, int urlCount, List<UrlAttribution> urls) {

    public static AttributionResult empty() {
        return new AttributionResult(0, 0, List.of());
    }
}
