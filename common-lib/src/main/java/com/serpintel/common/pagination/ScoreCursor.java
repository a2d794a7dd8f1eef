package com.serpintel.common.pagination;

import java.util.List;
import java.util.UUID;

/**
 * Position in the volatility-alert list: score descending, query ascending,
 * keyword id ascending.
 */
public record ScoreCursor(double score, String query, UUID id) {

    public String encode() {
        return CursorCodec.encode(Double.toString(score), query, id.toString());
    }

    public static ScoreCursor decode(String token) {
        List<String> parts = CursorCodec.decode(token, 3);
        try {
            return new ScoreCursor(Double.parseDouble(parts.get(0)), parts.get(1), UUID.fromString(parts.get(2)));
        } catch (IllegalArgumentException e) {
            throw CursorCodec.invalid(e);
        }
    }

    /**
     * True when {@code (score, query, id)} sorts strictly after this position.
     */
    public boolean precedes(double otherScore, String otherQuery, UUID otherId) {
        if (otherScore != score) {
            return otherScore < score;
        }
        int q = otherQuery.compareTo(query);
        if (q != 0) {
            return q > 0;
        }
        return otherId.toString().compareTo(id.toString()) > 0;
    }
}
