package com.serpintel.common.validation;

import java.util.Locale;

/**
 * Canonical form of a tracked search query: trimmed, inner whitespace runs
 * collapsed to one space, lower-cased.
 */
public final class QueryNormalizer {

    private QueryNormalizer() {}

    public static String normalize(String query) {
        if (query == null) {
            return null;
        }
        return query.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
