package com.serpintel.common.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding helpers shared by the scoring and aggregation code. All rounding is
 * half-up on the decimal representation so repeated reads stay byte-identical.
 */
public final class Numbers {

    private Numbers() {}

    public static double round(double value, int decimals) {
        return BigDecimal.valueOf(value)
            .setScale(decimals, RoundingMode.HALF_UP)
            .doubleValue();
    }

    public static double round2(double value) {
        return round(value, 2);
    }

    /** Clamp to [0, cap] and return the 0-1 ratio; a zero cap yields 0. */
    public static double normalizeToOne(double value, double cap) {
        if (cap == 0.0) {
            return 0.0;
        }
        return Math.min(Math.max(value, 0.0), cap) / cap;
    }
}
