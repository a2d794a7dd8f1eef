package com.serpintel.common.classifier;

import com.serpintel.common.model.VolatilityMaturity;

/**
 * Maps a pair count to a {@link VolatilityMaturity}.
 *
 * <p>0-4 pairs are preliminary, 5-19 developing, 20 or more stable.
 */
public final class MaturityClassifier {

    public static final int DEVELOPING_MIN_SAMPLES = 5;
    public static final int STABLE_MIN_SAMPLES     = 20;

    private MaturityClassifier() {}

    public static VolatilityMaturity classify(int sampleSize) {
        if (sampleSize >= STABLE_MIN_SAMPLES) {
            return VolatilityMaturity.STABLE;
        }
        if (sampleSize >= DEVELOPING_MIN_SAMPLES) {
            return VolatilityMaturity.DEVELOPING;
        }
        return VolatilityMaturity.PRELIMINARY;
    }
}
