package com.serpintel.common.classifier;

import com.serpintel.common.model.VolatilityRegime;

/**
 * Pure stateless classifier that maps a 0-100 volatility score to a
 * {@link VolatilityRegime}.
 *
 * <p>Bands (upper bound inclusive):
 * <ol>
 *   <li>score &le; 20 → {@link VolatilityRegime#CALM}</li>
 *   <li>score &le; 50 → {@link VolatilityRegime#SHIFTING}</li>
 *   <li>score &le; 75 → {@link VolatilityRegime#UNSTABLE}</li>
 *   <li>otherwise     → {@link VolatilityRegime#CHAOTIC}</li>
 * </ol>
 *
 * <p>No logging. No side-effects.
 */
public final class VolatilityRegimeClassifier {

    public static final double CALM_CEILING     = 20.0;
    public static final double SHIFTING_CEILING = 50.0;
    public static final double UNSTABLE_CEILING = 75.0;

    private VolatilityRegimeClassifier() {}

    public static VolatilityRegime classify(double score) {
        if (score <= CALM_CEILING) {
            return VolatilityRegime.CALM;
        }
        if (score <= SHIFTING_CEILING) {
            return VolatilityRegime.SHIFTING;
        }
        if (score <= UNSTABLE_CEILING) {
            return VolatilityRegime.UNSTABLE;
        }
        return VolatilityRegime.CHAOTIC;
    }
}
