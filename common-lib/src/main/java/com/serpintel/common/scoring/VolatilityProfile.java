package com.serpintel.common.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.model.VolatilityMaturity;
import com.serpintel.common.model.VolatilityRegime;

/**
 * Keyword-level volatility over one window. The three components reconcile to
 * {@code volatilityScore} within 0.02.
 *
 * @param sampleSize         number of consecutive pairs in the window
 * @param averageRankShift   mean of the per-pair average shifts, 4 dp
 * @param maxRankShift       largest single shift in any pair
 * @param featureVolatility  total feature changes across all pairs
 * @param aiOverviewChurn    number of pairs whose AI overview status flipped
 */
public record VolatilityProfile(
    @JsonProperty("sampleSize")                 int sampleSize,
    @JsonProperty("averageRankShift")           double averageRankShift,
    @JsonProperty("maxRankShift")               int maxRankShift,
    @JsonProperty("featureVolatility")          int featureVolatility,
    @JsonProperty("aiOverviewChurn")            int aiOverviewChurn,
    @JsonProperty("volatilityScore")            double volatilityScore,
    @JsonProperty("rankVolatilityComponent")    double rankVolatilityComponent,
    @JsonProperty("aiOverviewComponent")        double aiOverviewComponent,
    @JsonProperty("featureVolatilityComponent") double featureVolatilityComponent,
    @JsonProperty("volatilityRegime")           VolatilityRegime regime,
    @JsonProperty("maturity")                   VolatilityMaturity maturity
) {

    public static VolatilityProfile empty() {
        return new VolatilityProfile(0, 0.0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0,
            VolatilityRegime.CALM, VolatilityMaturity.PRELIMINARY);
    }

    public boolean hasSamples() {
        return sampleSize > 0;
    }
}
