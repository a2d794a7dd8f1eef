package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.model.VolatilityMaturity;
import com.serpintel.common.model.VolatilityRegime;

import java.util.UUID;

public record VolatilityAlertItem(
    @JsonProperty("keywordTargetId")            UUID keywordTargetId,
    @JsonProperty("query")                      String query,
    @JsonProperty("locale")                     String locale,
    @JsonProperty("device")                     String device,
    @JsonProperty("volatilityScore")            double volatilityScore,
    @JsonProperty("rankVolatilityComponent")    double rankVolatilityComponent,
    @JsonProperty("aiOverviewComponent")        double aiOverviewComponent,
    @JsonProperty("featureVolatilityComponent") double featureVolatilityComponent,
    @JsonProperty("maturity")                   VolatilityMaturity maturity,
    @JsonProperty("volatilityRegime")           VolatilityRegime volatilityRegime,
    @JsonProperty("sampleSize")                 int sampleSize,
    @JsonProperty("alertThreshold")             int alertThreshold,
    @JsonProperty("exceedsThreshold")           boolean exceedsThreshold
) {}
