package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.model.VolatilityMaturity;
import com.serpintel.common.model.VolatilityRegime;

import java.time.Instant;
import java.util.UUID;

/**
 * Response for GET /api/seo/keyword-targets/{id}/volatility.
 */
public record KeywordVolatilityResponse(
    @JsonProperty("keywordTargetId")            UUID keywordTargetId,
    @JsonProperty("query")                      String query,
    @JsonProperty("locale")                     String locale,
    @JsonProperty("device")                     String device,
    @JsonProperty("windowDays")                 Integer windowDays,
    @JsonProperty("windowStartAt")              Instant windowStartAt,
    @JsonProperty("alertThreshold")             int alertThreshold,
    @JsonProperty("exceedsThreshold")           boolean exceedsThreshold,
    @JsonProperty("sampleSize")                 int sampleSize,
    @JsonProperty("snapshotCount")              int snapshotCount,
    @JsonProperty("averageRankShift")           double averageRankShift,
    @JsonProperty("maxRankShift")               int maxRankShift,
    @JsonProperty("featureVolatility")          int featureVolatility,
    @JsonProperty("aiOverviewChurn")            int aiOverviewChurn,
    @JsonProperty("volatilityScore")            double volatilityScore,
    @JsonProperty("rankVolatilityComponent")    double rankVolatilityComponent,
    @JsonProperty("aiOverviewComponent")        double aiOverviewComponent,
    @JsonProperty("featureVolatilityComponent") double featureVolatilityComponent,
    @JsonProperty("volatilityRegime")           VolatilityRegime volatilityRegime,
    @JsonProperty("maturity")                   VolatilityMaturity maturity,
    @JsonProperty("computedAt")                 Instant computedAt
) {}
