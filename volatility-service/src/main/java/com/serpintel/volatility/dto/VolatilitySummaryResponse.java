package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.risk.MaturityDistribution;
import com.serpintel.common.risk.ProjectRiskSummary;
import com.serpintel.common.risk.RegimeDistribution;
import com.serpintel.common.risk.RiskKeyword;

import java.time.Instant;
import java.util.List;

/**
 * Response for GET /api/seo/volatility-summary.
 */
public record VolatilitySummaryResponse(
    @JsonProperty("windowDays")                     Integer windowDays,
    @JsonProperty("keywordCount")                   int keywordCount,
    @JsonProperty("activeKeywordCount")             int activeKeywordCount,
    @JsonProperty("averageVolatility")              double averageVolatility,
    @JsonProperty("maxVolatility")                  double maxVolatility,
    @JsonProperty("regimeDistribution")             RegimeDistribution regimeDistribution,
    @JsonProperty("maturityDistribution")           MaturityDistribution maturityDistribution,
    @JsonProperty("weightedProjectVolatilityScore") double weightedProjectVolatilityScore,
    @JsonProperty("volatilityConcentrationRatio")   Double volatilityConcentrationRatio,
    @JsonProperty("top3RiskKeywords")               List<RiskKeyword> top3RiskKeywords,
    @JsonProperty("computedAt")                     Instant computedAt
) {
    public static VolatilitySummaryResponse of(Integer windowDays, ProjectRiskSummary s, Instant computedAt) {
        return new VolatilitySummaryResponse(
            windowDays, s.keywordCount(), s.activeKeywordCount(), s.averageVolatility(), s.maxVolatility(),
            s.regimeDistribution(), s.maturityDistribution(), s.weightedProjectVolatilityScore(),
            s.volatilityConcentrationRatio(), s.top3RiskKeywords(), computedAt);
    }
}
