package com.serpintel.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Project-wide volatility summary. Both distributions sum to
 * {@code keywordCount}.
 *
 * @param volatilityConcentrationRatio share of total volatility held by the
 *                                     three riskiest keywords; null when the
 *                                     total is zero
 */
public record ProjectRiskSummary(
    @JsonProperty("keywordCount")                   int keywordCount,
    @JsonProperty("activeKeywordCount")             int activeKeywordCount,
    @JsonProperty("averageVolatility")              double averageVolatility,
    @JsonProperty("maxVolatility")                  double maxVolatility,
    @JsonProperty("regimeDistribution")             RegimeDistribution regimeDistribution,
    @JsonProperty("maturityDistribution")           MaturityDistribution maturityDistribution,
    @JsonProperty("weightedProjectVolatilityScore") double weightedProjectVolatilityScore,
    @JsonProperty("volatilityConcentrationRatio")   Double volatilityConcentrationRatio,
    @JsonProperty("top3RiskKeywords")               List<RiskKeyword> top3RiskKeywords
) {}
