package com.serpintel.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.model.VolatilityRegime;

import java.util.UUID;

public record RiskKeyword(
    @JsonProperty("keywordTargetId")  UUID keywordTargetId,
    @JsonProperty("query")            String query,
    @JsonProperty("volatilityScore")  double volatilityScore,
    @JsonProperty("volatilityRegime") VolatilityRegime volatilityRegime
) {}
