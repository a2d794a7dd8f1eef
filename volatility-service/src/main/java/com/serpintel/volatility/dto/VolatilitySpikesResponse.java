package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.spike.VolatilitySpike;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record VolatilitySpikesResponse(
    @JsonProperty("keywordTargetId") UUID keywordTargetId,
    @JsonProperty("query")           String query,
    @JsonProperty("locale")          String locale,
    @JsonProperty("device")          String device,
    @JsonProperty("windowDays")      Integer windowDays,
    @JsonProperty("sampleSize")      int sampleSize,
    @JsonProperty("totalPairs")      int totalPairs,
    @JsonProperty("topN")            int topN,
    @JsonProperty("spikes")          List<VolatilitySpike> spikes,
    @JsonProperty("computedAt")      Instant computedAt
) {}
