package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.attribution.UrlAttribution;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record VolatilityBreakdownResponse(
    @JsonProperty("keywordTargetId") UUID keywordTargetId,
    @JsonProperty("query")           String query,
    @JsonProperty("locale")          String locale,
    @JsonProperty("device")          String device,
    @JsonProperty("windowDays")      Integer windowDays,
    @JsonProperty("sampleSize")      int sampleSize,
    @JsonProperty("urlCount")        int urlCount,
    @JsonProperty("urls")            List<UrlAttribution> urls,
    @JsonProperty("computedAt")      Instant computedAt
) {}
