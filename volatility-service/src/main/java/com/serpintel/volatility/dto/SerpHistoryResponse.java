package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.UUID;

public record SerpHistoryResponse(
    @JsonProperty("keywordTargetId") UUID keywordTargetId,
    @JsonProperty("query")           String query,
    @JsonProperty("locale")          String locale,
    @JsonProperty("device")          String device,
    @JsonProperty("windowDays")      Integer windowDays,
    @JsonProperty("items")           List<SerpHistoryItem> items,
    @JsonProperty("nextCursor")      String nextCursor
) {}
