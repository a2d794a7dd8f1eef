package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * One point of a keyword's SERP time series. {@code rawPayload} is only
 * serialized when the caller asked for it.
 */
public record SerpHistoryItem(
    @JsonProperty("snapshotId")          UUID snapshotId,
    @JsonProperty("capturedAt")          Instant capturedAt,
    @JsonProperty("aiOverviewStatus")    String aiOverviewStatus,
    @JsonProperty("payloadParseWarning") boolean payloadParseWarning,
    @JsonProperty("topResults")          List<TopResult> topResults,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("rawPayload")          JsonNode rawPayload
) {
    public record TopResult(
        @JsonProperty("rank") Integer rank,
        @JsonProperty("url")  String url
    ) {}
}
