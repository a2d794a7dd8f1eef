package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record SerpSnapshotView(
    @JsonProperty("id")               UUID    id,
    @JsonProperty("query")            String  query,
    @JsonProperty("locale")           String  locale,
    @JsonProperty("device")           String  device,
    @JsonProperty("capturedAt")       Instant capturedAt,
    @JsonProperty("validAt")          Instant validAt,
    @JsonProperty("aiOverviewStatus") String  aiOverviewStatus,
    @JsonProperty("source")           String  source,
    @JsonProperty("batchRef")         String  batchRef,
    @JsonProperty("createdAt")        Instant createdAt
) {}
