package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request body for POST /api/seo/serp-snapshots. Timestamps stay raw strings
 * so that offset-less values can be rejected explicitly.
 */
public record RecordSnapshotRequest(
    @JsonProperty("query")                String   query,
    @JsonProperty("locale")               String   locale,
    @JsonProperty("device")               String   device,
    @JsonProperty("capturedAt")           String   capturedAt,
    @JsonProperty("validAt")              String   validAt,
    @JsonProperty("rawPayload")           JsonNode rawPayload,
    @JsonProperty("payloadSchemaVersion") String   payloadSchemaVersion,
    @JsonProperty("aiOverviewStatus")     String   aiOverviewStatus,
    @JsonProperty("aiOverviewText")       String   aiOverviewText,
    @JsonProperty("source")               String   source,
    @JsonProperty("batchRef")             String   batchRef
) {}
