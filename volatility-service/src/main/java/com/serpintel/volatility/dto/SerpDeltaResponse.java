package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.delta.SerpDelta;

import java.time.Instant;
import java.util.UUID;

/**
 * Response for GET /api/seo/serp-deltas. {@code delta} is null when fewer
 * than two snapshots exist.
 */
public record SerpDeltaResponse(
    @JsonProperty("delta")    SerpDelta delta,
    @JsonProperty("metadata") Metadata metadata
) {
    /**
     * {@code same_timestamp} and {@code payload_parse_warning} are omitted
     * when no delta was computed.
     */
    public record Metadata(
        @JsonProperty("keywordTargetId")        UUID keywordTargetId,
        @JsonProperty("query")                  String query,
        @JsonProperty("locale")                 String locale,
        @JsonProperty("device")                 String device,
        @JsonProperty("insufficient_snapshots") boolean insufficientSnapshots,
        @JsonProperty("snapshot_count")         int snapshotCount,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("same_timestamp")         Boolean sameTimestamp,
        @JsonInclude(JsonInclude.Include.NON_NULL)
        @JsonProperty("payload_parse_warning")  Boolean payloadParseWarning,
        @JsonProperty("from_snapshot")          SnapshotRef fromSnapshot,
        @JsonProperty("to_snapshot")            SnapshotRef toSnapshot
    ) {}

    public record SnapshotRef(
        @JsonProperty("id")               UUID id,
        @JsonProperty("capturedAt")       Instant capturedAt,
        @JsonProperty("aiOverviewStatus") String aiOverviewStatus,
        @JsonProperty("source")           String source
    ) {}
}
