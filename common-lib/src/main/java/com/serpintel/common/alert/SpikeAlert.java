package com.serpintel.common.alert;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * T2: one pair scored above the spike threshold.
 */
public record SpikeAlert(
    @JsonProperty("keywordTargetId")     UUID keywordTargetId,
    @JsonProperty("query")               String query,
    @JsonProperty("fromSnapshotId")      UUID fromSnapshotId,
    @JsonProperty("toSnapshotId")        UUID toSnapshotId,
    @JsonProperty("fromCapturedAt")      Instant fromCapturedAt,
    @JsonProperty("toCapturedAt")        Instant toCapturedAt,
    @JsonProperty("pairVolatilityScore") double pairVolatilityScore,
    @JsonProperty("threshold")           double threshold,
    @JsonProperty("exceedanceMargin")    double exceedanceMargin
) implements VolatilityAlert {

    static final int SEVERITY = 6;

    @Override
    @JsonProperty("triggerType")
    public AlertTrigger triggerType() {
        return AlertTrigger.T2;
    }

    @Override
    public int severityRank() {
        return SEVERITY;
    }

    @Override
    public Instant sortCapturedAt() {
        return toCapturedAt;
    }

    @Override
    public UUID sortKeywordTargetId() {
        return keywordTargetId;
    }

    @Override
    public UUID sortSnapshotId() {
        return toSnapshotId;
    }
}
