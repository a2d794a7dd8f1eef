package com.serpintel.common.alert;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.model.VolatilityRegime;

import java.time.Instant;
import java.util.UUID;

/**
 * T1: the most recent pair of a keyword landed in a different regime than the
 * pair before it. Snapshot fields describe the most recent pair.
 */
public record RegimeTransitionAlert(
    @JsonProperty("keywordTargetId")     UUID keywordTargetId,
    @JsonProperty("query")               String query,
    @JsonProperty("fromRegime")          VolatilityRegime fromRegime,
    @JsonProperty("toRegime")            VolatilityRegime toRegime,
    @JsonProperty("fromSnapshotId")      UUID fromSnapshotId,
    @JsonProperty("toSnapshotId")        UUID toSnapshotId,
    @JsonProperty("fromCapturedAt")      Instant fromCapturedAt,
    @JsonProperty("toCapturedAt")        Instant toCapturedAt,
    @JsonProperty("pairVolatilityScore") double pairVolatilityScore
) implements VolatilityAlert {

    @Override
    @JsonProperty("triggerType")
    public AlertTrigger triggerType() {
        return AlertTrigger.T1;
    }

    /**
     * De-escalations rank 1. Escalations rank by destination and jump size:
     * calm→shifting 2, shifting→unstable 3, calm→unstable 4,
     * unstable→chaotic 4, any larger jump to chaotic 5.
     */
    @Override
    public int severityRank() {
        int from = fromRegime.ordinal();
        int to   = toRegime.ordinal();
        if (to <= from) {
            return 1;
        }
        int jump = to - from;
        return switch (toRegime) {
            case CHAOTIC  -> jump >= 2 ? 5 : 4;
            case UNSTABLE -> jump == 2 ? 4 : 3;
            default       -> 2;
        };
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
