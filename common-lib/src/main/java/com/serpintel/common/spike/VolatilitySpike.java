package com.serpintel.common.spike;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record VolatilitySpike(
    @JsonProperty("fromSnapshotId")         UUID    fromSnapshotId,
    @JsonProperty("toSnapshotId")           UUID    toSnapshotId,
    @JsonProperty("fromCapturedAt")         Instant fromCapturedAt,
    @JsonProperty("toCapturedAt")           Instant toCapturedAt,
    @JsonProperty("pairVolatilityScore")    double  pairVolatilityScore,
    @JsonProperty("pairRankShift")          double  pairRankShift,
    @JsonProperty("pairMaxShift")           int     pairMaxShift,
    @JsonProperty("pairFeatureChangeCount") int     pairFeatureChangeCount,
    @JsonProperty("aiFlipped")              boolean aiFlipped
) {}
