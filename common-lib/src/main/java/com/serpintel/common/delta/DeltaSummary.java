package com.serpintel.common.delta;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeltaSummary(
    @JsonProperty("moved_count")     int movedCount,
    @JsonProperty("entered_count")   int enteredCount,
    @JsonProperty("exited_count")    int exitedCount,
    @JsonProperty("improved_count")  int improvedCount,
    @JsonProperty("declined_count")  int declinedCount,
    @JsonProperty("unchanged_count") int unchangedCount
) {}
