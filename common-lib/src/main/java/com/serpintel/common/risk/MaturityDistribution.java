package com.serpintel.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MaturityDistribution(
    @JsonProperty("preliminary") int preliminary,
    @JsonProperty("developing")  int developing,
    @JsonProperty("stable")      int stable
) {
    public int total() {
        return preliminary + developing + stable;
    }
}
