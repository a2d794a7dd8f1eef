package com.serpintel.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RegimeDistribution(
    @JsonProperty("calm")     int calm,
    @JsonProperty("shifting") int shifting,
    @JsonProperty("unstable") int unstable,
    @JsonProperty("chaotic")  int chaotic
) {
    public int total() {
        return calm + shifting + unstable + chaotic;
    }
}
