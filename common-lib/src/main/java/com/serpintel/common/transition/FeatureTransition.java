package com.serpintel.common.transition;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One distinct feature-set transition and how many pairs made it. Both sets
 * are ascending.
 */
public record FeatureTransition(
    @JsonProperty("fromFeatureSet") List<String> fromFeatureSet,
    @JsonProperty("toFeatureSet")   List<String> toFeatureSet,
    @JsonProperty("count")          int count
) {

    @JsonIgnore
    public String fromKey() {
        return String.join(",", fromFeatureSet);
    }

    @JsonIgnore
    public String toKey() {
        return String.join(",", toFeatureSet);
    }
}
