package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.transition.FeatureTransition;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record FeatureTransitionsResponse(
    @JsonProperty("keywordTargetId")         UUID keywordTargetId,
    @JsonProperty("query")                   String query,
    @JsonProperty("locale")                  String locale,
    @JsonProperty("device")                  String device,
    @JsonProperty("windowDays")              Integer windowDays,
    @JsonProperty("sampleSize")              int sampleSize,
    @JsonProperty("totalTransitions")        int totalTransitions,
    @JsonProperty("distinctTransitionCount") int distinctTransitionCount,
    @JsonProperty("transitions")             List<FeatureTransition> transitions,
    @JsonProperty("computedAt")              Instant computedAt
) {}
