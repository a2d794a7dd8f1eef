package com.serpintel.common.delta;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AiOverviewChange(
    @JsonProperty("changed") boolean changed,
    @JsonProperty("from")    String  from,
    @JsonProperty("to")      String  to
) {}
