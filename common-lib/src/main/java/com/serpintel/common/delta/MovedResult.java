package com.serpintel.common.delta;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A URL ranked in both snapshots. {@code rankDelta = rankFrom - rankTo}, so a
 * positive value is an improvement; null when either rank is unknown.
 */
public record MovedResult(
    @JsonProperty("url")        String  url,
    @JsonProperty("domain")     String  domain,
    @JsonProperty("rank_from")  Integer rankFrom,
    @JsonProperty("rank_to")    Integer rankTo,
    @JsonProperty("rank_delta") Integer rankDelta,
    @JsonProperty("title_to")   String  titleTo
) {}
