package com.serpintel.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One organic result extracted from a snapshot payload. {@code rank} is null
 * when the payload carried no usable position; such results never feed
 * rank-shift metrics.
 */
public record RankedResult(
    @JsonProperty("url")    String  url,
    @JsonProperty("domain") String  domain,
    @JsonProperty("rank")   Integer rank,
    @JsonProperty("title")  String  title
) {
    public boolean ranked() {
        return rank != null;
    }
}
