package com.serpintel.common.attribution;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Rank-shift contribution of one URL across a window.
 *
 * @param appearances      windowed snapshots in which the URL is ranked
 * @param totalAbsShift    summed |shift| over pairs where the URL is ranked in both
 * @param pairsBothPresent pairs contributing to {@code totalAbsShift}
 * @param averageShift     {@code totalAbsShift / pairsBothPresent}, 0 when no such pair
 */
public record UrlAttribution(
    @JsonProperty("url")              String  url,
    @JsonProperty("appearances")      int     appearances,
    @JsonProperty("totalAbsShift")    double  totalAbsShift,
    @JsonProperty("pairsBothPresent") int     pairsBothPresent,
    @JsonProperty("averageShift")     double  averageShift,
    @JsonProperty("firstSeen")        Instant firstSeen,
    @JsonProperty("lastSeen")         Instant lastSeen
) {}
