package com.serpintel.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Qualitative volatility tier derived from a 0-100 score, ordered from
 * least to most volatile. {@link #ordinal()} is the escalation level.
 */
public enum VolatilityRegime {
    CALM,
    SHIFTING,
    UNSTABLE,
    CHAOTIC;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
