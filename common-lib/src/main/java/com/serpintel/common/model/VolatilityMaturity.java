package com.serpintel.common.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Confidence tier derived from the number of snapshot pairs behind a score.
 * Declaration order is the comparison order used by minimum-maturity filters.
 */
public enum VolatilityMaturity {
    PRELIMINARY,
    DEVELOPING,
    STABLE;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAtLeast(VolatilityMaturity other) {
        return ordinal() >= other.ordinal();
    }

    public static VolatilityMaturity fromWire(String raw) {
        if (raw != null) {
            for (VolatilityMaturity m : values()) {
                if (m.wireValue().equals(raw)) {
                    return m;
                }
            }
        }
        throw new InvalidParameterException(ErrorCode.INVALID_ENUM, "minMaturity",
            "minMaturity must be one of: preliminary, developing, stable");
    }
}
