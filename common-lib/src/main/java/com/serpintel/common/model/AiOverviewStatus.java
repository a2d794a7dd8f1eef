package com.serpintel.common.model;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;

import java.util.Locale;

/**
 * AI overview state recorded with each snapshot. A flip is any change of
 * status between two consecutive snapshots.
 */
public enum AiOverviewStatus {
    PRESENT,
    ABSENT,
    PARSE_ERROR,
    UNKNOWN;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AiOverviewStatus fromWire(String raw) {
        if (raw != null) {
            for (AiOverviewStatus s : values()) {
                if (s.wireValue().equals(raw)) {
                    return s;
                }
            }
        }
        throw new InvalidParameterException(ErrorCode.INVALID_ENUM, "aiOverviewStatus",
            "aiOverviewStatus must be one of: present, absent, parse_error, unknown");
    }
}
