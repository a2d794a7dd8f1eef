package com.serpintel.common.model;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Device class a keyword target is tracked on. Wire values are lower-case.
 */
public enum Device {
    DESKTOP,
    MOBILE;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Device fromWire(String raw) {
        if (raw != null) {
            for (Device d : values()) {
                if (d.wireValue().equals(raw)) {
                    return d;
                }
            }
        }
        throw new InvalidParameterException(ErrorCode.INVALID_ENUM, "device",
            "device must be one of: desktop, mobile");
    }
}
