package com.serpintel.common.validation;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Strict parsing of raw query-string values. Every parser throws
 * {@link InvalidParameterException} on malformed or out-of-range input so that
 * validation finishes before any snapshot is read.
 */
public final class RequestParams {

    private static final Pattern UUID_RE = Pattern.compile(
        "^[0-9a-f]{8}-[0-9a-f]{4}-[1-5][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}$",
        Pattern.CASE_INSENSITIVE);

    private static final Pattern UNSIGNED_INT = Pattern.compile("^\\d+$");
    private static final Pattern SIGNED_INT   = Pattern.compile("^-?\\d+$");
    private static final Pattern DECIMAL      = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    private RequestParams() {}

    /**
     * Parse a UUID path or query value.
     */
    public static UUID uuid(String raw, String name) {
        if (raw == null || !UUID_RE.matcher(raw).matches()) {
            throw new InvalidParameterException(ErrorCode.MALFORMED_ID, name, name + " must be a valid UUID");
        }
        return UUID.fromString(raw);
    }

    public static boolean isUuid(String raw) {
        return raw != null && UUID_RE.matcher(raw).matches();
    }

    /**
     * Parse an optional non-negative integer in {@code [min, max]}.
     *
     * @return the value, or {@code null} when {@code raw} is absent
     */
    public static Integer optionalInt(String raw, String name, int min, int max) {
        if (raw == null) {
            return null;
        }
        return boundedInt(raw, UNSIGNED_INT, name, min, max);
    }

    public static int intOrDefault(String raw, String name, int min, int max, int defaultValue) {
        Integer value = optionalInt(raw, name, min, max);
        return value != null ? value : defaultValue;
    }

    /**
     * Same as {@link #intOrDefault} but accepts a leading minus sign so that
     * negative input is reported as out of range rather than malformed.
     */
    public static int signedIntOrDefault(String raw, String name, int min, int max, int defaultValue) {
        if (raw == null) {
            return defaultValue;
        }
        return boundedInt(raw, SIGNED_INT, name, min, max);
    }

    public static int requiredInt(String raw, String name, int min, int max) {
        if (raw == null) {
            throw new InvalidParameterException(ErrorCode.VALIDATION_ERROR, name, name + " is required");
        }
        return boundedInt(raw, UNSIGNED_INT, name, min, max);
    }

    public static double decimalOrDefault(String raw, String name, double min, double max, double defaultValue) {
        if (raw == null) {
            return defaultValue;
        }
        if (!DECIMAL.matcher(raw).matches()) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, name, name + " must be a number");
        }
        double n = Double.parseDouble(raw);
        if (n < min) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, name, name + " must be >= " + format(min));
        }
        if (n > max) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, name, name + " must be <= " + format(max));
        }
        return n;
    }

    public static boolean booleanOrDefault(String raw, String name, boolean defaultValue) {
        if (raw == null) {
            return defaultValue;
        }
        if ("true".equals(raw)) {
            return true;
        }
        if ("false".equals(raw)) {
            return false;
        }
        throw new InvalidParameterException(ErrorCode.VALIDATION_ERROR, name, name + " must be true or false");
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static int boundedInt(String raw, Pattern shape, String name, int min, int max) {
        if (!shape.matcher(raw).matches()) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, name, name + " must be an integer");
        }
        long n;
        try {
            n = Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, name, name + " must be <= " + max, e);
        }
        if (n < min) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, name, name + " must be >= " + min);
        }
        if (n > max) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, name, name + " must be <= " + max);
        }
        return (int) n;
    }

    private static String format(double d) {
        return d == Math.rint(d) ? String.valueOf((long) d) : String.valueOf(d);
    }
}
