package com.serpintel.common.validation;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Parses capture timestamps. An explicit offset ({@code Z} or {@code +hh:mm})
 * is mandatory; date-only and zone-less values are rejected.
 */
public final class Timestamps {

    private static final Pattern ISO_8601_WITH_OFFSET = Pattern.compile(
        "^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}(\\.\\d{1,9})?(Z|[+-]\\d{2}:\\d{2})$");

    private Timestamps() {}

    public static Instant parseWithOffset(String raw, String name) {
        if (raw == null || !ISO_8601_WITH_OFFSET.matcher(raw).matches()) {
            throw new InvalidParameterException(ErrorCode.INVALID_TIMESTAMP, name,
                name + " must be an ISO 8601 datetime with a timezone offset");
        }
        try {
            return OffsetDateTime.parse(raw, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidParameterException(ErrorCode.INVALID_TIMESTAMP, name,
                name + " must be an ISO 8601 datetime with a timezone offset", e);
        }
    }
}
