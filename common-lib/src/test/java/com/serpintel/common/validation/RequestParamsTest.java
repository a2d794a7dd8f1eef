package com.serpintel.common.validation;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RequestParamsTest {

    @Nested
    @DisplayName("uuid()")
    class UuidTests {

        @Test
        @DisplayName("valid v4 UUID parses")
        void valid() {
            assertEquals(UUID.fromString("3f2b9c1e-7a44-4d1b-9e0a-2c5d8f6b1a00"),
                RequestParams.uuid("3f2b9c1e-7a44-4d1b-9e0a-2c5d8f6b1a00", "id"));
        }

        @ParameterizedTest(name = "\"{0}\" → MALFORMED_ID")
        @ValueSource(strings = {"123", "not-a-uuid", "3f2b9c1e-7a44-4d1b-9e0a-2c5d8f6b1a0"})
        void malformed(String raw) {
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> RequestParams.uuid(raw, "id"));
            assertEquals(ErrorCode.MALFORMED_ID, e.getCode());
        }
    }

    @Nested
    @DisplayName("integer parsers")
    class IntTests {

        @Test
        @DisplayName("absent optional → null, absent with default → default")
        void absent() {
            assertNull(RequestParams.optionalInt(null, "windowDays", 1, 365));
            assertEquals(20, RequestParams.intOrDefault(null, "topN", 1, 50, 20));
        }

        @ParameterizedTest(name = "\"{0}\" → OUT_OF_RANGE")
        @ValueSource(strings = {"0", "366", "7.5", "abc", "-1", "99999999999999999999"})
        void rejected(String raw) {
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> RequestParams.optionalInt(raw, "windowDays", 1, 365));
            assertEquals(ErrorCode.OUT_OF_RANGE, e.getCode());
            assertEquals("windowDays", e.getField());
        }

        @Test
        @DisplayName("signed parser reports negatives as below the minimum")
        void signedNegative() {
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> RequestParams.signedIntOrDefault("-5", "alertThreshold", 0, 100, 60));
            assertEquals("alertThreshold must be >= 0", e.getMessage());
        }

        @Test
        @DisplayName("required parser rejects absence")
        void required() {
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> RequestParams.requiredInt(null, "windowDays", 1, 30));
            assertEquals(ErrorCode.VALIDATION_ERROR, e.getCode());
            assertEquals(30, RequestParams.requiredInt("30", "windowDays", 1, 30));
        }
    }

    @Nested
    @DisplayName("decimal and boolean parsers")
    class OtherTests {

        @Test
        @DisplayName("decimal within range parses; outside range is rejected")
        void decimal() {
            assertEquals(0.5, RequestParams.decimalOrDefault("0.5", "concentrationThreshold", 0, 1, 0.8));
            assertEquals(0.8, RequestParams.decimalOrDefault(null, "concentrationThreshold", 0, 1, 0.8));
            assertThrows(InvalidParameterException.class,
                () -> RequestParams.decimalOrDefault("1.01", "concentrationThreshold", 0, 1, 0.8));
            assertThrows(InvalidParameterException.class,
                () -> RequestParams.decimalOrDefault("NaN", "spikeThreshold", 0, 100, 75));
        }

        @Test
        @DisplayName("boolean accepts only true/false")
        void bool() {
            assertTrue(RequestParams.booleanOrDefault("true", "includePayload", false));
            assertFalse(RequestParams.booleanOrDefault(null, "includePayload", false));
            assertThrows(InvalidParameterException.class,
                () -> RequestParams.booleanOrDefault("yes", "includePayload", false));
        }
    }

    @Nested
    @DisplayName("Timestamps and QueryNormalizer")
    class TimestampTests {

        @Test
        @DisplayName("offset is applied")
        void offset() {
            assertEquals(Instant.parse("2025-01-01T10:00:00Z"),
                Timestamps.parseWithOffset("2025-01-01T12:00:00+02:00", "capturedAt"));
        }

        @ParameterizedTest(name = "\"{0}\" → INVALID_TIMESTAMP")
        @ValueSource(strings = {"2025-01-01", "2025-01-01T12:00:00", "yesterday", "2025-13-01T00:00:00Z"})
        void rejected(String raw) {
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> Timestamps.parseWithOffset(raw, "capturedAt"));
            assertEquals(ErrorCode.INVALID_TIMESTAMP, e.getCode());
        }

        @Test
        @DisplayName("queries are trimmed, collapsed and lower-cased")
        void normalize() {
            assertEquals("best running shoes", QueryNormalizer.normalize("  Best   Running\tShoes "));
        }
    }
}
