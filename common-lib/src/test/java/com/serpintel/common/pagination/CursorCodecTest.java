package com.serpintel.common.pagination;

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

class CursorCodecTest {

    private static final UUID ID = UUID.fromString("3f2b9c1e-7a44-4d1b-9e0a-2c5d8f6b1a00");

    @Nested
    @DisplayName("decode() — malformed tokens")
    class MalformedTests {

        @ParameterizedTest(name = "\"{0}\" → INVALID_CURSOR")
        @ValueSource(strings = {"", "not a cursor", "%%%", "abc="})
        void rejected(String token) {
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> TimeCursor.decode(token));
            assertEquals(ErrorCode.INVALID_CURSOR, e.getCode());
            assertEquals("cursor", e.getField());
        }

        @Test
        @DisplayName("wrong number of parts → INVALID_CURSOR")
        void wrongArity() {
            String token = CursorCodec.encode("only-one-part");
            assertThrows(InvalidParameterException.class, () -> TimeCursor.decode(token));
        }

        @Test
        @DisplayName("right arity but unparseable parts → INVALID_CURSOR")
        void badParts() {
            String token = CursorCodec.encode("yesterday", "not-a-uuid");
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> TimeCursor.decode(token));
            assertEquals(ErrorCode.INVALID_CURSOR, e.getCode());
        }

        @Test
        @DisplayName("a score cursor is not a time cursor")
        void crossKind() {
            String token = new ScoreCursor(42.5, "shoes", ID).encode();
            assertThrows(InvalidParameterException.class, () -> TimeCursor.decode(token));
        }
    }

    @Test
    @DisplayName("tokens are url-safe and decode to the same position")
    void decodesOwnTokens() {
        TimeCursor at = new TimeCursor(Instant.parse("2025-01-02T03:04:05.123456Z"), ID);
        String token = at.encode();
        assertTrue(token.matches("^[A-Za-z0-9_-]+$"));
        assertEquals(at, TimeCursor.decode(token));

        ScoreCursor score = new ScoreCursor(61.25, "best running shoes", ID);
        assertEquals(score, ScoreCursor.decode(score.encode()));
    }

    @Nested
    @DisplayName("ScoreCursor.precedes()")
    class PrecedesTests {

        private final ScoreCursor cursor = new ScoreCursor(50.0, "m", ID);

        @Test
        @DisplayName("lower score sorts after")
        void lowerScore() {
            assertTrue(cursor.precedes(49.99, "a", ID));
            assertFalse(cursor.precedes(50.01, "z", ID));
        }

        @Test
        @DisplayName("equal score: later query sorts after")
        void queryTieBreak() {
            assertTrue(cursor.precedes(50.0, "n", ID));
            assertFalse(cursor.precedes(50.0, "l", ID));
        }

        @Test
        @DisplayName("the cursor row itself is not after")
        void selfExcluded() {
            assertFalse(cursor.precedes(50.0, "m", ID));
            assertTrue(cursor.precedes(50.0, "m", UUID.fromString("ffffffff-7a44-4d1b-9e0a-2c5d8f6b1a00")));
        }
    }
}
