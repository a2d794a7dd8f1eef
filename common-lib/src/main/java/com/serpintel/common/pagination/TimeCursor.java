package com.serpintel.common.pagination;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;

/**
 * Position in a list ordered by a timestamp with an id tie-break
 * (snapshot history, keyword-target and snapshot listings).
 */
public record TimeCursor(Instant at, UUID id) {

    public String encode() {
        return CursorCodec.encode(at.toString(), id.toString());
    }

    public static TimeCursor decode(String token) {
        List<String> parts = CursorCodec.decode(token, 2);
        try {
            return new TimeCursor(Instant.parse(parts.get(0)), UUID.fromString(parts.get(1)));
        } catch (DateTimeParseException | IllegalArgumentException e) {
            throw CursorCodec.invalid(e);
        }
    }
}
