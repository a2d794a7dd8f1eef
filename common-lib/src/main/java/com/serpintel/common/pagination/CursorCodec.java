package com.serpintel.common.pagination;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Opaque cursor tokens: the sort-key parts joined with U+001F, UTF-8,
 * base64url without padding. A token that does not decode to the expected
 * number of non-empty parts is rejected with {@link ErrorCode#INVALID_CURSOR}.
 *
 * <p>No logging. No side-effects.
 */
public final class CursorCodec {

    private static final String  SEPARATOR      = "\u001F";
    private static final Pattern BASE64URL      = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final int     MAX_TOKEN_SIZE = 1024;

    private CursorCodec() {}

    public static String encode(String... parts) {
        String joined = String.join(SEPARATOR, parts);
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(joined.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws InvalidParameterException when the token is malformed
     */
    public static List<String> decode(String token, int expectedParts) {
        if (token == null || token.isEmpty() || token.length() > MAX_TOKEN_SIZE
                || !BASE64URL.matcher(token).matches()) {
            throw invalid(null);
        }
        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw invalid(e);
        }
        String[] parts = decoded.split(SEPARATOR, -1);
        if (parts.length != expectedParts || Arrays.stream(parts).anyMatch(String::isEmpty)) {
            throw invalid(null);
        }
        return List.of(parts);
    }

    static InvalidParameterException invalid(Throwable cause) {
        return new InvalidParameterException(ErrorCode.INVALID_CURSOR, "cursor", "cursor is invalid", cause);
    }
}
