package com.serpintel.common.exception;

/**
 * A request parameter or body field failed validation. Raised before any
 * snapshot is loaded.
 */
public class InvalidParameterException extends VolatilityException {

    private final String field;

    public InvalidParameterException(ErrorCode code, String field, String message) {
        super(code, message);
        this.field = field;
    }

    public InvalidParameterException(ErrorCode code, String field, String message, Throwable cause) {
        super(code, message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
