package com.serpintel.common.exception;

/**
 * Root of the engine's unchecked exception hierarchy. Every subclass carries
 * an {@link ErrorCode} so the transport layer can map it without inspecting
 * messages.
 */
public abstract class VolatilityException extends RuntimeException {

    private final ErrorCode code;

    protected VolatilityException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected VolatilityException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
