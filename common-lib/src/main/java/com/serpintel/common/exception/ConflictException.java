package com.serpintel.common.exception;

public class ConflictException extends VolatilityException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }
}
