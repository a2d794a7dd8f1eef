package com.serpintel.common.exception;

/**
 * Machine-readable error categories surfaced in the error envelope.
 */
public enum ErrorCode {
    MALFORMED_ID,
    OUT_OF_RANGE,
    INVALID_ENUM,
    INVALID_CURSOR,
    INVALID_TIMESTAMP,
    VALIDATION_ERROR,
    NOT_FOUND,
    CONFLICT
}
