package com.serpintel.volatility.web;

import com.serpintel.common.exception.ConflictException;
import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.List;

/**
 * Maps the exception taxonomy onto the HTTP error envelope. Client errors log
 * at WARN, anything unexpected at ERROR with the stack trace; internals never
 * reach the response body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidParameterException.class)
    public ResponseEntity<ApiError> handleInvalidParameter(InvalidParameterException e) {
        log.warn("Rejected request. code={} field={} message={}", e.getCode(), e.getField(), e.getMessage());
        ApiError.Detail detail = new ApiError.Detail(e.getCode().name(), e.getField(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiError.of("BAD_REQUEST", e.getMessage(), List.of(detail)));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(ResourceNotFoundException e) {
        log.warn("Resource not found. message={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(ApiError.of("NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiError> handleConflict(ConflictException e) {
        log.warn("Conflict. message={}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(ApiError.of("CONFLICT", e.getMessage()));
    }

    /** Unreadable JSON bodies and missing or mistyped bound parameters. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> handleInput(ServerWebInputException e) {
        String message = e.getReason() != null ? e.getReason() : "Invalid request";
        log.warn("Invalid request input. reason={}", message);
        ApiError.Detail detail = new ApiError.Detail(ErrorCode.VALIDATION_ERROR.name(), null, message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(ApiError.of("BAD_REQUEST", message, List.of(detail)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception e) {
        log.error("Unhandled exception", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiError.of("SERVER_ERROR", "Internal server error"));
    }
}
