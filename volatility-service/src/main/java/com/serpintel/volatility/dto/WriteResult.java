package com.serpintel.volatility.dto;

/**
 * Outcome of an idempotent write: {@code created} is false when an existing
 * record was returned instead.
 */
public record WriteResult<T>(T value, boolean created) {}
