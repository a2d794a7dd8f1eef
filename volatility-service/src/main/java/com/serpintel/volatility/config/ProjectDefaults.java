package com.serpintel.volatility.config;

import java.util.UUID;

/**
 * Project used when a request names none.
 */
public record ProjectDefaults(UUID id, String slug) {}
