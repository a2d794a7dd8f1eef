package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Page body whose cursor travels inside {@code data} rather than in the
 * pagination block.
 */
public record ItemsPage<T>(
    @JsonProperty("items")      List<T> items,
    @JsonProperty("nextCursor") String nextCursor
) {}
