package com.serpintel.volatility.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Success envelope: {@code {data, pagination?}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    @JsonProperty("data")       T data,
    @JsonProperty("pagination") Pagination pagination
) {
    public static <T> ApiResponse<T> of(T data) {
        return new ApiResponse<>(data, null);
    }

    public static <T> ApiResponse<T> paged(T data, Pagination pagination) {
        return new ApiResponse<>(data, pagination);
    }

    /**
     * Cursor pagination block. {@code nextCursor} is null on the last page.
     */
    public record Pagination(
        @JsonProperty("limit")      int limit,
        @JsonProperty("hasMore")    boolean hasMore,
        @JsonProperty("nextCursor") @JsonInclude(JsonInclude.Include.ALWAYS) String nextCursor
    ) {}
}
