package com.serpintel.volatility.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Error envelope: {@code {error: {code, message, details?}}}.
 */
public record ApiError(@JsonProperty("error") Body error) {

    public static ApiError of(String code, String message) {
        return new ApiError(new Body(code, message, null));
    }

    public static ApiError of(String code, String message, List<Detail> details) {
        return new ApiError(new Body(code, message, details));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Body(
        @JsonProperty("code")    String code,
        @JsonProperty("message") String message,
        @JsonProperty("details") List<Detail> details
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Detail(
        @JsonProperty("code")    String code,
        @JsonProperty("field")   String field,
        @JsonProperty("message") String message
    ) {}
}
