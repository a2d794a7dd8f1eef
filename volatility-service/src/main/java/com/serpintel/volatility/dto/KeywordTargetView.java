package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record KeywordTargetView(
    @JsonProperty("id")        UUID    id,
    @JsonProperty("query")     String  query,
    @JsonProperty("locale")    String  locale,
    @JsonProperty("device")    String  device,
    @JsonProperty("isPrimary") boolean isPrimary,
    @JsonProperty("intent")    String  intent,
    @JsonProperty("notes")     String  notes,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("updatedAt") Instant updatedAt
) {}
