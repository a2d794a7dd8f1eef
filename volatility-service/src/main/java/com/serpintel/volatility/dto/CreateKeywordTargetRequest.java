package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/seo/keyword-targets.
 */
public record CreateKeywordTargetRequest(
    @JsonProperty("query")     String  query,
    @JsonProperty("locale")    String  locale,
    @JsonProperty("device")    String  device,
    @JsonProperty("isPrimary") Boolean isPrimary,
    @JsonProperty("intent")    String  intent,
    @JsonProperty("notes")     String  notes
) {}
