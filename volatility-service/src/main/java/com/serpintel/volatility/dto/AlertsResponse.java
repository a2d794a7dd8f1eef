package com.serpintel.volatility.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.alert.VolatilityAlert;

import java.time.Instant;
import java.util.List;

/**
 * Response for GET /api/seo/alerts.
 */
public record AlertsResponse(
    @JsonProperty("alerts")                 List<VolatilityAlert> alerts,
    @JsonProperty("alertCount")             int alertCount,
    @JsonProperty("totalAlerts")            int totalAlerts,
    @JsonProperty("windowDays")             int windowDays,
    @JsonProperty("spikeThreshold")         double spikeThreshold,
    @JsonProperty("concentrationThreshold") double concentrationThreshold,
    @JsonProperty("limit")                  int limit,
    @JsonProperty("computedAt")             Instant computedAt
) {}
