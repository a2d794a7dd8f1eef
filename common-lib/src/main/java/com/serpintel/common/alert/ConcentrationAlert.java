package com.serpintel.common.alert;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.risk.RiskKeyword;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * T3: project volatility concentration above threshold. Emitted at most once
 * per evaluation and never when the ratio is undefined.
 *
 * @param latestCapturedAt newest capture in the evaluated window; orders the
 *                         alert against keyword-level alerts
 */
public record ConcentrationAlert(
    @JsonProperty("projectId")                    UUID projectId,
    @JsonProperty("volatilityConcentrationRatio") double volatilityConcentrationRatio,
    @JsonProperty("threshold")                    double threshold,
    @JsonProperty("top3RiskKeywords")             List<RiskKeyword> top3RiskKeywords,
    @JsonProperty("activeKeywordCount")           int activeKeywordCount,
    @JsonIgnore                                   Instant latestCapturedAt
) implements VolatilityAlert {

    static final int SEVERITY = 7;

    @Override
    @JsonProperty("triggerType")
    public AlertTrigger triggerType() {
        return AlertTrigger.T3;
    }

    @Override
    public int severityRank() {
        return SEVERITY;
    }

    @Override
    public Instant sortCapturedAt() {
        return latestCapturedAt;
    }

    @Override
    public UUID sortKeywordTargetId() {
        return null;
    }

    @Override
    public UUID sortSnapshotId() {
        return null;
    }
}
