package com.serpintel.common.delta;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.serpintel.common.model.RankedResult;

import java.util.List;

/**
 * Rank movement between two snapshots of one keyword target.
 */
public record SerpDelta(
    @JsonProperty("moved")       List<MovedResult>  moved,
    @JsonProperty("entered")     List<RankedResult> entered,
    @JsonProperty("exited")      List<RankedResult> exited,
    @JsonProperty("ai_overview") AiOverviewChange   aiOverview,
    @JsonProperty("summary")     DeltaSummary       summary
) {}
