package com.serpintel.common.risk;

import com.serpintel.common.scoring.VolatilityProfile;

import java.util.UUID;

/**
 * A keyword target together with its computed profile, the unit of
 * project-level aggregation.
 */
public record KeywordVolatility(
    UUID keywordTargetId,
    String query,
    String locale,
    String device,
    VolatilityProfile profile
) {
    public double score() {
        return profile.volatilityScore();
    }
}
