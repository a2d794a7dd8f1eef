package com.serpintel.common.scoring;

import com.serpintel.common.model.SnapshotPair;
import com.serpintel.common.util.Numbers;

/**
 * Volatility of one consecutive snapshot pair.
 *
 * <p>The three {@code *Raw} contributions are already weighted and scaled to
 * 0-100; their sum is the unrounded pair score. Rounded accessors are what the
 * HTTP surface reports.
 *
 * @param pair               the scored pair
 * @param averageRankShift   mean absolute shift over every ranked URL of the pair
 * @param maxRankShift       largest single shift in the pair
 * @param featureChangeCount size of the symmetric difference of the feature sets
 * @param aiFlipped          AI overview status differs between the snapshots
 */
public record PairScore(
    SnapshotPair pair,
    double averageRankShift,
    int maxRankShift,
    int featureChangeCount,
    boolean aiFlipped,
    double rankComponentRaw,
    double aiComponentRaw,
    double featureComponentRaw
) {

    public double rawScore() {
        return Math.min(100.0, rankComponentRaw + aiComponentRaw + featureComponentRaw);
    }

    public double pairVolatilityScore() {
        return Numbers.round2(rawScore());
    }

    public double rankVolatilityComponent() {
        return Numbers.round2(rankComponentRaw);
    }

    public double aiOverviewComponent() {
        return Numbers.round2(aiComponentRaw);
    }

    public double featureVolatilityComponent() {
        return Numbers.round2(featureComponentRaw);
    }
}
