package com.serpintel.common.scoring;

import com.serpintel.common.classifier.MaturityClassifier;
import com.serpintel.common.classifier.VolatilityRegimeClassifier;
import com.serpintel.common.model.SnapshotPair;
import com.serpintel.common.util.Numbers;

import java.util.List;

/**
 * Reduces the scored pairs of a window into a {@link VolatilityProfile}.
 *
 * <p>The keyword score is the mean pair score. Components are the means of the
 * unrounded pair contributions, so they reconcile with the score after
 * rounding. Zero pairs yield {@link VolatilityProfile#empty()}.
 *
 * <p>No logging. No side-effects.
 */
public final class VolatilityAggregator {

    private VolatilityAggregator() {}

    public static VolatilityProfile aggregate(List<PairScore> pairScores) {
        int n = pairScores.size();
        if (n == 0) {
            return VolatilityProfile.empty();
        }

        double avgShiftSum = 0.0;
        int    maxShift    = 0;
        int    features    = 0;
        int    aiFlips     = 0;
        double rankSum     = 0.0;
        double aiSum       = 0.0;
        double featureSum  = 0.0;
        double scoreSum    = 0.0;

        for (PairScore p : pairScores) {
            avgShiftSum += p.averageRankShift();
            maxShift     = Math.max(maxShift, p.maxRankShift());
            features    += p.featureChangeCount();
            aiFlips     += p.aiFlipped() ? 1 : 0;
            rankSum     += p.rankComponentRaw();
            aiSum       += p.aiComponentRaw();
            featureSum  += p.featureComponentRaw();
            scoreSum    += p.rawScore();
        }

        double score = Numbers.round2(scoreSum / n);
        return new VolatilityProfile(
            n,
            Numbers.round(avgShiftSum / n, 4),
            maxShift,
            features,
            aiFlips,
            score,
            Numbers.round2(rankSum / n),
            Numbers.round2(aiSum / n),
            Numbers.round2(featureSum / n),
            VolatilityRegimeClassifier.classify(score),
            MaturityClassifier.classify(n));
    }

    /** Convenience: score then aggregate. */
    public static VolatilityProfile compute(List<SnapshotPair> pairs) {
        return aggregate(PairScorer.scoreAll(pairs));
    }
}
