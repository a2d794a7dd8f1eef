package com.serpintel.common.spike;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.model.SnapshotPair;
import com.serpintel.common.scoring.PairScore;
import com.serpintel.common.util.Numbers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks the pairs of a window by pair score and returns the most volatile.
 *
 * <p>The sort is stable on score descending only: equal scores keep their
 * chronological order. Returns {@code min(topN, pairs)} spikes.
 *
 * <p>No logging. No side-effects.
 */
public final class SpikeDetector {

    public static final int MIN_TOP_N     = 1;
    public static final int MAX_TOP_N     = 10;
    public static final int DEFAULT_TOP_N = 3;

    private SpikeDetector() {}

    /**
     * @param pairScores scored pairs in chronological order
     */
    public static List<VolatilitySpike> detect(List<PairScore> pairScores, int topN) {
        if (topN < MIN_TOP_N || topN > MAX_TOP_N) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, "topN",
                "topN must be between " + MIN_TOP_N + " and " + MAX_TOP_N);
        }

        // List.sort is a stable merge sort
        List<PairScore> ranked = new ArrayList<>(pairScores);
        ranked.sort(Comparator.comparingDouble(PairScore::pairVolatilityScore).reversed());

        List<VolatilitySpike> spikes = new ArrayList<>();
        for (PairScore p : ranked.subList(0, Math.min(topN, ranked.size()))) {
            spikes.add(toSpike(p));
        }
        return List.copyOf(spikes);
    }

    private static VolatilitySpike toSpike(PairScore p) {
        SnapshotPair pair = p.pair();
        return new VolatilitySpike(
            pair.from().id(),
            pair.to().id(),
            pair.from().capturedAt(),
            pair.to().capturedAt(),
            p.pairVolatilityScore(),
            Numbers.round(p.averageRankShift(), 4),
            p.maxRankShift(),
            p.featureChangeCount(),
            p.aiFlipped());
    }
}
