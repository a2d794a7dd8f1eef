package com.serpintel.common.scoring;

import com.serpintel.common.model.RankedResult;
import com.serpintel.common.model.SnapshotObservation;
import com.serpintel.common.model.SnapshotPair;
import com.serpintel.common.util.Numbers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Pure stateless scorer for a single snapshot pair.
 *
 * <p>Three normalised sub-signals are weighted into a 0-100 score:
 * <ul>
 *   <li>rank movement: {@code 0.40 × avg/20 + 0.25 × max/50}</li>
 *   <li>AI overview flip: {@code 0.20 × (0|1)}</li>
 *   <li>feature churn: {@code 0.15 × changes/5}</li>
 * </ul>
 * Each sub-signal is clamped to [0, 1] before weighting.
 *
 * <p>A URL ranked in only one snapshot has entered or left the visible page.
 * Its shift is measured against rank {@code depth + 1}, where depth is the
 * larger ranked-result count of the two snapshots. Unranked results are
 * ignored.
 *
 * <p>No logging. No side-effects.
 */
public final class PairScorer {

    public static final double AVG_SHIFT_CAP      = 20.0;
    public static final double MAX_SHIFT_CAP      = 50.0;
    public static final double FEATURE_CHANGE_CAP = 5.0;

    public static final double AVG_SHIFT_WEIGHT = 0.40;
    public static final double MAX_SHIFT_WEIGHT = 0.25;
    public static final double AI_WEIGHT        = 0.20;
    public static final double FEATURE_WEIGHT   = 0.15;

    private PairScorer() {}

    public static PairScore score(SnapshotPair pair) {
        SnapshotObservation from = pair.from();
        SnapshotObservation to   = pair.to();

        // ── rank movement ──────────────────────────────────────────────────
        Map<String, Integer> fromRanks = rankMap(from.results());
        Map<String, Integer> toRanks   = rankMap(to.results());
        int outsideRank = Math.max(fromRanks.size(), toRanks.size()) + 1;

        List<Integer> shifts = new ArrayList<>();
        for (Map.Entry<String, Integer> e : fromRanks.entrySet()) {
            Integer toRank = toRanks.get(e.getKey());
            shifts.add(Math.abs(e.getValue() - (toRank != null ? toRank : outsideRank)));
        }
        for (Map.Entry<String, Integer> e : toRanks.entrySet()) {
            if (!fromRanks.containsKey(e.getKey())) {
                shifts.add(Math.abs(outsideRank - e.getValue()));
            }
        }

        double averageShift = shifts.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        int maxShift        = shifts.stream().mapToInt(Integer::intValue).max().orElse(0);

        // ── features and AI overview ───────────────────────────────────────
        int featureChanges = symmetricDifference(from.features(), to.features());
        boolean aiFlipped  = from.aiOverviewStatus() != to.aiOverviewStatus();

        double rankRaw = 100.0 * (AVG_SHIFT_WEIGHT * Numbers.normalizeToOne(averageShift, AVG_SHIFT_CAP)
                                + MAX_SHIFT_WEIGHT * Numbers.normalizeToOne(maxShift, MAX_SHIFT_CAP));
        double aiRaw      = 100.0 * AI_WEIGHT * (aiFlipped ? 1.0 : 0.0);
        double featureRaw = 100.0 * FEATURE_WEIGHT * Numbers.normalizeToOne(featureChanges, FEATURE_CHANGE_CAP);

        return new PairScore(pair, averageShift, maxShift, featureChanges, aiFlipped,
            rankRaw, aiRaw, featureRaw);
    }

    public static List<PairScore> scoreAll(List<SnapshotPair> pairs) {
        List<PairScore> scores = new ArrayList<>(pairs.size());
        for (SnapshotPair pair : pairs) {
            scores.add(score(pair));
        }
        return scores;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    /** First ranked occurrence of each URL. */
    static Map<String, Integer> rankMap(List<RankedResult> results) {
        Map<String, Integer> ranks = new LinkedHashMap<>();
        for (RankedResult r : results) {
            if (r.ranked()) {
                ranks.putIfAbsent(r.url(), r.rank());
            }
        }
        return ranks;
    }

    private static int symmetricDifference(Set<String> a, Set<String> b) {
        Set<String> union = new TreeSet<>(a);
        union.addAll(b);
        int shared = 0;
        for (String f : a) {
            if (b.contains(f)) {
                shared++;
            }
        }
        return union.size() - shared;
    }
}
