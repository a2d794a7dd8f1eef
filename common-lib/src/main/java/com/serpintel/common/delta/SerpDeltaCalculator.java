package com.serpintel.common.delta;

import com.serpintel.common.model.RankedResult;
import com.serpintel.common.model.SnapshotObservation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure stateless comparison of two snapshots' organic results.
 *
 * <p>Ordering:
 * <ul>
 *   <li>moved: rank delta descending (nulls last), then url</li>
 *   <li>entered / exited: rank ascending (nulls last), then url</li>
 * </ul>
 *
 * <p>No logging. No side-effects.
 */
public final class SerpDeltaCalculator {

    private static final Comparator<RankedResult> BY_RANK = Comparator
        .comparing(RankedResult::rank, Comparator.nullsLast(Comparator.<Integer>naturalOrder()))
        .thenComparing(RankedResult::url);

    private static final Comparator<MovedResult> BY_DELTA = Comparator
        .comparing(MovedResult::rankDelta, Comparator.nullsLast(Comparator.<Integer>reverseOrder()))
        .thenComparing(MovedResult::url);

    private SerpDeltaCalculator() {}

    public static SerpDelta compute(SnapshotObservation from, SnapshotObservation to) {
        Map<String, RankedResult> fromMap = byUrl(from.results());
        Map<String, RankedResult> toMap   = byUrl(to.results());

        List<RankedResult> entered = new ArrayList<>();
        for (RankedResult r : toMap.values()) {
            if (!fromMap.containsKey(r.url())) {
                entered.add(r);
            }
        }
        entered.sort(BY_RANK);

        List<RankedResult> exited = new ArrayList<>();
        List<MovedResult>  moved  = new ArrayList<>();
        for (RankedResult f : fromMap.values()) {
            RankedResult t = toMap.get(f.url());
            if (t == null) {
                exited.add(f);
                continue;
            }
            Integer delta = f.rank() != null && t.rank() != null ? f.rank() - t.rank() : null;
            moved.add(new MovedResult(f.url(), t.domain() != null ? t.domain() : f.domain(),
                f.rank(), t.rank(), delta, t.title()));
        }
        exited.sort(BY_RANK);
        moved.sort(BY_DELTA);

        int improved = 0, declined = 0, unchanged = 0;
        for (MovedResult m : moved) {
            if (m.rankDelta() == null) {
                continue;
            }
            if (m.rankDelta() > 0) {
                improved++;
            } else if (m.rankDelta() < 0) {
                declined++;
            } else {
                unchanged++;
            }
        }

        AiOverviewChange ai = new AiOverviewChange(
            from.aiOverviewStatus() != to.aiOverviewStatus(),
            from.aiOverviewStatus().wireValue(),
            to.aiOverviewStatus().wireValue());

        return new SerpDelta(List.copyOf(moved), List.copyOf(entered), List.copyOf(exited), ai,
            new DeltaSummary(moved.size(), entered.size(), exited.size(), improved, declined, unchanged));
    }

    private static Map<String, RankedResult> byUrl(List<RankedResult> results) {
        Map<String, RankedResult> map = new LinkedHashMap<>();
        for (RankedResult r : results) {
            map.putIfAbsent(r.url(), r);
        }
        return map;
    }
}
