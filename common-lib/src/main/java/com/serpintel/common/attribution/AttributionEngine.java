package com.serpintel.common.attribution;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.model.RankedResult;
import com.serpintel.common.model.SnapshotObservation;
import com.serpintel.common.model.SnapshotPair;
import com.serpintel.common.util.Numbers;
import com.serpintel.common.window.AnalysisWindow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-URL rank-shift breakdown over the pairs of a window.
 *
 * <p>Only ranked results count. A URL's shift in a pair is recorded only when
 * it is ranked in both snapshots of that pair. Output is sorted by
 * {@code totalAbsShift} descending, then url ascending (ordinal).
 *
 * <p>No logging. No side-effects.
 */
public final class AttributionEngine {

    public static final int MIN_TOP_N     = 1;
    public static final int MAX_TOP_N     = 50;
    public static final int DEFAULT_TOP_N = 20;

    private static final Comparator<UrlAttribution> ORDER = Comparator
        .comparingDouble(UrlAttribution::totalAbsShift).reversed()
        .thenComparing(UrlAttribution::url);

    private AttributionEngine() {}

    public static AttributionResult attribute(AnalysisWindow window, int topN) {
        if (topN < MIN_TOP_N || topN > MAX_TOP_N) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, "topN",
                "topN must be between " + MIN_TOP_N + " and " + MAX_TOP_N);
        }
        if (window.sampleSize() == 0) {
            return AttributionResult.empty();
        }

        Map<String, Accumulator> byUrl = new LinkedHashMap<>();

        // ── appearances and first/last seen, per snapshot ──────────────────
        for (SnapshotObservation s : window.snapshots()) {
            for (String url : rankMap(s).keySet()) {
                byUrl.computeIfAbsent(url, Accumulator::new).seen(s.capturedAt());
            }
        }

        // ── shifts, per pair ───────────────────────────────────────────────
        for (SnapshotPair pair : window.pairs()) {
            Map<String, Integer> from = rankMap(pair.from());
            Map<String, Integer> to   = rankMap(pair.to());
            for (Map.Entry<String, Integer> e : from.entrySet()) {
                Integer toRank = to.get(e.getKey());
                if (toRank != null) {
                    byUrl.get(e.getKey()).shift(Math.abs(e.getValue() - toRank));
                }
            }
        }

        List<UrlAttribution> all = new ArrayList<>(byUrl.size());
        for (Accumulator a : byUrl.values()) {
            all.add(a.toAttribution());
        }
        all.sort(ORDER);

        List<UrlAttribution> top = all.subList(0, Math.min(topN, all.size()));
        return new AttributionResult(window.sampleSize(), all.size(), List.copyOf(top));
    }

    private static Map<String, Integer> rankMap(SnapshotObservation s) {
        Map<String, Integer> ranks = new HashMap<>();
        for (RankedResult r : s.results()) {
            if (r.ranked()) {
                ranks.putIfAbsent(r.url(), r.rank());
            }
        }
        return ranks;
    }

    // ── accumulator ────────────────────────────────────────────────────────

    private static final class Accumulator {
        private final String url;
        private int     appearances;
        private long    totalAbsShift;
        private int     pairsBothPresent;
        private Instant firstSeen;
        private Instant lastSeen;

        Accumulator(String url) {
            this.url = url;
        }

        void seen(Instant at) {
            appearances++;
            if (firstSeen == null || at.isBefore(firstSeen)) {
                firstSeen = at;
            }
            if (lastSeen == null || at.isAfter(lastSeen)) {
                lastSeen = at;
            }
        }

        void shift(int abs) {
            totalAbsShift += abs;
            pairsBothPresent++;
        }

        UrlAttribution toAttribution() {
            double average = pairsBothPresent > 0
                ? Numbers.round2((double) totalAbsShift / pairsBothPresent)
                : 0.0;
            return new UrlAttribution(url, appearances, totalAbsShift, pairsBothPresent,
                average, firstSeen, lastSeen);
        }
    }
}
