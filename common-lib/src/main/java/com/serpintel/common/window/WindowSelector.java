package com.serpintel.common.window;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.model.SnapshotObservation;
import com.serpintel.common.model.SnapshotPair;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Filters a snapshot sequence to a trailing window and forms consecutive
 * pairs. The window start is derived once from the caller's request time so
 * every computation of one request shares the same boundary.
 *
 * <p>No logging. No side-effects.
 */
public final class WindowSelector {

    public static final int MIN_WINDOW_DAYS = 1;
    public static final int MAX_WINDOW_DAYS = 365;

    /**
     * Capture order: capturedAt ASC, then id ASC by canonical text (the order
     * PostgreSQL applies to uuid columns).
     */
    public static final Comparator<SnapshotObservation> CAPTURE_ORDER = Comparator
        .comparing(SnapshotObservation::capturedAt)
        .thenComparing(s -> s.id().toString());

    private WindowSelector() {}

    /**
     * Inclusive start of a trailing window.
     *
     * @return {@code null} when {@code windowDays} is null (unbounded)
     */
    public static Instant windowStart(Instant requestTime, Integer windowDays) {
        if (windowDays == null) {
            return null;
        }
        return requestTime.minus(Duration.ofDays(windowDays));
    }

    /**
     * Select and pair.
     *
     * @param snapshots   snapshots of one keyword target, any order
     * @param windowDays  1-365, or null for all history
     * @param requestTime the fixed "now" of the current request
     * @throws InvalidParameterException when windowDays is outside [1, 365]
     */
    public static AnalysisWindow select(List<SnapshotObservation> snapshots,
                                        Integer windowDays,
                                        Instant requestTime) {
        return select(snapshots, windowDays, MAX_WINDOW_DAYS, requestTime);
    }

    /**
     * Variant with a caller-specific upper bound (the alert surface accepts at
     * most 30 days).
     */
    public static AnalysisWindow select(List<SnapshotObservation> snapshots,
                                        Integer windowDays,
                                        int maxWindowDays,
                                        Instant requestTime) {
        if (windowDays != null && (windowDays < MIN_WINDOW_DAYS || windowDays > maxWindowDays)) {
            throw new InvalidParameterException(ErrorCode.OUT_OF_RANGE, "windowDays",
                "windowDays must be between " + MIN_WINDOW_DAYS + " and " + maxWindowDays);
        }
        Instant start = windowStart(requestTime, windowDays);

        List<SnapshotObservation> windowed = new ArrayList<>();
        for (SnapshotObservation s : snapshots) {
            if (start == null || !s.capturedAt().isBefore(start)) {
                windowed.add(s);
            }
        }
        windowed.sort(CAPTURE_ORDER);

        return new AnalysisWindow(windowDays, start, List.copyOf(windowed), pair(windowed));
    }

    /**
     * Consecutive pairs of an already ordered sequence.
     */
    public static List<SnapshotPair> pair(List<SnapshotObservation> ordered) {
        List<SnapshotPair> pairs = new ArrayList<>(Math.max(0, ordered.size() - 1));
        for (int i = 0; i + 1 < ordered.size(); i++) {
            pairs.add(new SnapshotPair(ordered.get(i), ordered.get(i + 1)));
        }
        return pairs;
    }
}
