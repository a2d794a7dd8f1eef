package com.serpintel.common.window;

import com.serpintel.common.model.SnapshotObservation;
import com.serpintel.common.model.SnapshotPair;

import java.time.Instant;
import java.util.List;

/**
 * Snapshots inside a trailing window, ascending, with their consecutive pairs.
 *
 * @param windowDays  requested window, or {@code null} for unbounded history
 * @param windowStart inclusive lower bound, or {@code null} when unbounded
 * @param snapshots   windowed snapshots ordered capturedAt ASC, id ASC
 * @param pairs       {@code snapshots.size() - 1} consecutive pairs (never negative)
 */
public record AnalysisWindow(
    Integer windowDays,
    Instant windowStart,
    List<SnapshotObservation> snapshots,
    List<SnapshotPair> pairs
) {
    public int sampleSize() {
        return pairs.size();
    }
}
