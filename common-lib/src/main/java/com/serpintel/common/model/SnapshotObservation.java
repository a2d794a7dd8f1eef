package com.serpintel.common.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Engine-side view of one captured SERP: everything the volatility
 * computations read, already extracted from the raw payload.
 *
 * @param id               snapshot id, used as the ordering tie-break
 * @param capturedAt       capture instant
 * @param aiOverviewStatus AI overview state at capture time
 * @param results          organic results, rank ascending with nulls last
 * @param features         non-organic feature tags, ascending
 * @param parseWarning     true when the payload structure was not recognised
 */
public record SnapshotObservation(
    UUID id,
    Instant capturedAt,
    AiOverviewStatus aiOverviewStatus,
    List<RankedResult> results,
    SortedSet<String> features,
    boolean parseWarning
) {
    public SnapshotObservation {
        results  = List.copyOf(results);
        features = Collections.unmodifiableSortedSet(new TreeSet<>(features));
    }
}
