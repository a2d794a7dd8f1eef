package com.serpintel.common.transition;

import com.serpintel.common.model.SnapshotPair;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tallies the feature-set transitions of a window's pairs.
 *
 * <p>Sorted by count descending, then the comma-joined from-set ascending,
 * then the comma-joined to-set ascending.
 *
 * <p>No logging. No side-effects.
 */
public final class TransitionMatrixBuilder {

    private static final Comparator<FeatureTransition> ORDER = Comparator
        .comparingInt(FeatureTransition::count).reversed()
        .thenComparing(FeatureTransition::fromKey)
        .thenComparing(FeatureTransition::toKey);

    private TransitionMatrixBuilder() {}

    public static TransitionMatrix build(List<SnapshotPair> pairs) {
        Map<Transition, Integer> counts = new LinkedHashMap<>();
        for (SnapshotPair pair : pairs) {
            Transition t = new Transition(List.copyOf(pair.from().features()), List.copyOf(pair.to().features()));
            counts.merge(t, 1, Integer::sum);
        }

        List<FeatureTransition> transitions = new ArrayList<>(counts.size());
        counts.forEach((t, count) -> transitions.add(new FeatureTransition(t.from(), t.to(), count)));
        transitions.sort(ORDER);

        return new TransitionMatrix(pairs.size(), List.copyOf(transitions));
    }

    private record Transition(List<String> from, List<String> to) {}
}
