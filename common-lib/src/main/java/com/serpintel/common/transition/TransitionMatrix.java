package com.serpintel.common.transition;

import java.util.List;

/**
 * @param totalTransitions equals the pair count; the counts always sum to it
 */
public record TransitionMatrix(int totalTransitions, List<FeatureTransition> transitions) {

    public int distinctTransitionCount() {
        return transitions.size();
    }
}
