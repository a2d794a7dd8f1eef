package com.serpintel.common.spike;

import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.model.SnapshotPair;
import com.serpintel.common.scoring.PairScore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.serpintel.common.SnapshotFixtures.*;
import static com.serpintel.common.model.AiOverviewStatus.ABSENT;
import static org.junit.jupiter.api.Assertions.*;

class SpikeDetectorTest {

    private static PairScore scored(int n, double rankRaw) {
        SnapshotPair p = pair(snapshot(n, ABSENT, urls(1, 3)), snapshot(n + 1, ABSENT, urls(1, 3)));
        return new PairScore(p, 1.0, 2, 0, false, rankRaw, 0.0, 0.0);
    }

    @Test
    @DisplayName("score desc; equal scores keep chronological order")
    void stableOrder() {
        List<PairScore> scores = List.of(scored(1, 10.0), scored(2, 30.0), scored(3, 30.0), scored(4, 5.0));

        List<VolatilitySpike> spikes = SpikeDetector.detect(scores, 3);

        assertEquals(3, spikes.size());
        assertEquals(id(2), spikes.get(0).fromSnapshotId());
        assertEquals(id(3), spikes.get(1).fromSnapshotId());
        assertEquals(id(1), spikes.get(2).fromSnapshotId());
        assertEquals(30.0, spikes.get(0).pairVolatilityScore());
        assertEquals(id(3), spikes.get(0).toSnapshotId());
    }

    @Test
    @DisplayName("returns min(topN, pairs)")
    void fewerPairsThanTopN() {
        assertEquals(1, SpikeDetector.detect(List.of(scored(1, 10.0)), 10).size());
        assertTrue(SpikeDetector.detect(List.of(), 3).isEmpty());
    }

    @Test
    @DisplayName("topN outside 1-10 → OUT_OF_RANGE")
    void topNRange() {
        assertThrows(InvalidParameterException.class, () -> SpikeDetector.detect(List.of(), 0));
        assertThrows(InvalidParameterException.class, () -> SpikeDetector.detect(List.of(), 11));
    }
}
