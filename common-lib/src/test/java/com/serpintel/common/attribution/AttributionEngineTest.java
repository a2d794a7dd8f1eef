package com.serpintel.common.attribution;

import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.window.AnalysisWindow;
import com.serpintel.common.window.WindowSelector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.serpintel.common.SnapshotFixtures.*;
import static com.serpintel.common.model.AiOverviewStatus.ABSENT;
import static org.junit.jupiter.api.Assertions.*;

class AttributionEngineTest {

    private static AnalysisWindow window() {
        return WindowSelector.select(List.of(
            snapshot(1, ABSENT, List.of("a", "b", "c")),
            snapshot(2, ABSENT, List.of("b", "a", "c")),
            snapshot(3, ABSENT, List.of("a", "b", "d"))), null, BASE.plusSeconds(86_400));
    }

    @Nested
    @DisplayName("attribute()")
    class AttributeTests {

        @Test
        @DisplayName("sorted by total shift desc, url asc; averages over both-present pairs")
        void ordering() {
            AttributionResult r = AttributionEngine.attribute(window(), 20);

            assertEquals(2, r.sampleSize());
            assertEquals(4, r.urlCount());
            assertEquals(List.of("a", "b", "c", "d"), r.urls().stream().map(UrlAttribution::url).toList());

            UrlAttribution a = r.urls().get(0);
            assertEquals(3, a.appearances());
            assertEquals(2.0, a.totalAbsShift());
            assertEquals(2, a.pairsBothPresent());
            assertEquals(1.0, a.averageShift());
            assertEquals(BASE.plusSeconds(3_600), a.firstSeen());
            assertEquals(BASE.plusSeconds(3 * 3_600), a.lastSeen());

            UrlAttribution c = r.urls().get(2);
            assertEquals(2, c.appearances());
            assertEquals(1, c.pairsBothPresent());
            assertEquals(0.0, c.averageShift());

            UrlAttribution d = r.urls().get(3);
            assertEquals(0, d.pairsBothPresent());
            assertEquals(0.0, d.averageShift());
        }

        @Test
        @DisplayName("topN cuts the list but urlCount stays the distinct total")
        void topN() {
            AttributionResult r = AttributionEngine.attribute(window(), 2);
            assertEquals(2, r.urls().size());
            assertEquals(4, r.urlCount());
        }

        @Test
        @DisplayName("zero samples → empty")
        void empty() {
            AnalysisWindow one = WindowSelector.select(
                List.of(snapshot(1, ABSENT, List.of("a"))), null, BASE);
            assertEquals(AttributionResult.empty(), AttributionEngine.attribute(one, 20));
        }

        @Test
        @DisplayName("topN outside 1-50 → OUT_OF_RANGE")
        void topNRange() {
            assertThrows(InvalidParameterException.class, () -> AttributionEngine.attribute(window(), 0));
            assertThrows(InvalidParameterException.class, () -> AttributionEngine.attribute(window(), 51));
        }
    }
}
