package com.serpintel.common.alert;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.model.SnapshotObservation;
import com.serpintel.common.model.VolatilityRegime;
import com.serpintel.common.window.WindowSelector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.UUID;

import static com.serpintel.common.SnapshotFixtures.*;
import static com.serpintel.common.model.AiOverviewStatus.ABSENT;
import static com.serpintel.common.model.AiOverviewStatus.PRESENT;
import static org.junit.jupiter.api.Assertions.*;

class AlertEvaluatorTest {

    private static final UUID PROJECT = UUID.fromString("00000000-0000-4000-a000-000000000001");

    /** Calm pair followed by a 51-point pair. */
    private static KeywordSeries escalating(long keywordId, String query) {
        List<SnapshotObservation> snaps = List.of(
            snapshot(1, ABSENT, urls(1, 10)),
            snapshot(2, ABSENT, urls(1, 10)),
            snapshot(3, PRESENT, urls(11, 10), "f1", "f2", "f3", "f4", "f5"));
        return new KeywordSeries(id(keywordId), query, "en-US", "desktop",
            WindowSelector.select(snaps, null, BASE.plusSeconds(86_400)));
    }

    private static KeywordSeries flat(long keywordId, String query) {
        List<SnapshotObservation> snaps = List.of(snapshot(1, ABSENT, urls(1, 10)));
        return new KeywordSeries(id(keywordId), query, "en-US", "desktop",
            WindowSelector.select(snaps, null, BASE.plusSeconds(86_400)));
    }

    private static AlertParameters params(double spike, double concentration, int limit) {
        return new AlertParameters(7, spike, concentration, limit);
    }

    @Nested
    @DisplayName("evaluate() — triggers and ordering")
    class EvaluateTests {

        @Test
        @DisplayName("T3, T2, T1 emitted and ordered by severity")
        void allThreeTriggers() {
            AlertReport report = AlertEvaluator.evaluate(PROJECT,
                List.of(escalating(10, "running shoes")), params(50.0, 0.8, 100));

            assertEquals(3, report.totalAlerts());
            assertEquals(List.of(AlertTrigger.T3, AlertTrigger.T2, AlertTrigger.T1),
                report.alerts().stream().map(VolatilityAlert::triggerType).toList());

            ConcentrationAlert t3 = (ConcentrationAlert) report.alerts().get(0);
            assertEquals(1.0, t3.volatilityConcentrationRatio());
            assertEquals(PROJECT, t3.projectId());

            SpikeAlert t2 = (SpikeAlert) report.alerts().get(1);
            assertEquals(51.0, t2.pairVolatilityScore(), 1e-9);
            assertEquals(1.0, t2.exceedanceMargin(), 1e-9);
            assertEquals(id(3), t2.toSnapshotId());

            RegimeTransitionAlert t1 = (RegimeTransitionAlert) report.alerts().get(2);
            assertEquals(VolatilityRegime.CALM, t1.fromRegime());
            assertEquals(VolatilityRegime.UNSTABLE, t1.toRegime());
            assertEquals(4, t1.severityRank());
        }

        @Test
        @DisplayName("limit cuts the list but totalAlerts counts everything")
        void limit() {
            AlertReport report = AlertEvaluator.evaluate(PROJECT,
                List.of(escalating(10, "running shoes")), params(50.0, 0.8, 2));
            assertEquals(2, report.alertCount());
            assertEquals(3, report.totalAlerts());
        }

        @Test
        @DisplayName("spike threshold is strict: a pair at exactly the threshold does not fire")
        void strictSpike() {
            AlertReport report = AlertEvaluator.evaluate(PROJECT,
                List.of(escalating(10, "q")), params(51.0, 1.0, 100));
            assertEquals(List.of(AlertTrigger.T1),
                report.alerts().stream().map(VolatilityAlert::triggerType).toList());
        }

        @Test
        @DisplayName("no pairs anywhere → no alerts, T3 suppressed by null ratio")
        void noData() {
            AlertReport report = AlertEvaluator.evaluate(PROJECT,
                List.of(flat(1, "a"), flat(2, "b")), params(0.0, 0.0, 100));
            assertEquals(0, report.totalAlerts());
        }

        @Test
        @DisplayName("same severity and time → keyword id ascending")
        void tieBreakByKeyword() {
            AlertReport report = AlertEvaluator.evaluate(PROJECT,
                List.of(escalating(20, "b"), escalating(10, "a")), params(50.0, 1.0, 100));

            List<SpikeAlert> spikes = report.alerts().stream()
                .filter(a -> a instanceof SpikeAlert).map(a -> (SpikeAlert) a).toList();
            assertEquals(List.of(id(10), id(20)), spikes.stream().map(SpikeAlert::keywordTargetId).toList());
        }

        @Test
        @DisplayName("repeated evaluation is identical")
        void deterministic() {
            List<KeywordSeries> series = List.of(escalating(20, "b"), escalating(10, "a"));
            assertEquals(AlertEvaluator.evaluate(PROJECT, series, params(50.0, 0.5, 100)),
                         AlertEvaluator.evaluate(PROJECT, series, params(50.0, 0.5, 100)));
        }
    }

    @Nested
    @DisplayName("RegimeTransitionAlert.severityRank()")
    class SeverityTests {

        @ParameterizedTest(name = "{0} → {1} = {2}")
        @CsvSource({
            "CALM,     SHIFTING, 2",
            "SHIFTING, UNSTABLE, 3",
            "CALM,     UNSTABLE, 4",
            "UNSTABLE, CHAOTIC,  4",
            "SHIFTING, CHAOTIC,  5",
            "CALM,     CHAOTIC,  5",
            "CHAOTIC,  CALM,     1",
            "UNSTABLE, SHIFTING, 1"
        })
        void rank(VolatilityRegime from, VolatilityRegime to, int expected) {
            RegimeTransitionAlert a = new RegimeTransitionAlert(id(1), "q", from, to,
                id(2), id(3), BASE, BASE, 0.0);
            assertEquals(expected, a.severityRank());
        }
    }

    @Nested
    @DisplayName("AlertParameters — validation")
    class ParameterTests {

        @Test
        @DisplayName("windowDays 31 → OUT_OF_RANGE")
        void windowTooWide() {
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> new AlertParameters(31, 75.0, 0.8, 100));
            assertEquals(ErrorCode.OUT_OF_RANGE, e.getCode());
            assertEquals("windowDays", e.getField());
        }

        @Test
        @DisplayName("concentrationThreshold above 1 → OUT_OF_RANGE")
        void ratioTooHigh() {
            assertThrows(InvalidParameterException.class, () -> new AlertParameters(7, 75.0, 1.5, 100));
        }
    }
}
