package com.serpintel.common.alert;

import com.serpintel.common.classifier.VolatilityRegimeClassifier;
import com.serpintel.common.model.SnapshotObservation;
import com.serpintel.common.model.SnapshotPair;
import com.serpintel.common.model.VolatilityRegime;
import com.serpintel.common.risk.KeywordVolatility;
import com.serpintel.common.risk.ProjectRiskAggregator;
import com.serpintel.common.risk.ProjectRiskSummary;
import com.serpintel.common.scoring.PairScore;
import com.serpintel.common.scoring.PairScorer;
import com.serpintel.common.scoring.VolatilityAggregator;
import com.serpintel.common.util.Numbers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Compute-on-read alert scan over every keyword target of one project.
 *
 * <p>Triggers:
 * <ul>
 *   <li>T1: regime of the latest pair differs from the preceding pair (needs 2+ pairs)</li>
 *   <li>T2: pair score strictly above {@code spikeThreshold}, one per (keyword, toSnapshot)</li>
 *   <li>T3: concentration ratio strictly above {@code concentrationThreshold}, at most once</li>
 * </ul>
 *
 * <p>Order: severity descending, capture time descending, trigger ascending,
 * keyword id ascending (nulls last), to-snapshot id descending (nulls last).
 *
 * <p>No logging. No side-effects.
 */
public final class AlertEvaluator {

    private static final Comparator<UUID> UUID_TEXT = Comparator.comparing(UUID::toString);

    public static final Comparator<VolatilityAlert> ALERT_ORDER = Comparator
        .comparingInt(VolatilityAlert::severityRank).reversed()
        .thenComparing(VolatilityAlert::sortCapturedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
        .thenComparing(VolatilityAlert::triggerType)
        .thenComparing(VolatilityAlert::sortKeywordTargetId, Comparator.nullsLast(UUID_TEXT))
        .thenComparing(VolatilityAlert::sortSnapshotId, Comparator.nullsLast(UUID_TEXT.reversed()));

    private AlertEvaluator() {}

    public static AlertReport evaluate(UUID projectId, List<KeywordSeries> series, AlertParameters params) {
        List<VolatilityAlert>   alerts    = new ArrayList<>();
        List<KeywordVolatility> profiles  = new ArrayList<>(series.size());
        Set<String>             spikeKeys = new HashSet<>();
        Instant latestCapture = null;

        for (KeywordSeries s : series) {
            for (SnapshotObservation snap : s.window().snapshots()) {
                if (latestCapture == null || snap.capturedAt().isAfter(latestCapture)) {
                    latestCapture = snap.capturedAt();
                }
            }

            List<PairScore> scores = PairScorer.scoreAll(s.window().pairs());
            profiles.add(new KeywordVolatility(s.keywordTargetId(), s.query(), s.locale(), s.device(),
                VolatilityAggregator.aggregate(scores)));

            // ── T1 ─────────────────────────────────────────────────────────
            if (scores.size() >= 2) {
                PairScore last = scores.get(scores.size() - 1);
                PairScore prev = scores.get(scores.size() - 2);
                VolatilityRegime toRegime   = VolatilityRegimeClassifier.classify(last.pairVolatilityScore());
                VolatilityRegime fromRegime = VolatilityRegimeClassifier.classify(prev.pairVolatilityScore());
                if (toRegime != fromRegime) {
                    SnapshotPair p = last.pair();
                    alerts.add(new RegimeTransitionAlert(s.keywordTargetId(), s.query(), fromRegime, toRegime,
                        p.from().id(), p.to().id(), p.from().capturedAt(), p.to().capturedAt(),
                        last.pairVolatilityScore()));
                }
            }

            // ── T2 ─────────────────────────────────────────────────────────
            for (PairScore score : scores) {
                double pairScore = score.pairVolatilityScore();
                if (pairScore <= params.spikeThreshold()) {
                    continue;
                }
                SnapshotPair p = score.pair();
                if (spikeKeys.add(s.keywordTargetId() + "|" + p.to().id())) {
                    alerts.add(new SpikeAlert(s.keywordTargetId(), s.query(),
                        p.from().id(), p.to().id(), p.from().capturedAt(), p.to().capturedAt(),
                        pairScore, params.spikeThreshold(),
                        Numbers.round2(pairScore - params.spikeThreshold())));
                }
            }
        }

        // ── T3 ─────────────────────────────────────────────────────────────
        ProjectRiskSummary summary = ProjectRiskAggregator.summarize(profiles);
        Double ratio = summary.volatilityConcentrationRatio();
        if (ratio != null && ratio > params.concentrationThreshold()) {
            alerts.add(new ConcentrationAlert(projectId, ratio, params.concentrationThreshold(),
                summary.top3RiskKeywords(), summary.activeKeywordCount(), latestCapture));
        }

        alerts.sort(ALERT_ORDER);
        List<VolatilityAlert> page = alerts.subList(0, Math.min(params.limit(), alerts.size()));
        return new AlertReport(List.copyOf(page), alerts.size());
    }
}
