package com.serpintel.common.risk;

import com.serpintel.common.util.Numbers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pure stateless reduction of every keyword target of a project into a
 * {@link ProjectRiskSummary}.
 *
 * <p>Rules:
 * <ul>
 *   <li>active keyword: score &gt; 0</li>
 *   <li>weighted score: {@code Σ(score × sampleSize) / Σ sampleSize}, 0 without samples</li>
 *   <li>concentration: {@code Σ top-3 scores / Σ all scores}, 4 dp, null when the total is 0</li>
 *   <li>risk order: score descending, query ascending, id ascending</li>
 * </ul>
 *
 * <p>No logging. No side-effects.
 */
public final class ProjectRiskAggregator {

    public static final int TOP_RISK_COUNT = 3;

    public static final Comparator<KeywordVolatility> RISK_ORDER = Comparator
        .comparingDouble(KeywordVolatility::score).reversed()
        .thenComparing(KeywordVolatility::query)
        .thenComparing(KeywordVolatility::keywordTargetId, Comparator.comparing(Object::toString));

    private ProjectRiskAggregator() {}

    public static ProjectRiskSummary summarize(List<KeywordVolatility> keywords) {
        int keywordCount = keywords.size();

        int calm = 0, shifting = 0, unstable = 0, chaotic = 0;
        int preliminary = 0, developing = 0, stable = 0;
        double scoreSum    = 0.0;
        double maxScore    = 0.0;
        double weightedSum = 0.0;
        long   sampleSum   = 0;

        for (KeywordVolatility k : keywords) {
            double score = k.score();
            scoreSum    += score;
            maxScore     = Math.max(maxScore, score);
            weightedSum += score * k.profile().sampleSize();
            sampleSum   += k.profile().sampleSize();

            switch (k.profile().regime()) {
                case CALM     -> calm++;
                case SHIFTING -> shifting++;
                case UNSTABLE -> unstable++;
                case CHAOTIC  -> chaotic++;
            }
            switch (k.profile().maturity()) {
                case PRELIMINARY -> preliminary++;
                case DEVELOPING  -> developing++;
                case STABLE      -> stable++;
            }
        }

        List<KeywordVolatility> active = activeByRisk(keywords);
        List<KeywordVolatility> top3   = active.subList(0, Math.min(TOP_RISK_COUNT, active.size()));

        List<RiskKeyword> top3Risk = new ArrayList<>(top3.size());
        for (KeywordVolatility k : top3) {
            top3Risk.add(new RiskKeyword(k.keywordTargetId(), k.query(), k.score(), k.profile().regime()));
        }

        return new ProjectRiskSummary(
            keywordCount,
            active.size(),
            keywordCount > 0 ? Numbers.round2(scoreSum / keywordCount) : 0.0,
            maxScore,
            new RegimeDistribution(calm, shifting, unstable, chaotic),
            new MaturityDistribution(preliminary, developing, stable),
            sampleSum > 0 ? Numbers.round2(weightedSum / sampleSum) : 0.0,
            concentrationRatio(top3, scoreSum),
            List.copyOf(top3Risk));
    }

    /**
     * Keywords with a non-zero score, riskiest first.
     */
    public static List<KeywordVolatility> activeByRisk(List<KeywordVolatility> keywords) {
        List<KeywordVolatility> active = new ArrayList<>();
        for (KeywordVolatility k : keywords) {
            if (k.score() > 0.0) {
                active.add(k);
            }
        }
        active.sort(RISK_ORDER);
        return active;
    }

    static Double concentrationRatio(List<KeywordVolatility> top3, double total) {
        if (total <= 0.0) {
            return null;
        }
        double top3Sum = 0.0;
        for (KeywordVolatility k : top3) {
            top3Sum += k.score();
        }
        return Numbers.round(Math.min(1.0, top3Sum / total), 4);
    }
}
