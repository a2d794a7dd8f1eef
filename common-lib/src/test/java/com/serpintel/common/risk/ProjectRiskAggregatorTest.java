package com.serpintel.common.risk;

import com.serpintel.common.classifier.MaturityClassifier;
import com.serpintel.common.classifier.VolatilityRegimeClassifier;
import com.serpintel.common.scoring.VolatilityProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.serpintel.common.SnapshotFixtures.id;
import static org.junit.jupiter.api.Assertions.*;

class ProjectRiskAggregatorTest {

    static KeywordVolatility keyword(int n, String query, double score, int sampleSize) {
        VolatilityProfile p = sampleSize == 0 ? VolatilityProfile.empty()
            : new VolatilityProfile(sampleSize, 0.0, 0, 0, 0, score, score, 0.0, 0.0,
                VolatilityRegimeClassifier.classify(score), MaturityClassifier.classify(sampleSize));
        return new KeywordVolatility(id(n), query, "en-US", "desktop", p);
    }

    @Nested
    @DisplayName("summarize() — concentration")
    class ConcentrationTests {

        @Test
        @DisplayName("all scores zero → ratio null, no active keywords")
        void zeroTotal() {
            ProjectRiskSummary s = ProjectRiskAggregator.summarize(List.of(
                keyword(1, "a", 0.0, 3), keyword(2, "b", 0.0, 0)));

            assertNull(s.volatilityConcentrationRatio());
            assertEquals(0, s.activeKeywordCount());
            assertTrue(s.top3RiskKeywords().isEmpty());
            assertEquals(0.0, s.weightedProjectVolatilityScore());
        }

        @Test
        @DisplayName("ratio = Σ top-3 / Σ all")
        void ratio() {
            ProjectRiskSummary s = ProjectRiskAggregator.summarize(List.of(
                keyword(1, "delta", 10.0, 1),
                keyword(2, "alpha", 50.0, 1),
                keyword(3, "beta",  10.0, 1),
                keyword(4, "gamma", 30.0, 1)));

            assertEquals(0.9, s.volatilityConcentrationRatio(), 0.01);
            assertEquals(List.of("alpha", "gamma", "beta"),
                s.top3RiskKeywords().stream().map(RiskKeyword::query).toList());
            assertEquals(25.0, s.averageVolatility());
            assertEquals(50.0, s.maxVolatility());
            assertEquals(25.0, s.weightedProjectVolatilityScore());
        }

        @Test
        @DisplayName("fewer than three active keywords → ratio 1")
        void singleActive() {
            ProjectRiskSummary s = ProjectRiskAggregator.summarize(List.of(keyword(1, "a", 42.0, 5)));
            assertEquals(1.0, s.volatilityConcentrationRatio());
        }
    }

    @Nested
    @DisplayName("summarize() — distributions")
    class DistributionTests {

        @Test
        @DisplayName("regime and maturity buckets both sum to keywordCount")
        void bucketsSum() {
            ProjectRiskSummary s = ProjectRiskAggregator.summarize(List.of(
                keyword(1, "a", 0.0, 0),
                keyword(2, "b", 35.0, 6),
                keyword(3, "c", 60.0, 25),
                keyword(4, "d", 90.0, 2)));

            assertEquals(4, s.keywordCount());
            assertEquals(new RegimeDistribution(1, 1, 1, 1), s.regimeDistribution());
            assertEquals(new MaturityDistribution(2, 1, 1), s.maturityDistribution());
            assertEquals(s.keywordCount(), s.regimeDistribution().total());
            assertEquals(s.keywordCount(), s.maturityDistribution().total());
        }

        @Test
        @DisplayName("weighted score favours keywords with more pairs")
        void weighted() {
            ProjectRiskSummary s = ProjectRiskAggregator.summarize(List.of(
                keyword(1, "a", 10.0, 9), keyword(2, "b", 100.0, 1)));
            assertEquals(19.0, s.weightedProjectVolatilityScore());
        }

        @Test
        @DisplayName("empty project → zeroed summary")
        void emptyProject() {
            ProjectRiskSummary s = ProjectRiskAggregator.summarize(List.of());
            assertEquals(0, s.keywordCount());
            assertEquals(0.0, s.averageVolatility());
            assertNull(s.volatilityConcentrationRatio());
        }
    }
}
