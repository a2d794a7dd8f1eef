package com.serpintel.volatility.service;

import com.serpintel.common.attribution.AttributionEngine;
import com.serpintel.common.attribution.AttributionResult;
import com.serpintel.common.model.SnapshotObservation;
import com.serpintel.common.scoring.PairScorer;
import com.serpintel.common.scoring.VolatilityAggregator;
import com.serpintel.common.scoring.VolatilityProfile;
import com.serpintel.common.spike.SpikeDetector;
import com.serpintel.common.spike.VolatilitySpike;
import com.serpintel.common.transition.TransitionMatrix;
import com.serpintel.common.transition.TransitionMatrixBuilder;
import com.serpintel.common.window.AnalysisWindow;
import com.serpintel.common.window.WindowSelector;
import com.serpintel.volatility.dto.FeatureTransitionsResponse;
import com.serpintel.volatility.dto.KeywordVolatilityResponse;
import com.serpintel.volatility.dto.VolatilityBreakdownResponse;
import com.serpintel.volatility.dto.VolatilitySpikesResponse;
import com.serpintel.volatility.model.KeywordTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Keyword-level volatility reads. Each call fixes one request time, loads the
 * target's windowed snapshots and runs the pure engine over them. Nothing is
 * cached or written.
 */
@Service
public class KeywordVolatilityService {

    private static final Logger log = LoggerFactory.getLogger(KeywordVolatilityService.class);

    private final KeywordTargetService      keywordTargetService;
    private final SerpSnapshotService       snapshotService;
    private final SnapshotObservationMapper mapper;
    private final Clock                     clock;

    public KeywordVolatilityService(KeywordTargetService keywordTargetService,
                                    SerpSnapshotService snapshotService,
                                    SnapshotObservationMapper mapper,
                                    Clock clock) {
        this.keywordTargetService = keywordTargetService;
        this.snapshotService      = snapshotService;
        this.mapper               = mapper;
        this.clock                = clock;
    }

    public Mono<KeywordVolatilityResponse> volatility(UUID projectId, UUID keywordTargetId,
                                                      Integer windowDays, int alertThreshold) {
        return load(projectId, keywordTargetId, windowDays).map(w -> {
            VolatilityProfile p = VolatilityAggregator.compute(w.window().pairs());
            boolean exceeds = p.hasSamples() && p.volatilityScore() >= alertThreshold;
            log.info("Volatility computed. keywordTargetId={} windowDays={} sampleSize={} score={} regime={}",
                     keywordTargetId, windowDays, p.sampleSize(), p.volatilityScore(), p.regime());
            KeywordTarget t = w.target();
            return new KeywordVolatilityResponse(
                t.getId(), t.getQuery(), t.getLocale(), t.getDevice(),
                windowDays, w.window().windowStart(), alertThreshold, exceeds,
                p.sampleSize(), w.window().snapshots().size(),
                p.averageRankShift(), p.maxRankShift(), p.featureVolatility(), p.aiOverviewChurn(),
                p.volatilityScore(), p.rankVolatilityComponent(), p.aiOverviewComponent(),
                p.featureVolatilityComponent(), p.regime(), p.maturity(), w.requestTime());
        });
    }

    public Mono<VolatilityBreakdownResponse> breakdown(UUID projectId, UUID keywordTargetId,
                                                       Integer windowDays, int topN) {
        return load(projectId, keywordTargetId, windowDays).map(w -> {
            AttributionResult result = AttributionEngine.attribute(w.window(), topN);
            log.debug("Breakdown computed. keywordTargetId={} urlCount={}", keywordTargetId, result.urlCount());
            KeywordTarget t = w.target();
            return new VolatilityBreakdownResponse(
                t.getId(), t.getQuery(), t.getLocale(), t.getDevice(), windowDays,
                result.sampleSize(), result.urlCount(), result.urls(), w.requestTime());
        });
    }

    public Mono<VolatilitySpikesResponse> spikes(UUID projectId, UUID keywordTargetId,
                                                 Integer windowDays, int topN) {
        return load(projectId, keywordTargetId, windowDays).map(w -> {
            int sampleSize = w.window().sampleSize();
            List<VolatilitySpike> spikes = SpikeDetector.detect(PairScorer.scoreAll(w.window().pairs()), topN);
            log.debug("Spikes computed. keywordTargetId={} sampleSize={} returned={}",
                      keywordTargetId, sampleSize, spikes.size());
            KeywordTarget t = w.target();
            return new VolatilitySpikesResponse(
                t.getId(), t.getQuery(), t.getLocale(), t.getDevice(), windowDays,
                sampleSize, sampleSize, topN, spikes, w.requestTime());
        });
    }

    public Mono<FeatureTransitionsResponse> featureTransitions(UUID projectId, UUID keywordTargetId,
                                                               Integer windowDays) {
        return load(projectId, keywordTargetId, windowDays).map(w -> {
            TransitionMatrix matrix = TransitionMatrixBuilder.build(w.window().pairs());
            log.debug("Feature transitions computed. keywordTargetId={} distinct={}",
                      keywordTargetId, matrix.distinctTransitionCount());
            KeywordTarget t = w.target();
            return new FeatureTransitionsResponse(
                t.getId(), t.getQuery(), t.getLocale(), t.getDevice(), windowDays,
                w.window().sampleSize(), matrix.totalTransitions(), matrix.distinctTransitionCount(),
                matrix.transitions(), w.requestTime());
        });
    }

    // ── loading ────────────────────────────────────────────────────────────

    private Mono<LoadedWindow> load(UUID projectId, UUID keywordTargetId, Integer windowDays) {
        Instant requestTime = clock.instant();
        Instant windowStart = WindowSelector.windowStart(requestTime, windowDays);
        return keywordTargetService.require(projectId, keywordTargetId)
            .flatMap(target -> snapshotService.keywordWindow(projectId, target, windowStart)
                .map(mapper::toObservation)
                .collectList()
                .map(observations -> new LoadedWindow(target,
                    select(observations, windowDays, requestTime), requestTime)))
            .doOnError(e -> log.warn("Keyword window load failed. keywordTargetId={} err={}",
                                     keywordTargetId, e.getMessage()));
    }

    private static AnalysisWindow select(List<SnapshotObservation> observations, Integer windowDays,
                                         Instant requestTime) {
        return WindowSelector.select(observations, windowDays, requestTime);
    }

    private record LoadedWindow(KeywordTarget target, AnalysisWindow window, Instant requestTime) {}
}
