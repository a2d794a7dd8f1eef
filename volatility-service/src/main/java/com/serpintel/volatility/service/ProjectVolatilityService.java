package com.serpintel.volatility.service;

import com.serpintel.common.alert.KeywordSeries;
import com.serpintel.common.model.SnapshotObservation;
import com.serpintel.common.model.VolatilityMaturity;
import com.serpintel.common.pagination.ScoreCursor;
import com.serpintel.common.risk.KeywordVolatility;
import com.serpintel.common.risk.ProjectRiskAggregator;
import com.serpintel.common.risk.ProjectRiskSummary;
import com.serpintel.common.scoring.VolatilityAggregator;
import com.serpintel.common.scoring.VolatilityProfile;
import com.serpintel.common.window.WindowSelector;
import com.serpintel.volatility.dto.ItemsPage;
import com.serpintel.volatility.dto.VolatilityAlertItem;
import com.serpintel.volatility.dto.VolatilitySummaryResponse;
import com.serpintel.volatility.model.KeywordTarget;
import com.serpintel.volatility.model.SerpSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Project-wide reads: the risk summary and the paged list of keywords whose
 * volatility crosses a threshold. Both load every target and the windowed
 * snapshots of the project in two queries, then group in memory.
 */
@Service
public class ProjectVolatilityService {

    private static final Logger log = LoggerFactory.getLogger(ProjectVolatilityService.class);

    private final KeywordTargetService      keywordTargetService;
    private final SerpSnapshotService       snapshotService;
    private final SnapshotObservationMapper mapper;
    private final Clock                     clock;

    public ProjectVolatilityService(KeywordTargetService keywordTargetService,
                                    SerpSnapshotService snapshotService,
                                    SnapshotObservationMapper mapper,
                                    Clock clock) {
        this.keywordTargetService = keywordTargetService;
        this.snapshotService      = snapshotService;
        this.mapper               = mapper;
        this.clock                = clock;
    }

    public Mono<VolatilitySummaryResponse> summary(UUID projectId, Integer windowDays) {
        Instant requestTime = clock.instant();
        return series(projectId, windowDays, requestTime).map(series -> {
            ProjectRiskSummary summary = ProjectRiskAggregator.summarize(profiles(series));
            log.info("Volatility summary computed. projectId={} windowDays={} keywords={} active={} concentration={}",
                     projectId, windowDays, summary.keywordCount(), summary.activeKeywordCount(),
                     summary.volatilityConcentrationRatio());
            return VolatilitySummaryResponse.of(windowDays, summary, requestTime);
        });
    }

    /**
     * Keywords with at least one pair, maturity at or above {@code minMaturity}
     * and a score at or above {@code alertThreshold}, riskiest first.
     *
     * @param cursor position after which the page starts, or null for the first page
     */
    public Mono<ItemsPage<VolatilityAlertItem>> volatilityAlerts(UUID projectId, Integer windowDays,
                                                                int alertThreshold,
                                                                VolatilityMaturity minMaturity,
                                                                ScoreCursor cursor, int limit) {
        Instant requestTime = clock.instant();
        return series(projectId, windowDays, requestTime).map(series -> {
            List<KeywordVolatility> matching = new ArrayList<>();
            for (KeywordVolatility k : profiles(series)) {
                VolatilityProfile p = k.profile();
                if (p.sampleSize() >= 1
                        && p.maturity().isAtLeast(minMaturity)
                        && p.volatilityScore() >= alertThreshold) {
                    matching.add(k);
                }
            }
            matching.sort(ProjectRiskAggregator.RISK_ORDER);

            int start = 0;
            if (cursor != null) {
                start = matching.size();
                for (int i = 0; i < matching.size(); i++) {
                    KeywordVolatility k = matching.get(i);
                    if (cursor.precedes(k.score(), k.query(), k.keywordTargetId())) {
                        start = i;
                        break;
                    }
                }
            }
            int end = Math.min(start + limit, matching.size());
            List<VolatilityAlertItem> page = new ArrayList<>(end - start);
            for (KeywordVolatility k : matching.subList(start, end)) {
                page.add(toItem(k, alertThreshold));
            }
            String next = null;
            if (end < matching.size()) {
                KeywordVolatility last = matching.get(end - 1);
                next = new ScoreCursor(last.score(), last.query(), last.keywordTargetId()).encode();
            }
            log.debug("Volatility alerts listed. projectId={} matching={} returned={} hasMore={}",
                      projectId, matching.size(), page.size(), next != null);
            return new ItemsPage<>(page, next);
        });
    }

    /**
     * Every keyword target of the project with its windowed snapshots. Targets
     * without snapshots get an empty window.
     */
    Mono<List<KeywordSeries>> series(UUID projectId, Integer windowDays, Instant requestTime) {
        Instant windowStart = WindowSelector.windowStart(requestTime, windowDays);
        Mono<List<KeywordTarget>> targets = keywordTargetService.findAll(projectId).collectList();
        Mono<Map<String, List<SnapshotObservation>>> snapshots = snapshotService
            .projectWindow(projectId, windowStart)
            .collectList()
            .map(this::groupByKey);

        return Mono.zip(targets, snapshots).map(t -> {
            List<KeywordSeries> out = new ArrayList<>(t.getT1().size());
            for (KeywordTarget target : t.getT1()) {
                List<SnapshotObservation> own = t.getT2().getOrDefault(key(target), List.of());
                out.add(new KeywordSeries(target.getId(), target.getQuery(), target.getLocale(),
                    target.getDevice(), WindowSelector.select(own, windowDays, requestTime)));
            }
            return out;
        });
    }

    static List<KeywordVolatility> profiles(List<KeywordSeries> series) {
        List<KeywordVolatility> out = new ArrayList<>(series.size());
        for (KeywordSeries s : series) {
            out.add(new KeywordVolatility(s.keywordTargetId(), s.query(), s.locale(), s.device(),
                VolatilityAggregator.compute(s.window().pairs())));
        }
        return out;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Map<String, List<SnapshotObservation>> groupByKey(List<SerpSnapshot> rows) {
        Map<String, List<SnapshotObservation>> byKey = new HashMap<>();
        for (SerpSnapshot row : rows) {
            String k = key(row.getQuery(), row.getLocale(), row.getDevice());
            byKey.computeIfAbsent(k, x -> new ArrayList<>()).add(mapper.toObservation(row));
        }
        return byKey;
    }

    private static String key(KeywordTarget t) {
        return key(t.getQuery(), t.getLocale(), t.getDevice());
    }

    private static String key(String query, String locale, String device) {
        return query + '\u0000' + locale + '\u0000' + device;
    }

    private static VolatilityAlertItem toItem(KeywordVolatility k, int alertThreshold) {
        VolatilityProfile p = k.profile();
        return new VolatilityAlertItem(
            k.keywordTargetId(), k.query(), k.locale(), k.device(),
            p.volatilityScore(), p.rankVolatilityComponent(), p.aiOverviewComponent(),
            p.featureVolatilityComponent(), p.maturity(), p.regime(), p.sampleSize(),
            alertThreshold, true);
    }
}
