package com.serpintel.volatility.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.serpintel.common.extraction.ExtractionResult;
import com.serpintel.common.extraction.SerpPayloadExtractor;
import com.serpintel.common.model.RankedResult;
import com.serpintel.common.pagination.TimeCursor;
import com.serpintel.common.window.WindowSelector;
import com.serpintel.volatility.dto.SerpHistoryItem;
import com.serpintel.volatility.dto.SerpHistoryResponse;
import com.serpintel.volatility.model.KeywordTarget;
import com.serpintel.volatility.model.SerpSnapshot;
import com.serpintel.volatility.repository.SerpSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static com.serpintel.volatility.service.SnapshotObservationMapper.toInstant;
import static com.serpintel.volatility.service.SnapshotObservationMapper.toUtc;

/**
 * Newest-first time series of one keyword's snapshots.
 */
@Service
public class SerpHistoryService {

    private static final Logger log = LoggerFactory.getLogger(SerpHistoryService.class);

    private final KeywordTargetService      keywordTargetService;
    private final SerpSnapshotRepository    repository;
    private final SnapshotObservationMapper mapper;
    private final Clock                     clock;

    public SerpHistoryService(KeywordTargetService keywordTargetService,
                              SerpSnapshotRepository repository,
                              SnapshotObservationMapper mapper,
                              Clock clock) {
        this.keywordTargetService = keywordTargetService;
        this.repository           = repository;
        this.mapper               = mapper;
        this.clock                = clock;
    }

    public Mono<SerpHistoryResponse> history(UUID projectId, UUID keywordTargetId, Integer windowDays,
                                             TimeCursor cursor, int limit, int topN,
                                             boolean includePayload) {
        LocalDateTime since = SerpSnapshotService.since(WindowSelector.windowStart(clock.instant(), windowDays));
        return keywordTargetService.require(projectId, keywordTargetId)
            .flatMap(target -> page(projectId, target, since, cursor, limit)
                .collectList()
                .map(rows -> {
                    boolean hasMore = rows.size() > limit;
                    List<SerpSnapshot> pageRows = hasMore ? rows.subList(0, limit) : rows;
                    List<SerpHistoryItem> items = new ArrayList<>(pageRows.size());
                    for (SerpSnapshot row : pageRows) {
                        items.add(toItem(row, topN, includePayload));
                    }
                    String next = hasMore
                        ? SerpSnapshotService.cursorOf(pageRows.get(pageRows.size() - 1)).encode()
                        : null;
                    log.debug("SERP history page served. keywordTargetId={} items={} hasMore={}",
                              keywordTargetId, items.size(), hasMore);
                    return new SerpHistoryResponse(target.getId(), target.getQuery(), target.getLocale(),
                        target.getDevice(), windowDays, items, next);
                }));
    }

    private Flux<SerpSnapshot> page(UUID projectId, KeywordTarget t, LocalDateTime since,
                                    TimeCursor cursor, int limit) {
        if (cursor == null) {
            return repository.findHistoryFirstPage(projectId, t.getQuery(), t.getLocale(), t.getDevice(),
                since, limit + 1);
        }
        return repository.findHistoryPageBefore(projectId, t.getQuery(), t.getLocale(), t.getDevice(),
            since, toUtc(cursor.at()), cursor.id(), limit + 1);
    }

    private SerpHistoryItem toItem(SerpSnapshot row, int topN, boolean includePayload) {
        JsonNode payload = mapper.readPayload(row);
        ExtractionResult extraction = SerpPayloadExtractor.extractResults(payload);
        List<SerpHistoryItem.TopResult> top = new ArrayList<>(topN);
        for (RankedResult r : extraction.results()) {
            if (top.size() == topN) {
                break;
            }
            top.add(new SerpHistoryItem.TopResult(r.rank(), r.url()));
        }
        return new SerpHistoryItem(row.getId(), toInstant(row.getCapturedAt()), row.getAiOverviewStatus(),
            extraction.parseWarning(), top, includePayload ? payload : null);
    }
}
