package com.serpintel.volatility.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.model.AiOverviewStatus;
import com.serpintel.common.model.Device;
import com.serpintel.common.pagination.TimeCursor;
import com.serpintel.common.validation.QueryNormalizer;
import com.serpintel.common.validation.Timestamps;
import com.serpintel.volatility.dto.CursorPage;
import com.serpintel.volatility.dto.RecordSnapshotRequest;
import com.serpintel.volatility.dto.SerpSnapshotView;
import com.serpintel.volatility.dto.WriteResult;
import com.serpintel.volatility.model.KeywordTarget;
import com.serpintel.volatility.model.SerpSnapshot;
import com.serpintel.volatility.repository.SerpSnapshotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.serpintel.volatility.service.SnapshotObservationMapper.toInstant;
import static com.serpintel.volatility.service.SnapshotObservationMapper.toUtc;

/**
 * Append-only snapshot ledger. Recording the same natural key and capture
 * time twice returns the stored row instead of a duplicate.
 */
@Service
public class SerpSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(SerpSnapshotService.class);

    static final Set<String> VALID_SOURCES = Set.of("dataforseo");

    /** Lower bound used when a read has no window. */
    static final LocalDateTime UNBOUNDED = LocalDateTime.of(1970, 1, 1, 0, 0);

    private final SerpSnapshotRepository repository;
    private final ObjectMapper           objectMapper;
    private final Clock                  clock;

    public SerpSnapshotService(SerpSnapshotRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    public Mono<WriteResult<SerpSnapshotView>> record(UUID projectId, RecordSnapshotRequest request) {
        return Mono.fromCallable(() -> toEntity(projectId, request))
            .flatMap(entity -> findExisting(entity)
                .map(existing -> {
                    log.info("Snapshot replay, returning existing record. projectId={} id={} capturedAt={}",
                             projectId, existing.getId(), existing.getCapturedAt());
                    return new WriteResult<>(toView(existing), false);
                })
                .switchIfEmpty(Mono.defer(() -> insert(entity))));
    }

    /**
     * Windowed snapshots of one keyword target, oldest first.
     *
     * @param windowStart inclusive lower bound, or null for all history
     */
    public Flux<SerpSnapshot> keywordWindow(UUID projectId, KeywordTarget target, Instant windowStart) {
        return repository.findKeywordWindow(projectId, target.getQuery(), target.getLocale(),
            target.getDevice(), since(windowStart));
    }

    /**
     * Windowed snapshots of the whole project, oldest first.
     */
    public Flux<SerpSnapshot> projectWindow(UUID projectId, Instant windowStart) {
        return repository.findProjectWindow(projectId, since(windowStart));
    }

    public Mono<CursorPage<SerpSnapshotView>> list(UUID projectId, TimeCursor cursor, int limit) {
        Flux<SerpSnapshot> rows = cursor == null
            ? repository.findProjectFirstPage(projectId, limit + 1)
            : repository.findProjectPageBefore(projectId, toUtc(cursor.at()), cursor.id(), limit + 1);
        return rows.collectList().map(list -> {
            boolean hasMore = list.size() > limit;
            List<SerpSnapshot> page = hasMore ? list.subList(0, limit) : list;
            String next = hasMore ? cursorOf(page.get(page.size() - 1)).encode() : null;
            return new CursorPage<>(page.stream().map(SerpSnapshotService::toView).toList(), limit, next);
        });
    }

    static TimeCursor cursorOf(SerpSnapshot row) {
        return new TimeCursor(toInstant(row.getCapturedAt()), row.getId());
    }

    static LocalDateTime since(Instant windowStart) {
        return windowStart != null ? toUtc(windowStart) : UNBOUNDED;
    }

    // ── write path ─────────────────────────────────────────────────────────

    private Mono<SerpSnapshot> findExisting(SerpSnapshot e) {
        return repository.findByProjectIdAndQueryAndLocaleAndDeviceAndCapturedAt(
            e.getProjectId(), e.getQuery(), e.getLocale(), e.getDevice(), e.getCapturedAt());
    }

    /** A concurrent insert of the same key loses the race and returns the winner. */
    private Mono<WriteResult<SerpSnapshotView>> insert(SerpSnapshot entity) {
        return repository.save(entity)
            .map(saved -> {
                log.info("Snapshot recorded. projectId={} id={} query={} capturedAt={}",
                         saved.getProjectId(), saved.getId(), saved.getQuery(), saved.getCapturedAt());
                return new WriteResult<>(toView(saved), true);
            })
            .onErrorResume(DataIntegrityViolationException.class, e -> {
                log.debug("Snapshot insert raced an identical record. query={} capturedAt={}",
                          entity.getQuery(), entity.getCapturedAt());
                return findExisting(entity)
                    .map(existing -> new WriteResult<>(toView(existing), false))
                    .switchIfEmpty(Mono.error(e));
            });
    }

    private SerpSnapshot toEntity(UUID projectId, RecordSnapshotRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new InvalidParameterException(ErrorCode.VALIDATION_ERROR, "query", "query is required");
        }
        if (request.locale() == null || request.locale().isBlank()) {
            throw new InvalidParameterException(ErrorCode.VALIDATION_ERROR, "locale", "locale is required");
        }
        Device device = Device.fromWire(request.device());
        if (request.capturedAt() == null) {
            throw new InvalidParameterException(ErrorCode.VALIDATION_ERROR, "capturedAt", "capturedAt is required");
        }
        Instant capturedAt = Timestamps.parseWithOffset(request.capturedAt(), "capturedAt");
        Instant validAt = request.validAt() != null
            ? Timestamps.parseWithOffset(request.validAt(), "validAt")
            : capturedAt;
        if (request.rawPayload() == null || request.rawPayload().isNull()) {
            throw new InvalidParameterException(ErrorCode.VALIDATION_ERROR, "rawPayload", "rawPayload is required");
        }
        if (request.source() == null || !VALID_SOURCES.contains(request.source())) {
            throw new InvalidParameterException(ErrorCode.INVALID_ENUM, "source", "source must be one of: dataforseo");
        }
        AiOverviewStatus status = request.aiOverviewStatus() != null
            ? AiOverviewStatus.fromWire(request.aiOverviewStatus())
            : AiOverviewStatus.UNKNOWN;

        SerpSnapshot e = new SerpSnapshot();
        e.setProjectId(projectId);
        e.setQuery(QueryNormalizer.normalize(request.query()));
        e.setLocale(request.locale());
        e.setDevice(device.wireValue());
        e.setCapturedAt(toUtc(capturedAt));
        e.setValidAt(toUtc(validAt));
        e.setRawPayload(writePayload(request));
        e.setPayloadSchemaVersion(request.payloadSchemaVersion());
        e.setAiOverviewStatus(status.wireValue());
        e.setAiOverviewText(request.aiOverviewText());
        e.setSource(request.source());
        e.setBatchRef(request.batchRef());
        e.setCreatedAt(toUtc(clock.instant()));
        return e;
    }

    private String writePayload(RecordSnapshotRequest request) {
        try {
            return objectMapper.writeValueAsString(request.rawPayload());
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException(ErrorCode.VALIDATION_ERROR, "rawPayload",
                "rawPayload could not be serialized", e);
        }
    }

    static SerpSnapshotView toView(SerpSnapshot e) {
        return new SerpSnapshotView(
            e.getId(), e.getQuery(), e.getLocale(), e.getDevice(),
            toInstant(e.getCapturedAt()),
            e.getValidAt() != null ? toInstant(e.getValidAt()) : null,
            e.getAiOverviewStatus(), e.getSource(), e.getBatchRef(),
            toInstant(e.getCreatedAt()));
    }
}
