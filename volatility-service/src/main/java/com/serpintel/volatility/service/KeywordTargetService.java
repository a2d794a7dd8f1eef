package com.serpintel.volatility.service;

import com.serpintel.common.exception.ConflictException;
import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.exception.ResourceNotFoundException;
import com.serpintel.common.model.Device;
import com.serpintel.common.pagination.TimeCursor;
import com.serpintel.common.validation.QueryNormalizer;
import com.serpintel.volatility.dto.CreateKeywordTargetRequest;
import com.serpintel.volatility.dto.CursorPage;
import com.serpintel.volatility.dto.KeywordTargetView;
import com.serpintel.volatility.dto.WriteResult;
import com.serpintel.volatility.model.KeywordTarget;
import com.serpintel.volatility.repository.KeywordTargetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static com.serpintel.volatility.service.SnapshotObservationMapper.toInstant;
import static com.serpintel.volatility.service.SnapshotObservationMapper.toUtc;

/**
 * Keyword-target ledger: creation, project-scoped lookup and cursor listing.
 */
@Service
public class KeywordTargetService {

    private static final Logger log = LoggerFactory.getLogger(KeywordTargetService.class);

    private final KeywordTargetRepository repository;
    private final Clock                   clock;

    public KeywordTargetService(KeywordTargetRepository repository, Clock clock) {
        this.repository = repository;
        this.clock      = clock;
    }

    /**
     * Creates a target. A second target with the same normalised query,
     * locale and device in the project is a conflict.
     */
    public Mono<WriteResult<KeywordTargetView>> create(UUID projectId, CreateKeywordTargetRequest request) {
        return Mono.fromCallable(() -> toEntity(projectId, request))
            .flatMap(entity -> repository
                .findByProjectIdAndQueryAndLocaleAndDevice(projectId, entity.getQuery(), entity.getLocale(), entity.getDevice())
                .flatMap(existing -> Mono.<KeywordTarget>error(duplicate(entity)))
                .switchIfEmpty(Mono.defer(() -> repository.save(entity)))
                .onErrorMap(DataIntegrityViolationException.class, e -> duplicate(entity)))
            .doOnSuccess(saved -> log.info("Keyword target created. projectId={} id={} query={}",
                                           projectId, saved.getId(), saved.getQuery()))
            .map(saved -> new WriteResult<>(toView(saved), true));
    }

    /**
     * Loads a target owned by {@code projectId}; missing and foreign targets
     * both fail with the same not-found error.
     */
    public Mono<KeywordTarget> require(UUID projectId, UUID id) {
        return repository.findByIdAndProjectId(id, projectId)
            .switchIfEmpty(Mono.error(new ResourceNotFoundException("KeywordTarget")));
    }

    public Flux<KeywordTarget> findAll(UUID projectId) {
        return repository.findAllForProject(projectId);
    }

    /**
     * Lists targets oldest first. Fetches one extra row to detect a next page.
     */
    public Mono<CursorPage<KeywordTargetView>> list(UUID projectId, TimeCursor cursor, int limit) {
        Flux<KeywordTarget> rows = cursor == null
            ? repository.findFirstPage(projectId, limit + 1)
            : repository.findPageAfter(projectId, toUtc(cursor.at()), cursor.id(), limit + 1);
        return rows.collectList().map(list -> {
            boolean hasMore = list.size() > limit;
            List<KeywordTarget> page = hasMore ? list.subList(0, limit) : list;
            String next = null;
            if (hasMore) {
                KeywordTarget last = page.get(page.size() - 1);
                next = new TimeCursor(toInstant(last.getCreatedAt()), last.getId()).encode();
            }
            return new CursorPage<>(page.stream().map(KeywordTargetService::toView).toList(), limit, next);
        });
    }

    // ── mapping ────────────────────────────────────────────────────────────

    private KeywordTarget toEntity(UUID projectId, CreateKeywordTargetRequest request) {
        if (request.query() == null || request.query().isBlank()) {
            throw new InvalidParameterException(ErrorCode.VALIDATION_ERROR, "query", "query is required");
        }
        if (request.locale() == null || request.locale().isBlank()) {
            throw new InvalidParameterException(ErrorCode.VALIDATION_ERROR, "locale", "locale is required");
        }
        Device device = Device.fromWire(request.device());

        LocalDateTime now = toUtc(clock.instant());
        KeywordTarget e = new KeywordTarget();
        e.setProjectId(projectId);
        e.setQuery(QueryNormalizer.normalize(request.query()));
        e.setLocale(request.locale());
        e.setDevice(device.wireValue());
        e.setPrimary(Boolean.TRUE.equals(request.isPrimary()));
        e.setIntent(request.intent());
        e.setNotes(request.notes());
        e.setCreatedAt(now);
        e.setUpdatedAt(now);
        return e;
    }

    static KeywordTargetView toView(KeywordTarget e) {
        return new KeywordTargetView(
            e.getId(), e.getQuery(), e.getLocale(), e.getDevice(), e.isPrimary(),
            e.getIntent(), e.getNotes(), toInstant(e.getCreatedAt()), toInstant(e.getUpdatedAt()));
    }

    private static ConflictException duplicate(KeywordTarget e) {
        return new ConflictException("KeywordTarget already exists for query=" + e.getQuery()
            + " locale=" + e.getLocale() + " device=" + e.getDevice());
    }
}
