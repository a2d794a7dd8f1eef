package com.serpintel.volatility.repository;

import com.serpintel.volatility.model.SerpSnapshot;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Read and append access to the snapshot ledger. Every query is scoped by
 * project; window queries take an inclusive lower bound on capture time.
 */
@Repository
public interface SerpSnapshotRepository extends ReactiveCrudRepository<SerpSnapshot, UUID> {

    Mono<SerpSnapshot> findByIdAndProjectId(UUID id, UUID projectId);

    Mono<SerpSnapshot> findByProjectIdAndQueryAndLocaleAndDeviceAndCapturedAt(
        UUID projectId, String query, String locale, String device, LocalDateTime capturedAt);

    /** Snapshots of one keyword captured at or after {@code since}, oldest first. */
    @Query("""
        SELECT * FROM serp_snapshot
        WHERE project_id = :projectId
          AND query = :query
          AND locale = :locale
          AND device = :device
          AND captured_at >= :since
        ORDER BY captured_at ASC, id ASC
        """)
    Flux<SerpSnapshot> findKeywordWindow(UUID projectId, String query, String locale, String device,
                                         LocalDateTime since);

    /** Snapshots of the whole project captured at or after {@code since}, oldest first. */
    @Query("""
        SELECT * FROM serp_snapshot
        WHERE project_id = :projectId
          AND captured_at >= :since
        ORDER BY captured_at ASC, id ASC
        """)
    Flux<SerpSnapshot> findProjectWindow(UUID projectId, LocalDateTime since);

    @Query("""
        SELECT * FROM serp_snapshot
        WHERE project_id = :projectId
          AND query = :query
          AND locale = :locale
          AND device = :device
        ORDER BY captured_at DESC, id DESC
        LIMIT 2
        """)
    Flux<SerpSnapshot> findLatestTwo(UUID projectId, String query, String locale, String device);

    // ── history pages: newest first ────────────────────────────────────────

    @Query("""
        SELECT * FROM serp_snapshot
        WHERE project_id = :projectId
          AND query = :query
          AND locale = :locale
          AND device = :device
          AND captured_at >= :since
        ORDER BY captured_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<SerpSnapshot> findHistoryFirstPage(UUID projectId, String query, String locale, String device,
                                            LocalDateTime since, int limit);

    @Query("""
        SELECT * FROM serp_snapshot
        WHERE project_id = :projectId
          AND query = :query
          AND locale = :locale
          AND device = :device
          AND captured_at >= :since
          AND (captured_at < :capturedAt OR (captured_at = :capturedAt AND id < :id))
        ORDER BY captured_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<SerpSnapshot> findHistoryPageBefore(UUID projectId, String query, String locale, String device,
                                             LocalDateTime since, LocalDateTime capturedAt, UUID id, int limit);

    // ── project listing: newest first ──────────────────────────────────────

    @Query("""
        SELECT * FROM serp_snapshot
        WHERE project_id = :projectId
        ORDER BY captured_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<SerpSnapshot> findProjectFirstPage(UUID projectId, int limit);

    @Query("""
        SELECT * FROM serp_snapshot
        WHERE project_id = :projectId
          AND (captured_at < :capturedAt OR (captured_at = :capturedAt AND id < :id))
        ORDER BY captured_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<SerpSnapshot> findProjectPageBefore(UUID projectId, LocalDateTime capturedAt, UUID id, int limit);
}
