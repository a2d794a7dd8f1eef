package com.serpintel.volatility.repository;

import com.serpintel.volatility.model.KeywordTarget;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

@Repository
public interface KeywordTargetRepository extends ReactiveCrudRepository<KeywordTarget, UUID> {

    /**
     * Project-scoped lookup. A target owned by another project is
     * indistinguishable from a missing one.
     */
    Mono<KeywordTarget> findByIdAndProjectId(UUID id, UUID projectId);

    Mono<KeywordTarget> findByProjectIdAndQueryAndLocaleAndDevice(
        UUID projectId, String query, String locale, String device);

    @Query("""
        SELECT * FROM keyword_target
        WHERE project_id = :projectId
        ORDER BY created_at ASC, id ASC
        """)
    Flux<KeywordTarget> findAllForProject(UUID projectId);

    @Query("""
        SELECT * FROM keyword_target
        WHERE project_id = :projectId
        ORDER BY created_at ASC, id ASC
        LIMIT :limit
        """)
    Flux<KeywordTarget> findFirstPage(UUID projectId, int limit);

    /**
     * Page strictly after {@code (createdAt, id)} in creation order.
     */
    @Query("""
        SELECT * FROM keyword_target
        WHERE project_id = :projectId
          AND (created_at > :createdAt OR (created_at = :createdAt AND id > :id))
        ORDER BY created_at ASC, id ASC
        LIMIT :limit
        """)
    Flux<KeywordTarget> findPageAfter(UUID projectId, LocalDateTime createdAt, UUID id, int limit);
}
