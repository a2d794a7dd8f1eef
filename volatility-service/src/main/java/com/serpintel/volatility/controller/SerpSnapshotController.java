package com.serpintel.volatility.controller;

import com.serpintel.common.pagination.TimeCursor;
import com.serpintel.common.validation.RequestParams;
import com.serpintel.volatility.dto.RecordSnapshotRequest;
import com.serpintel.volatility.dto.SerpSnapshotView;
import com.serpintel.volatility.service.ProjectResolver;
import com.serpintel.volatility.service.SerpSnapshotService;
import com.serpintel.volatility.web.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.serpintel.volatility.service.ProjectResolver.PROJECT_ID_HEADER;
import static com.serpintel.volatility.service.ProjectResolver.PROJECT_SLUG_HEADER;

@RestController
@RequestMapping("/api/seo/serp-snapshots")
public class SerpSnapshotController {

    private static final Logger log = LoggerFactory.getLogger(SerpSnapshotController.class);

    private final ProjectResolver     projectResolver;
    private final SerpSnapshotService snapshotService;

    public SerpSnapshotController(ProjectResolver projectResolver, SerpSnapshotService snapshotService) {
        this.projectResolver = projectResolver;
        this.snapshotService = snapshotService;
    }

    /** 201 for a new snapshot, 200 when the same capture was already recorded. */
    @PostMapping
    public Mono<ResponseEntity<ApiResponse<SerpSnapshotView>>> record(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @RequestBody RecordSnapshotRequest request) {
        log.info("Record snapshot received. query={} locale={} device={} capturedAt={}",
                 request.query(), request.locale(), request.device(), request.capturedAt());
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> snapshotService.record(pid, request))
            .map(result -> ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(ApiResponse.of(result.value())))
            .doOnError(e -> log.error("Record snapshot endpoint error. query={}", request.query(), e));
    }

    @GetMapping
    public Mono<ResponseEntity<ApiResponse<List<SerpSnapshotView>>>> list(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) String limit) {
        log.info("Snapshot list requested. limit={} cursor={}", limit, cursor != null);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> snapshotService.list(pid,
                cursor != null ? TimeCursor.decode(cursor) : null,
                RequestParams.intOrDefault(limit, "limit", 1,
                    KeywordTargetController.LIST_MAX_LIMIT, KeywordTargetController.LIST_DEFAULT_LIMIT)))
            .map(page -> ResponseEntity.ok(ApiResponse.paged(page.items(),
                new ApiResponse.Pagination(page.limit(), page.hasMore(), page.nextCursor()))))
            .doOnError(e -> log.error("Snapshot list endpoint error", e));
    }
}
