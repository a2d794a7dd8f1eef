package com.serpintel.volatility.controller;

import com.serpintel.common.pagination.TimeCursor;
import com.serpintel.common.validation.RequestParams;
import com.serpintel.common.window.WindowSelector;
import com.serpintel.volatility.dto.CreateKeywordTargetRequest;
import com.serpintel.volatility.dto.FeatureTransitionsResponse;
import com.serpintel.volatility.dto.KeywordTargetView;
import com.serpintel.volatility.dto.KeywordVolatilityResponse;
import com.serpintel.volatility.dto.SerpHistoryResponse;
import com.serpintel.volatility.dto.VolatilityBreakdownResponse;
import com.serpintel.volatility.dto.VolatilitySpikesResponse;
import com.serpintel.volatility.service.KeywordTargetService;
import com.serpintel.volatility.service.KeywordVolatilityService;
import com.serpintel.volatility.service.ProjectResolver;
import com.serpintel.volatility.service.SerpHistoryService;
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

/**
 * Keyword-target ledger and the per-keyword volatility reads.
 */
@RestController
@RequestMapping("/api/seo/keyword-targets")
public class KeywordTargetController {

    private static final Logger log = LoggerFactory.getLogger(KeywordTargetController.class);

    static final int LIST_DEFAULT_LIMIT    = 50;
    static final int LIST_MAX_LIMIT        = 200;
    static final int DEFAULT_ALERT_LEVEL   = 60;
    static final int BREAKDOWN_DEFAULT_TOP = 20;
    static final int BREAKDOWN_MAX_TOP     = 50;
    static final int SPIKES_DEFAULT_TOP    = 3;
    static final int SPIKES_MAX_TOP        = 10;
    static final int HISTORY_DEFAULT_TOP   = 10;
    static final int HISTORY_MAX_TOP       = 20;

    private final ProjectResolver          projectResolver;
    private final KeywordTargetService     keywordTargetService;
    private final KeywordVolatilityService volatilityService;
    private final SerpHistoryService       historyService;

    public KeywordTargetController(ProjectResolver projectResolver,
                                   KeywordTargetService keywordTargetService,
                                   KeywordVolatilityService volatilityService,
                                   SerpHistoryService historyService) {
        this.projectResolver      = projectResolver;
        this.keywordTargetService = keywordTargetService;
        this.volatilityService    = volatilityService;
        this.historyService       = historyService;
    }

    @PostMapping
    public Mono<ResponseEntity<ApiResponse<KeywordTargetView>>> create(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @RequestBody CreateKeywordTargetRequest request) {
        log.info("Create keyword target received. query={} locale={} device={}",
                 request.query(), request.locale(), request.device());
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> keywordTargetService.create(pid, request))
            .map(result -> ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.of(result.value())))
            .doOnError(e -> log.error("Create keyword target endpoint error. query={}", request.query(), e));
    }

    @GetMapping
    public Mono<ResponseEntity<ApiResponse<List<KeywordTargetView>>>> list(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @RequestParam(required = false) String cursor,
            @RequestParam(required = false) String limit) {
        log.info("Keyword target list requested. limit={} cursor={}", limit, cursor != null);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> {
                int n = RequestParams.intOrDefault(limit, "limit", 1, LIST_MAX_LIMIT, LIST_DEFAULT_LIMIT);
                TimeCursor position = cursor != null ? TimeCursor.decode(cursor) : null;
                return keywordTargetService.list(pid, position, n);
            })
            .map(page -> ResponseEntity.ok(ApiResponse.paged(page.items(),
                new ApiResponse.Pagination(page.limit(), page.hasMore(), page.nextCursor()))))
            .doOnError(e -> log.error("Keyword target list endpoint error", e));
    }

    @GetMapping("/{id}/volatility")
    public Mono<ResponseEntity<ApiResponse<KeywordVolatilityResponse>>> volatility(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @PathVariable String id,
            @RequestParam(required = false) String windowDays,
            @RequestParam(required = false) String alertThreshold) {
        log.info("Volatility requested. keywordTargetId={} windowDays={}", id, windowDays);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> volatilityService.volatility(pid,
                RequestParams.uuid(id, "id"),
                window(windowDays),
                RequestParams.signedIntOrDefault(alertThreshold, "alertThreshold", 0, 100, DEFAULT_ALERT_LEVEL)))
            .map(body -> ResponseEntity.ok(ApiResponse.of(body)))
            .doOnError(e -> log.error("Volatility endpoint error. keywordTargetId={}", id, e));
    }

    @GetMapping("/{id}/volatility-breakdown")
    public Mono<ResponseEntity<ApiResponse<VolatilityBreakdownResponse>>> breakdown(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @PathVariable String id,
            @RequestParam(required = false) String windowDays,
            @RequestParam(required = false) String topN) {
        log.info("Volatility breakdown requested. keywordTargetId={} windowDays={} topN={}", id, windowDays, topN);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> volatilityService.breakdown(pid,
                RequestParams.uuid(id, "id"),
                window(windowDays),
                RequestParams.intOrDefault(topN, "topN", 1, BREAKDOWN_MAX_TOP, BREAKDOWN_DEFAULT_TOP)))
            .map(body -> ResponseEntity.ok(ApiResponse.of(body)))
            .doOnError(e -> log.error("Volatility breakdown endpoint error. keywordTargetId={}", id, e));
    }

    @GetMapping("/{id}/volatility-spikes")
    public Mono<ResponseEntity<ApiResponse<VolatilitySpikesResponse>>> spikes(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @PathVariable String id,
            @RequestParam(required = false) String windowDays,
            @RequestParam(required = false) String topN) {
        log.info("Volatility spikes requested. keywordTargetId={} windowDays={} topN={}", id, windowDays, topN);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> volatilityService.spikes(pid,
                RequestParams.uuid(id, "id"),
                window(windowDays),
                RequestParams.intOrDefault(topN, "topN", 1, SPIKES_MAX_TOP, SPIKES_DEFAULT_TOP)))
            .map(body -> ResponseEntity.ok(ApiResponse.of(body)))
            .doOnError(e -> log.error("Volatility spikes endpoint error. keywordTargetId={}", id, e));
    }

    @GetMapping("/{id}/feature-transitions")
    public Mono<ResponseEntity<ApiResponse<FeatureTransitionsResponse>>> featureTransitions(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @PathVariable String id,
            @RequestParam(required = false) String windowDays) {
        log.info("Feature transitions requested. keywordTargetId={} windowDays={}", id, windowDays);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> volatilityService.featureTransitions(pid,
                RequestParams.uuid(id, "id"),
                window(windowDays)))
            .map(body -> ResponseEntity.ok(ApiResponse.of(body)))
            .doOnError(e -> log.error("Feature transitions endpoint error. keywordTargetId={}", id, e));
    }

    @GetMapping("/{id}/serp-history")
    public Mono<ResponseEntity<ApiResponse<SerpHistoryResponse>>> serpHistory(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @PathVariable String id,
            @RequestParam(required = false) String windowDays,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String topN,
            @RequestParam(required = false) String includePayload,
            @RequestParam(required = false) String cursor) {
        log.info("SERP history requested. keywordTargetId={} windowDays={} limit={}", id, windowDays, limit);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> historyService.history(pid,
                RequestParams.uuid(id, "id"),
                window(windowDays),
                cursor != null ? TimeCursor.decode(cursor) : null,
                RequestParams.intOrDefault(limit, "limit", 1, LIST_MAX_LIMIT, LIST_DEFAULT_LIMIT),
                RequestParams.intOrDefault(topN, "topN", 1, HISTORY_MAX_TOP, HISTORY_DEFAULT_TOP),
                RequestParams.booleanOrDefault(includePayload, "includePayload", false)))
            .map(body -> ResponseEntity.ok(ApiResponse.of(body)))
            .doOnError(e -> log.error("SERP history endpoint error. keywordTargetId={}", id, e));
    }

    static Integer window(String windowDays) {
        return RequestParams.optionalInt(windowDays, "windowDays",
            WindowSelector.MIN_WINDOW_DAYS, WindowSelector.MAX_WINDOW_DAYS);
    }
}
