package com.serpintel.volatility.controller;

import com.serpintel.common.alert.AlertParameters;
import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.model.VolatilityMaturity;
import com.serpintel.common.pagination.ScoreCursor;
import com.serpintel.common.validation.RequestParams;
import com.serpintel.volatility.dto.AlertsResponse;
import com.serpintel.volatility.dto.ItemsPage;
import com.serpintel.volatility.dto.SerpDeltaResponse;
import com.serpintel.volatility.dto.VolatilityAlertItem;
import com.serpintel.volatility.dto.VolatilitySummaryResponse;
import com.serpintel.volatility.service.AlertService;
import com.serpintel.volatility.service.ProjectResolver;
import com.serpintel.volatility.service.ProjectVolatilityService;
import com.serpintel.volatility.service.SerpDeltaService;
import com.serpintel.volatility.web.ApiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.UUID;

import static com.serpintel.volatility.service.ProjectResolver.PROJECT_ID_HEADER;
import static com.serpintel.volatility.service.ProjectResolver.PROJECT_SLUG_HEADER;

/**
 * Project-scoped reads: risk summary, threshold list, alert scan and SERP
 * deltas. Aggregates only ever cover the caller's own project.
 */
@RestController
@RequestMapping("/api/seo")
public class ProjectVolatilityController {

    private static final Logger log = LoggerFactory.getLogger(ProjectVolatilityController.class);

    static final int ALERTS_LIST_DEFAULT_LIMIT = 20;
    static final int ALERTS_LIST_MAX_LIMIT     = 50;

    private final ProjectResolver          projectResolver;
    private final ProjectVolatilityService projectVolatilityService;
    private final AlertService             alertService;
    private final SerpDeltaService         deltaService;

    public ProjectVolatilityController(ProjectResolver projectResolver,
                                      ProjectVolatilityService projectVolatilityService,
                                      AlertService alertService,
                                      SerpDeltaService deltaService) {
        this.projectResolver          = projectResolver;
        this.projectVolatilityService = projectVolatilityService;
        this.alertService             = alertService;
        this.deltaService             = deltaService;
    }

    @GetMapping("/volatility-summary")
    public Mono<ResponseEntity<ApiResponse<VolatilitySummaryResponse>>> summary(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @RequestParam(required = false) String windowDays) {
        log.info("Volatility summary requested. windowDays={}", windowDays);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> projectVolatilityService.summary(pid, KeywordTargetController.window(windowDays)))
            .map(body -> ResponseEntity.ok(ApiResponse.of(body)))
            .doOnError(e -> log.error("Volatility summary endpoint error. windowDays={}", windowDays, e));
    }

    @GetMapping("/volatility-alerts")
    public Mono<ResponseEntity<ApiResponse<ItemsPage<VolatilityAlertItem>>>> volatilityAlerts(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @RequestParam(required = false) String windowDays,
            @RequestParam(required = false) String alertThreshold,
            @RequestParam(required = false) String minMaturity,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String cursor) {
        log.info("Volatility alerts requested. windowDays={} alertThreshold={} minMaturity={} limit={}",
                 windowDays, alertThreshold, minMaturity, limit);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> projectVolatilityService.volatilityAlerts(pid,
                KeywordTargetController.window(windowDays),
                RequestParams.signedIntOrDefault(alertThreshold, "alertThreshold", 0, 100,
                    KeywordTargetController.DEFAULT_ALERT_LEVEL),
                minMaturity != null ? VolatilityMaturity.fromWire(minMaturity) : VolatilityMaturity.DEVELOPING,
                cursor != null ? ScoreCursor.decode(cursor) : null,
                RequestParams.intOrDefault(limit, "limit", 1, ALERTS_LIST_MAX_LIMIT, ALERTS_LIST_DEFAULT_LIMIT)))
            .map(body -> ResponseEntity.ok(ApiResponse.of(body)))
            .doOnError(e -> log.error("Volatility alerts endpoint error", e));
    }

    @GetMapping("/alerts")
    public Mono<ResponseEntity<ApiResponse<AlertsResponse>>> alerts(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @RequestParam(required = false) String windowDays,
            @RequestParam(required = false) String spikeThreshold,
            @RequestParam(required = false) String concentrationThreshold,
            @RequestParam(required = false) String limit) {
        log.info("Alert scan requested. windowDays={} spikeThreshold={} concentrationThreshold={} limit={}",
                 windowDays, spikeThreshold, concentrationThreshold, limit);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> alertService.scan(pid, new AlertParameters(
                RequestParams.requiredInt(windowDays, "windowDays", 1, AlertParameters.MAX_WINDOW_DAYS),
                RequestParams.decimalOrDefault(spikeThreshold, "spikeThreshold", 0, 100,
                    AlertParameters.DEFAULT_SPIKE_THRESHOLD),
                RequestParams.decimalOrDefault(concentrationThreshold, "concentrationThreshold", 0, 1,
                    AlertParameters.DEFAULT_CONCENTRATION_THRESHOLD),
                RequestParams.intOrDefault(limit, "limit", 1, AlertParameters.MAX_LIMIT,
                    AlertParameters.DEFAULT_LIMIT))))
            .map(body -> ResponseEntity.ok(ApiResponse.of(body)))
            .doOnError(e -> log.error("Alert scan endpoint error. windowDays={}", windowDays, e));
    }

    @GetMapping("/serp-deltas")
    public Mono<ResponseEntity<ApiResponse<SerpDeltaResponse>>> serpDeltas(
            @RequestHeader(value = PROJECT_ID_HEADER, required = false) String projectId,
            @RequestHeader(value = PROJECT_SLUG_HEADER, required = false) String projectSlug,
            @RequestParam(required = false) String keywordTargetId,
            @RequestParam(required = false) String fromSnapshotId,
            @RequestParam(required = false) String toSnapshotId) {
        log.info("SERP delta requested. keywordTargetId={} from={} to={}",
                 keywordTargetId, fromSnapshotId, toSnapshotId);
        return projectResolver.resolve(projectId, projectSlug)
            .flatMap(pid -> {
                if (keywordTargetId == null) {
                    throw new InvalidParameterException(ErrorCode.VALIDATION_ERROR, "keywordTargetId",
                        "keywordTargetId is required");
                }
                return deltaService.delta(pid,
                    RequestParams.uuid(keywordTargetId, "keywordTargetId"),
                    optionalUuid(fromSnapshotId, "fromSnapshotId"),
                    optionalUuid(toSnapshotId, "toSnapshotId"));
            })
            .map(body -> ResponseEntity.ok(ApiResponse.of(body)))
            .doOnError(e -> log.error("SERP delta endpoint error. keywordTargetId={}", keywordTargetId, e));
    }

    private static UUID optionalUuid(String raw, String name) {
        return raw != null ? RequestParams.uuid(raw, name) : null;
    }
}
