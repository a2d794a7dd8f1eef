package com.serpintel.volatility.service;

import com.serpintel.common.alert.AlertEvaluator;
import com.serpintel.common.alert.AlertParameters;
import com.serpintel.common.alert.AlertReport;
import com.serpintel.volatility.dto.AlertsResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Compute-on-read alert scan over the project's trailing window. Alerts are
 * never persisted; the same inputs always yield the same list.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final ProjectVolatilityService projectVolatilityService;
    private final Clock                    clock;

    public AlertService(ProjectVolatilityService projectVolatilityService, Clock clock) {
        this.projectVolatilityService = projectVolatilityService;
        this.clock                    = clock;
    }

    public Mono<AlertsResponse> scan(UUID projectId, AlertParameters params) {
        Instant requestTime = clock.instant();
        return projectVolatilityService.series(projectId, params.windowDays(), requestTime).map(series -> {
            AlertReport report = AlertEvaluator.evaluate(projectId, series, params);
            if (report.totalAlerts() > report.alertCount()) {
                log.info("Alert list truncated. projectId={} total={} limit={}",
                         projectId, report.totalAlerts(), params.limit());
            }
            log.info("Alert scan complete. projectId={} windowDays={} keywords={} alerts={}",
                     projectId, params.windowDays(), series.size(), report.alertCount());
            return new AlertsResponse(
                report.alerts(), report.alertCount(), report.totalAlerts(),
                params.windowDays(), params.spikeThreshold(), params.concentrationThreshold(),
                params.limit(), requestTime);
        });
    }
}
