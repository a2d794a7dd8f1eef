package com.serpintel.volatility.controller;

import com.serpintel.common.alert.AlertParameters;
import com.serpintel.common.model.VolatilityMaturity;
import com.serpintel.volatility.dto.AlertsResponse;
import com.serpintel.volatility.dto.ItemsPage;
import com.serpintel.volatility.dto.SerpDeltaResponse;
import com.serpintel.volatility.service.AlertService;
import com.serpintel.volatility.service.ProjectResolver;
import com.serpintel.volatility.service.ProjectVolatilityService;
import com.serpintel.volatility.service.SerpDeltaService;
import com.serpintel.volatility.web.ApiExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class ProjectVolatilityControllerTest {

    private static final UUID    PROJECT_ID = UUID.fromString("00000000-0000-4000-a000-000000000001");
    private static final Instant NOW        = Instant.parse("2025-06-30T12:00:00Z");

    private ProjectVolatilityService projectVolatilityService;
    private AlertService             alertService;
    private SerpDeltaService         deltaService;
    private WebTestClient            client;

    @BeforeEach
    void setUp() {
        ProjectResolver resolver = mock(ProjectResolver.class);
        projectVolatilityService = mock(ProjectVolatilityService.class);
        alertService             = mock(AlertService.class);
        deltaService             = mock(SerpDeltaService.class);
        when(resolver.resolve(any(), any())).thenReturn(Mono.just(PROJECT_ID));

        client = WebTestClient
            .bindToController(new ProjectVolatilityController(resolver, projectVolatilityService,
                alertService, deltaService))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Nested
    @DisplayName("GET /api/seo/alerts")
    class AlertScanTests {

        @Test
        @DisplayName("windowDays missing → 400 VALIDATION_ERROR")
        void windowRequired() {
            client.get().uri("/api/seo/alerts")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.details[0].code").isEqualTo("VALIDATION_ERROR")
                .jsonPath("$.error.details[0].field").isEqualTo("windowDays");
            verifyNoInteractions(alertService);
        }

        @Test
        @DisplayName("windowDays=31 → 400 OUT_OF_RANGE")
        void windowTooLarge() {
            client.get().uri("/api/seo/alerts?windowDays=31")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.details[0].code").isEqualTo("OUT_OF_RANGE");
        }

        @Test
        @DisplayName("concentrationThreshold=1.5 → 400")
        void concentrationOutOfRange() {
            client.get().uri("/api/seo/alerts?windowDays=7&concentrationThreshold=1.5")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.details[0].field").isEqualTo("concentrationThreshold");
        }

        @Test
        @DisplayName("defaults applied → 200")
        void defaults() {
            when(alertService.scan(eq(PROJECT_ID), any(AlertParameters.class)))
                .thenReturn(Mono.just(new AlertsResponse(List.of(), 0, 0, 7, 75, 0.8, 100, NOW)));

            client.get().uri("/api/seo/alerts?windowDays=7")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.alertCount").isEqualTo(0)
                .jsonPath("$.data.windowDays").isEqualTo(7);

            ArgumentCaptor<AlertParameters> captor = ArgumentCaptor.forClass(AlertParameters.class);
            verify(alertService).scan(eq(PROJECT_ID), captor.capture());
            assertEquals(7, captor.getValue().windowDays());
            assertEquals(75.0, captor.getValue().spikeThreshold());
            assertEquals(0.8, captor.getValue().concentrationThreshold());
            assertEquals(100, captor.getValue().limit());
        }
    }

    @Nested
    @DisplayName("GET /api/seo/volatility-alerts")
    class VolatilityAlertsTests {

        @Test
        @DisplayName("unknown minMaturity → 400 INVALID_ENUM")
        void badMaturity() {
            client.get().uri("/api/seo/volatility-alerts?minMaturity=mature")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.details[0].code").isEqualTo("INVALID_ENUM");
        }

        @Test
        @DisplayName("no parameters → threshold 60, developing, limit 20")
        void defaults() {
            when(projectVolatilityService.volatilityAlerts(PROJECT_ID, null, 60,
                    VolatilityMaturity.DEVELOPING, null, 20))
                .thenReturn(Mono.just(new ItemsPage<>(List.of(), null)));

            client.get().uri("/api/seo/volatility-alerts")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.items").isEmpty();
        }

        @Test
        @DisplayName("limit=51 → 400")
        void limitTooLarge() {
            client.get().uri("/api/seo/volatility-alerts?limit=51")
                .exchange()
                .expectStatus().isBadRequest();
            verifyNoInteractions(projectVolatilityService);
        }
    }

    @Nested
    @DisplayName("GET /api/seo/serp-deltas")
    class SerpDeltaTests {

        @Test
        @DisplayName("keywordTargetId missing → 400")
        void missingTarget() {
            client.get().uri("/api/seo/serp-deltas")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.details[0].field").isEqualTo("keywordTargetId")
                .jsonPath("$.error.message").isEqualTo("keywordTargetId is required");
        }

        @Test
        @DisplayName("malformed fromSnapshotId → 400 MALFORMED_ID")
        void malformedSnapshotId() {
            client.get().uri("/api/seo/serp-deltas?keywordTargetId={k}&fromSnapshotId=abc&toSnapshotId=def",
                    UUID.randomUUID())
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error.details[0].code").isEqualTo("MALFORMED_ID")
                .jsonPath("$.error.details[0].field").isEqualTo("fromSnapshotId");
            verifyNoInteractions(deltaService);
        }

        @Test
        @DisplayName("only keywordTargetId → latest-two lookup")
        void latestTwo() {
            UUID target = UUID.randomUUID();
            when(deltaService.delta(eq(PROJECT_ID), eq(target), isNull(), isNull()))
                .thenReturn(Mono.just(new SerpDeltaResponse(null, new SerpDeltaResponse.Metadata(
                    target, "running shoes", "en-US", "desktop", true, 0, null, null, null, null))));

            client.get().uri("/api/seo/serp-deltas?keywordTargetId={k}", target)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.delta").doesNotExist()
                .jsonPath("$.data.metadata.insufficient_snapshots").isEqualTo(true)
                .jsonPath("$.data.metadata.same_timestamp").doesNotExist();
            verify(deltaService).delta(PROJECT_ID, target, null, null);
        }
    }

    @Test
    @DisplayName("summary rejects windowDays=abc")
    void summaryMalformedWindow() {
        client.get().uri("/api/seo/volatility-summary?windowDays=abc")
            .exchange()
            .expectStatus().isBadRequest();
        verifyNoInteractions(projectVolatilityService);
    }
}
