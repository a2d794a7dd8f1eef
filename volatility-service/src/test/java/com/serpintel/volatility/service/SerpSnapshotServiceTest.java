package com.serpintel.volatility.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.pagination.TimeCursor;
import com.serpintel.volatility.dto.RecordSnapshotRequest;
import com.serpintel.volatility.model.KeywordTarget;
import com.serpintel.volatility.model.SerpSnapshot;
import com.serpintel.volatility.repository.SerpSnapshotRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static com.serpintel.volatility.service.ServiceFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SerpSnapshotServiceTest {

    private final ObjectMapper mapper = objectMapper();

    private SerpSnapshotRepository repository;
    private SerpSnapshotService    service;

    @BeforeEach
    void setUp() {
        repository = mock(SerpSnapshotRepository.class);
        service    = new SerpSnapshotService(repository, mapper, CLOCK);
    }

    private RecordSnapshotRequest request(String capturedAt, String source) throws Exception {
        return new RecordSnapshotRequest("  Running   Shoes ", "en-US", "desktop", capturedAt, null,
            mapper.readTree("{\"results\":[{\"url\":\"https://a.example\",\"rank\":1}]}"),
            "v1", "present", null, source, "batch-7");
    }

    @Nested
    @DisplayName("record()")
    class RecordTests {

        @Test
        @DisplayName("new capture → inserted, created=true, normalised query, UTC capture time")
        void inserted() throws Exception {
            when(repository.findByProjectIdAndQueryAndLocaleAndDeviceAndCapturedAt(any(), any(), any(), any(), any()))
                .thenReturn(Mono.empty());
            when(repository.save(any(SerpSnapshot.class))).thenAnswer(inv -> {
                SerpSnapshot s = inv.getArgument(0);
                s.setId(UUID.randomUUID());
                return Mono.just(s);
            });

            StepVerifier.create(service.record(PROJECT_ID, request("2025-06-01T10:00:00+02:00", "dataforseo")))
                .assertNext(r -> {
                    assertTrue(r.created());
                    assertEquals("running shoes", r.value().query());
                    assertEquals("2025-06-01T08:00:00Z", r.value().capturedAt().toString());
                    assertEquals(r.value().capturedAt(), r.value().validAt());
                    assertEquals("present", r.value().aiOverviewStatus());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("replay of the same capture → existing row, created=false")
        void replay() throws Exception {
            KeywordTarget t = target(1, "running shoes");
            SerpSnapshot existing = row(t, 1, 10, "present", List.of("https://a.example"));
            when(repository.findByProjectIdAndQueryAndLocaleAndDeviceAndCapturedAt(
                    eq(PROJECT_ID), eq("running shoes"), eq("en-US"), eq("desktop"),
                    eq(LocalDateTime.of(2025, 6, 1, 8, 0))))
                .thenReturn(Mono.just(existing));

            StepVerifier.create(service.record(PROJECT_ID, request("2025-06-01T08:00:00Z", "dataforseo")))
                .assertNext(r -> {
                    assertFalse(r.created());
                    assertEquals(existing.getId(), r.value().id());
                })
                .verifyComplete();
            verify(repository, never()).save(any());
        }

        @Test
        @DisplayName("concurrent insert of the same capture → the winner is returned")
        void raced() throws Exception {
            KeywordTarget t = target(1, "running shoes");
            SerpSnapshot winner = row(t, 1, 10, "present", List.of("https://a.example"));
            when(repository.findByProjectIdAndQueryAndLocaleAndDeviceAndCapturedAt(any(), any(), any(), any(), any()))
                .thenReturn(Mono.empty(), Mono.just(winner));
            when(repository.save(any(SerpSnapshot.class)))
                .thenReturn(Mono.error(new DataIntegrityViolationException("duplicate key")));

            StepVerifier.create(service.record(PROJECT_ID, request("2025-06-01T08:00:00Z", "dataforseo")))
                .assertNext(r -> {
                    assertFalse(r.created());
                    assertEquals(winner.getId(), r.value().id());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("timestamp without offset → INVALID_TIMESTAMP")
        void noOffset() throws Exception {
            StepVerifier.create(service.record(PROJECT_ID, request("2025-06-01T08:00:00", "dataforseo")))
                .expectErrorSatisfies(e -> assertEquals(ErrorCode.INVALID_TIMESTAMP,
                    ((InvalidParameterException) e).getCode()))
                .verify();
            verifyNoInteractions(repository);
        }

        @Test
        @DisplayName("unknown source → INVALID_ENUM")
        void badSource() throws Exception {
            StepVerifier.create(service.record(PROJECT_ID, request("2025-06-01T08:00:00Z", "scraper")))
                .expectErrorSatisfies(e -> assertEquals(ErrorCode.INVALID_ENUM,
                    ((InvalidParameterException) e).getCode()))
                .verify();
        }
    }

    @Test
    @DisplayName("list() fetches one extra row and emits a cursor from the last item")
    void listPagination() {
        KeywordTarget t = target(1, "q");
        SerpSnapshot a = row(t, 3, 1, "absent", List.of("x"));
        SerpSnapshot b = row(t, 2, 2, "absent", List.of("x"));
        SerpSnapshot c = row(t, 1, 3, "absent", List.of("x"));
        when(repository.findProjectFirstPage(PROJECT_ID, 3)).thenReturn(Flux.just(a, b, c));

        StepVerifier.create(service.list(PROJECT_ID, null, 2))
            .assertNext(page -> {
                assertEquals(2, page.items().size());
                assertTrue(page.hasMore());
                TimeCursor cursor = TimeCursor.decode(page.nextCursor());
                assertEquals(b.getId(), cursor.id());
            })
            .verifyComplete();
    }
}
