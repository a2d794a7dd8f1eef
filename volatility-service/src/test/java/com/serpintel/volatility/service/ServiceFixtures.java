package com.serpintel.volatility.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.serpintel.volatility.model.KeywordTarget;
import com.serpintel.volatility.model.SerpSnapshot;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Row builders shared by the service tests.
 */
public final class ServiceFixtures {

    public static final UUID    PROJECT_ID = UUID.fromString("00000000-0000-4000-a000-000000000001");
    public static final Instant NOW        = Instant.parse("2025-06-30T12:00:00Z");
    public static final Clock   CLOCK      = Clock.fixed(NOW, ZoneOffset.UTC);

    private ServiceFixtures() {}

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    public static KeywordTarget target(long n, String query) {
        KeywordTarget t = new KeywordTarget();
        t.setId(new UUID(1L, n));
        t.setProjectId(PROJECT_ID);
        t.setQuery(query);
        t.setLocale("en-US");
        t.setDevice("desktop");
        t.setCreatedAt(LocalDateTime.ofInstant(NOW.minusSeconds(86_400 * 60L), ZoneOffset.UTC));
        t.setUpdatedAt(t.getCreatedAt());
        return t;
    }

    /**
     * A snapshot of {@code target} captured {@code hoursAgo} before {@link #NOW}
     * with the given urls ranked 1..n.
     */
    public static SerpSnapshot row(KeywordTarget target, long n, long hoursAgo, String aiStatus, List<String> urls) {
        String results = urls.stream()
            .map(u -> "{\"url\":\"" + u + "\",\"rank\":" + (urls.indexOf(u) + 1) + "}")
            .collect(Collectors.joining(","));
        SerpSnapshot s = new SerpSnapshot();
        s.setId(new UUID(2L, n));
        s.setProjectId(PROJECT_ID);
        s.setQuery(target.getQuery());
        s.setLocale(target.getLocale());
        s.setDevice(target.getDevice());
        s.setCapturedAt(LocalDateTime.ofInstant(NOW.minusSeconds(3_600 * hoursAgo), ZoneOffset.UTC));
        s.setValidAt(s.getCapturedAt());
        s.setRawPayload("{\"results\":[" + results + "]}");
        s.setAiOverviewStatus(aiStatus);
        s.setSource("dataforseo");
        s.setCreatedAt(s.getCapturedAt());
        return s;
    }

    public static List<String> urls(int start, int count) {
        return java.util.stream.IntStream.range(start, start + count)
            .mapToObj(i -> "https://example.com/p" + i)
            .toList();
    }
}
