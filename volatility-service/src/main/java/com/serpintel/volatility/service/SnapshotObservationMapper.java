package com.serpintel.volatility.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.serpintel.common.extraction.ExtractionResult;
import com.serpintel.common.extraction.SerpPayloadExtractor;
import com.serpintel.common.model.AiOverviewStatus;
import com.serpintel.common.model.SnapshotObservation;
import com.serpintel.volatility.model.SerpSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.TreeSet;

/**
 * Converts stored snapshot rows into engine observations and back between
 * the UTC {@link LocalDateTime} columns and {@link Instant}.
 */
@Component
public class SnapshotObservationMapper {

    private static final Logger log = LoggerFactory.getLogger(SnapshotObservationMapper.class);

    private final ObjectMapper objectMapper;

    public SnapshotObservationMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SnapshotObservation toObservation(SerpSnapshot row) {
        JsonNode payload = readPayload(row);
        ExtractionResult extraction = SerpPayloadExtractor.extractResults(payload);
        return new SnapshotObservation(
            row.getId(),
            toInstant(row.getCapturedAt()),
            statusOf(row),
            extraction.results(),
            payload != null ? SerpPayloadExtractor.extractFeatures(payload) : new TreeSet<>(),
            extraction.parseWarning());
    }

    /**
     * Parsed payload, or {@code null} when the stored text is not JSON.
     */
    public JsonNode readPayload(SerpSnapshot row) {
        if (row.getRawPayload() == null) {
            return null;
        }
        try {
            return objectMapper.readTree(row.getRawPayload());
        } catch (JsonProcessingException e) {
            log.warn("Stored payload is not valid JSON. snapshotId={} err={}", row.getId(), e.getOriginalMessage());
            return null;
        }
    }

    public static Instant toInstant(LocalDateTime utc) {
        return utc.toInstant(ZoneOffset.UTC);
    }

    /** Truncated to the microsecond precision of the timestamp columns. */
    public static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant.truncatedTo(ChronoUnit.MICROS), ZoneOffset.UTC);
    }

    private static AiOverviewStatus statusOf(SerpSnapshot row) {
        String raw = row.getAiOverviewStatus();
        for (AiOverviewStatus s : AiOverviewStatus.values()) {
            if (s.wireValue().equals(raw)) {
                return s;
            }
        }
        return AiOverviewStatus.UNKNOWN;
    }
}
