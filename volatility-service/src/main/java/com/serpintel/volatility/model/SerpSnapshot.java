package com.serpintel.volatility.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One captured results page. Append-only: rows are never updated, and
 * {@code (projectId, query, locale, device, capturedAt)} is unique.
 * {@code rawPayload} holds the provider JSON as text; timestamps are UTC.
 */
@Data
@NoArgsConstructor
@Table("serp_snapshot")
public class SerpSnapshot {

    @Id
    private UUID id;

    private UUID          projectId;
    private String        query;
    private String        locale;
    private String        device;
    private LocalDateTime capturedAt;
    private LocalDateTime validAt;
    private String        rawPayload;
    private String        payloadSchemaVersion;
    private String        aiOverviewStatus;
    private String        aiOverviewText;
    private String        source;
    private String        batchRef;
    private LocalDateTime createdAt;
}
