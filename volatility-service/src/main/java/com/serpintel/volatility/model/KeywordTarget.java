package com.serpintel.volatility.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A tracked search query. {@code (projectId, query, locale, device)} is the
 * natural key shared with {@link SerpSnapshot}; timestamps are UTC.
 */
@Data
@NoArgsConstructor
@Table("keyword_target")
public class KeywordTarget {

    @Id
    private UUID id;

    private UUID          projectId;
    private String        query;
    private String        locale;
    private String        device;
    @Column("is_primary")
    private boolean       primary;
    private String        intent;
    private String        notes;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
