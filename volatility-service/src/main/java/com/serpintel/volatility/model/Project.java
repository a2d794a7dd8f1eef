package com.serpintel.volatility.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Tenant boundary. Every keyword target and snapshot belongs to exactly one
 * project.
 */
@Data
@NoArgsConstructor
@Table("project")
public class Project {

    @Id
    private UUID id;

    private String        name;
    private String        slug;
    private LocalDateTime createdAt;
}
