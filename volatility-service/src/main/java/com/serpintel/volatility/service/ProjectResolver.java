package com.serpintel.volatility.service;

import com.serpintel.common.exception.ErrorCode;
import com.serpintel.common.exception.InvalidParameterException;
import com.serpintel.common.validation.RequestParams;
import com.serpintel.volatility.config.ProjectDefaults;
import com.serpintel.volatility.model.Project;
import com.serpintel.volatility.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Resolves the calling tenant: {@code X-Project-Id}, else
 * {@code X-Project-Slug}, else the configured default project. A header that
 * names no existing project is a 400.
 */
@Service
public class ProjectResolver {

    public static final String PROJECT_ID_HEADER   = "X-Project-Id";
    public static final String PROJECT_SLUG_HEADER = "X-Project-Slug";

    private static final Logger log = LoggerFactory.getLogger(ProjectResolver.class);

    private final ProjectRepository projectRepository;
    private final ProjectDefaults   defaults;

    public ProjectResolver(ProjectRepository projectRepository, ProjectDefaults defaults) {
        this.projectRepository = projectRepository;
        this.defaults          = defaults;
    }

    public Mono<UUID> resolve(String projectIdHeader, String projectSlugHeader) {
        if (projectIdHeader != null && !projectIdHeader.isBlank()) {
            return Mono.fromCallable(() -> RequestParams.uuid(projectIdHeader, PROJECT_ID_HEADER))
                .flatMap(projectRepository::findById)
                .map(Project::getId)
                .switchIfEmpty(Mono.error(unknownProject(PROJECT_ID_HEADER, projectIdHeader)));
        }
        if (projectSlugHeader != null && !projectSlugHeader.isBlank()) {
            return projectRepository.findBySlug(projectSlugHeader)
                .map(Project::getId)
                .switchIfEmpty(Mono.error(unknownProject(PROJECT_SLUG_HEADER, projectSlugHeader)));
        }
        log.debug("No project header, using default project. projectId={}", defaults.id());
        return Mono.just(defaults.id());
    }

    private static InvalidParameterException unknownProject(String header, String value) {
        return new InvalidParameterException(ErrorCode.VALIDATION_ERROR, header, "Project not found: " + value);
    }
}
