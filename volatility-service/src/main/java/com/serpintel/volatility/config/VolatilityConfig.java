package com.serpintel.volatility.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.UUID;

@Configuration
public class VolatilityConfig {

    @Value("${serp.project.default-id}")
    private String defaultProjectId;

    @Value("${serp.project.default-slug}")
    private String defaultProjectSlug;

    /** Every "now" in the service derives from this clock. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProjectDefaults projectDefaults() {
        return new ProjectDefaults(UUID.fromString(defaultProjectId), defaultProjectSlug);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
