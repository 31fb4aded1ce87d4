package com.scholary.meeting.analysis;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the chunk analyzer service.
 *
 * <p>Timeouts are in seconds. Retries are configured under {@code pipeline.analysis}.
 */
@ConfigurationProperties(prefix = "analyzer")
@Validated
public record AnalyzerProperties(
    @NotBlank String baseUrl, @Positive int connectTimeout, @Positive int readTimeout) {}
