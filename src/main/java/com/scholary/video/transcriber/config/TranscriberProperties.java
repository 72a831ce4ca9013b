package com.scholary.video.transcriber.config;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job processing.
 *
 * <p>Controls which URLs are accepted and how many jobs and backend calls run at once.
 *
 * @param allowedHosts host substrings a submitted URL must contain (any one of them)
 * @param asyncExecutorThreads worker threads running job pipelines
 * @param asyncExecutorQueueSize jobs that may wait for a worker
 * @param backendExecutorThreads threads running speech backends for multi-backend requests
 * @param requireAnyBackendSuccess when true, a multi-backend result only counts as successful if
 *     at least one backend succeeded
 */
@ConfigurationProperties(prefix = "transcriber")
@Validated
public record TranscriberProperties(
    @NotEmpty List<String> allowedHosts,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize,
    @Positive int backendExecutorThreads,
    boolean requireAnyBackendSuccess) {}
