package com.scholary.video.transcriber.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper API client.
 *
 * <p>These control how we connect to the faster-whisper service and handle timeouts/retries.
 *
 * @param baseUrl base URL of the faster-whisper HTTP service
 * @param connectTimeout connect timeout in seconds
 * @param readTimeout request timeout in seconds
 * @param maxRetries attempts before giving up
 * @param language language sent with every request unless the job asks for another one
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @NotBlank String language) {}
