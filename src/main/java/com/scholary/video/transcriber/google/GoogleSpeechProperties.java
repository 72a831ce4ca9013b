package com.scholary.video.transcriber.google;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Google Speech-to-Text client.
 *
 * @param endpoint URL of the {@code speech:recognize} REST method
 * @param apiKey API key; the backend reports itself unavailable when blank
 * @param primaryLanguage language code tried first
 * @param fallbackLanguage language code tried when the first attempt recognizes nothing
 * @param ffmpegBinary ffmpeg executable used to convert audio to LINEAR16 WAV
 * @param conversionTimeoutSeconds time limit for the ffmpeg conversion
 * @param connectTimeout connect timeout in seconds
 * @param readTimeout request timeout in seconds
 */
@ConfigurationProperties(prefix = "google-speech")
@Validated
public record GoogleSpeechProperties(
    @NotBlank String endpoint,
    String apiKey,
    @NotBlank String primaryLanguage,
    @NotBlank String fallbackLanguage,
    @NotBlank String ffmpegBinary,
    @Positive int conversionTimeoutSeconds,
    @Positive int connectTimeout,
    @Positive int readTimeout) {

  public boolean hasApiKey() {
    return apiKey != null && !apiKey.isBlank();
  }
}
