package com.scholary.video.transcriber.summarization;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the generative summarization tiers.
 *
 * @param remote hosted model reached through an OpenAI-compatible API
 * @param local model served by a local runtime
 */
@ConfigurationProperties(prefix = "summarization")
@Validated
public record SummarizationProperties(@Valid @NotNull Remote remote, @Valid @NotNull Local local) {

  /**
   * @param enabled whether the remote tier may be used at all
   * @param baseUrl API base URL, {@code /chat/completions} is appended
   * @param apiKey bearer token; the tier stays off while it is blank
   * @param model model name sent with each request
   * @param connectTimeout connect timeout in seconds
   * @param readTimeout request timeout in seconds
   */
  public record Remote(
      boolean enabled,
      @NotBlank String baseUrl,
      String apiKey,
      @NotBlank String model,
      @Positive int connectTimeout,
      @Positive int readTimeout) {

    public boolean isConfigured() {
      return enabled && apiKey != null && !apiKey.isBlank();
    }
  }

  /**
   * @param enabled whether the local tier may be used at all
   * @param baseUrl model server URL, {@code /api/generate} is appended
   * @param model model name sent with each request
   * @param connectTimeout connect timeout in seconds
   * @param readTimeout request timeout in seconds
   */
  public record Local(
      boolean enabled,
      @NotBlank String baseUrl,
      @NotBlank String model,
      @Positive int connectTimeout,
      @Positive int readTimeout) {}
}
