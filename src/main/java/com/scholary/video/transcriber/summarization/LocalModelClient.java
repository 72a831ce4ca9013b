package com.scholary.video.transcriber.summarization;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Client for a local model server exposing an Ollama-style {@code /api/generate} endpoint.
 *
 * <p>Requests are non-streaming; the whole completion arrives in the {@code response} field.
 */
@Component
public class LocalModelClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalModelClient.class);

  private static final String PARAGRAPH_PROMPT =
      "다음 내용을 한국어로 한두 문장으로 요약하세요. 요약문만 답하세요.\n\n";

  private final SummarizationProperties.Local properties;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;

  public LocalModelClient(SummarizationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties.local();
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(this.properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized local model client: baseUrl={}, model={}, enabled={}",
        this.properties.baseUrl(),
        this.properties.model(),
        this.properties.enabled());
  }

  public boolean isEnabled() {
    return properties.enabled();
  }

  /**
   * Summarize one paragraph.
   *
   * @return the generated summary, or empty when the model answered with nothing
   * @throws SummaryBackendException if the model server cannot be reached or rejects the request
   */
  public Optional<String> summarizeParagraph(String text) {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("model", properties.model());
    payload.put("prompt", PARAGRAPH_PROMPT + text);
    payload.put("stream", false);

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/api/generate"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .POST(
                  HttpRequest.BodyPublishers.ofString(
                      objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8))
              .build();

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new SummaryBackendException(
            String.format(
                "Local model returned status %d: %s", response.statusCode(), response.body()));
      }

      String generated = objectMapper.readTree(response.body()).path("response").asText("").trim();
      return generated.isEmpty() ? Optional.empty() : Optional.of(generated);
    } catch (IOException e) {
      throw new SummaryBackendException("Local model unreachable: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SummaryBackendException("Local model request interrupted", e);
    }
  }
}
