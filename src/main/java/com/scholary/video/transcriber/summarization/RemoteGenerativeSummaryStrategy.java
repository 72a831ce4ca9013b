package com.scholary.video.transcriber.summarization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Summarizes with a hosted model behind an OpenAI-compatible {@code /chat/completions} API.
 *
 * <p>The model is asked for JSON in the exact shape of each summary mode, which {@link
 * GeneratedSummaryParser} then validates. The tier is only available when it is enabled and an
 * API key is configured.
 */
@Component
public class RemoteGenerativeSummaryStrategy implements SummaryStrategy {

  private static final Logger LOGGER =
      LoggerFactory.getLogger(RemoteGenerativeSummaryStrategy.class);

  public static final String NAME = "remote_generative";

  private static final String SYSTEM_PROMPT =
      "당신은 한국어 영상 스크립트를 정리하는 편집자입니다. 요청한 JSON 형식으로만 답하세요.";

  private static final String KEY_SUMMARY_PROMPT =
      "다음 텍스트를 문단별로 핵심만 요약하세요. "
          + "형식: {\"summaries\": [{\"paragraph_summary\": \"...\"}]}\n\n";

  private static final String CURATOR_PROMPT =
      "다음 텍스트를 큐레이터처럼 정리하세요. 제목, 한 줄 요약, 서로 겹치지 않는 핵심 포인트 3개를 만드세요. "
          + "형식: {\"title\": \"...\", \"one_line_summary\": \"...\", \"key_points\": [\"...\"]}\n\n";

  private static final String TIMELINE_PROMPT =
      "다음 텍스트를 시간 순서의 구간(최대 %d개)으로 나누어 요약하세요. timestamp는 \"1-3분\" 형식, "
          + "oneline_summary는 친근한 구어체 한 문장입니다. "
          + "형식: {\"sections\": [{\"timestamp\": \"...\", \"subtitle\": \"...\", \"summary\": \"...\", "
          + "\"keywords\": [\"...\"], \"oneline_summary\": \"...\"}]}\n\n";

  private final SummarizationProperties.Remote properties;
  private final GeneratedSummaryParser parser;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;

  public RemoteGenerativeSummaryStrategy(
      SummarizationProperties properties,
      GeneratedSummaryParser parser,
      ObjectMapper objectMapper) {
    this.properties = properties.remote();
    this.parser = parser;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(this.properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized remote summarizer: baseUrl={}, model={}, available={}",
        this.properties.baseUrl(),
        this.properties.model(),
        isAvailable());
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public boolean isAvailable() {
    return properties.isConfigured();
  }

  @Override
  public Optional<List<KeySummaryItem>> keySummary(String text) {
    return parser.parseKeySummary(complete(SYSTEM_PROMPT, KEY_SUMMARY_PROMPT + text));
  }

  @Override
  public Optional<CuratorSummary> curator(String text) {
    return parser.parseCurator(complete(SYSTEM_PROMPT, CURATOR_PROMPT + text));
  }

  @Override
  public Optional<List<TimelineSection>> timeline(String text) {
    String prompt =
        String.format(TIMELINE_PROMPT, RuleBasedSummaryStrategy.MAX_TIMELINE_SECTIONS) + text;
    return parser.parseTimeline(
        complete(SYSTEM_PROMPT, prompt), RuleBasedSummaryStrategy.MAX_TIMELINE_SECTIONS);
  }

  /**
   * Send one chat completion request and return the assistant message content.
   *
   * @throws SummaryBackendException on transport failure, a non-200 status or a response without
   *     content
   */
  protected String complete(String systemPrompt, String userPrompt) {
    ObjectNode payload = objectMapper.createObjectNode();
    payload.put("model", properties.model());
    ArrayNode messages = payload.putArray("messages");
    messages.addObject().put("role", "system").put("content", systemPrompt);
    messages.addObject().put("role", "user").put("content", userPrompt);
    payload.putObject("response_format").put("type", "json_object");

    try {
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/chat/completions"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .header("Authorization", "Bearer " + properties.apiKey())
              .POST(
                  HttpRequest.BodyPublishers.ofString(
                      objectMapper.writeValueAsString(payload), StandardCharsets.UTF_8))
              .build();

      HttpResponse<String> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new SummaryBackendException(
            String.format(
                "Chat completion returned status %d: %s",
                response.statusCode(), response.body()));
      }

      JsonNode content =
          objectMapper.readTree(response.body()).path("choices").path(0).path("message").path("content");
      if (!content.isTextual()) {
        throw new SummaryBackendException("Chat completion response has no content");
      }
      return content.asText();
    } catch (IOException e) {
      throw new SummaryBackendException("Chat completion request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SummaryBackendException("Chat completion request interrupted", e);
    }
  }
}
