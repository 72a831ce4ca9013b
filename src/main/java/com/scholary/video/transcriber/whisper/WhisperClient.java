package com.scholary.video.transcriber.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.transcriber.transcription.BackendTranscript;
import com.scholary.video.transcriber.transcription.SpeechBackend;
import com.scholary.video.transcriber.transcription.SpeechBackendException;
import com.scholary.video.transcriber.transcription.TranscriptSegment;
import com.scholary.video.transcriber.transcription.TranscriptionOptions;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for calling the faster-whisper transcription API.
 *
 * <p>This handles the low-level HTTP communication: building multipart requests, sending files,
 * parsing responses, and retrying on transient failures.
 *
 * <p>Returns raw byte[] bodies without manually setting Content-Length to avoid byte/char encoding
 * mismatches.
 */
@Component
public class WhisperClient implements SpeechBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  public static final String NAME = "whisper";

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String name() {
    return NAME;
  }

  /**
   * Transcribe an audio file.
   *
   * <p>Sends the audio file to the Whisper API as multipart/form-data together with the requested
   * model size and language. Includes retry logic for transient failures.
   *
   * @throws SpeechBackendException if transcription fails after retries
   */
  @Override
  public BackendTranscript transcribe(Path audioFile, TranscriptionOptions options) {
    String model = options.model();
    String language = options.language() != null ? options.language() : properties.language();

    LOGGER.info(
        "Transcribing with Whisper: file={}, model={}, language={}",
        audioFile.getFileName(),
        model,
        language);

    int attempt = 0;
    Exception lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return toTranscript(attemptTranscribe(audioFile, model, language));
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          // Exponential backoff with jitter
          long backoffMs = (long) (Math.pow(2, attempt) * 1000 + Math.random() * 1000);
          LOGGER.warn(
              "Whisper attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SpeechBackendException("Whisper 변환이 중단되었습니다", ie);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new SpeechBackendException("Whisper 변환이 중단되었습니다", e);
      }
    }

    throw new SpeechBackendException(
        String.format(
            "Whisper 서비스 오류 (%d회 시도): %s",
            properties.maxRetries(), lastException == null ? "" : lastException.getMessage()),
        lastException);
  }

  /**
   * Attempt a single transcription request.
   *
   * @throws IOException if the request fails
   * @throws InterruptedException if the request is interrupted
   */
  private WhisperResponse attemptTranscribe(Path audioFile, String model, String language)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    BodyPublisher bodyPublisher = buildMultipartBody(audioFile, model, language, boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/api/v1/transcribe"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(bodyPublisher)
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()));
    }

    WhisperResponse whisperResponse =
        objectMapper.readValue(response.body(), WhisperResponse.class);

    LOGGER.info(
        "Whisper transcription successful: {} segments, language={}",
        whisperResponse.segments() == null ? 0 : whisperResponse.segments().size(),
        whisperResponse.language());

    return whisperResponse;
  }

  /** Prefer the service's full text; older service versions only return segments. */
  static BackendTranscript toTranscript(WhisperResponse response) {
    List<TranscriptSegment> segments =
        response.segments() == null ? List.of() : response.segments();
    String text = response.text();
    if (text == null || text.isBlank()) {
      text =
          segments.stream()
              .map(TranscriptSegment::text)
              .filter(t -> t != null && !t.isBlank())
              .map(String::trim)
              .collect(Collectors.joining(" "));
    }
    return new BackendTranscript(text, response.language(), segments);
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>The format is:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="audio.mp3"
   * Content-Type: audio/mpeg
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * base
   * --boundary
   * Content-Disposition: form-data; name="language"
   *
   * ko
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(
      Path audioFile, String model, String language, String boundary) throws IOException {

    String filename = audioFile.getFileName().toString();
    byte[] fileBytes = Files.readAllBytes(audioFile);

    StringBuilder sb = new StringBuilder();

    // File part
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: ").append(contentType(filename)).append("\r\n\r\n");

    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    if (model != null && !model.isBlank()) {
      appendField(sb, boundary, "model", model);
    }
    appendField(sb, boundary, "language", language);
    appendField(sb, boundary, "task", "transcribe");

    // End boundary
    sb.append("--").append(boundary).append("--\r\n");

    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    byte[] body = new byte[prefix.length + fileBytes.length + suffix.length];
    System.arraycopy(prefix, 0, body, 0, prefix.length);
    System.arraycopy(fileBytes, 0, body, prefix.length, fileBytes.length);
    System.arraycopy(suffix, 0, body, prefix.length + fileBytes.length, suffix.length);

    return BodyPublishers.ofByteArray(body);
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }

  private static String contentType(String filename) {
    String lower = filename.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".mp3")) {
      return "audio/mpeg";
    }
    if (lower.endsWith(".wav")) {
      return "audio/wav";
    }
    return "application/octet-stream";
  }
}
