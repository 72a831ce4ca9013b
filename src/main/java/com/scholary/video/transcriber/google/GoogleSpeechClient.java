package com.scholary.video.transcriber.google;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.video.transcriber.transcription.BackendTranscript;
import com.scholary.video.transcriber.transcription.SpeechBackend;
import com.scholary.video.transcriber.transcription.SpeechBackendException;
import com.scholary.video.transcriber.transcription.SpeechNotRecognizedException;
import com.scholary.video.transcriber.transcription.TranscriptionOptions;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Speech backend calling the Google Speech-to-Text REST API.
 *
 * <p>The API only accepts a few encodings, so the audio is first converted with ffmpeg to 16 kHz
 * mono LINEAR16 WAV in a temporary file. Recognition runs in the primary language and, when it
 * yields nothing, once more in the fallback language. The temporary file is always deleted.
 *
 * <p>The synchronous {@code speech:recognize} endpoint only accepts about one minute of audio;
 * the API rejects longer files and the failure is reported as a {@link SpeechBackendException}.
 * Whole videos need {@code longrunningrecognize} with audio staged in Cloud Storage, which this
 * client does not do.
 */
@Component
public class GoogleSpeechClient implements SpeechBackend {

  private static final Logger LOGGER = LoggerFactory.getLogger(GoogleSpeechClient.class);

  public static final String NAME = "google";

  private static final int SAMPLE_RATE_HERTZ = 16_000;

  private final GoogleSpeechProperties properties;
  private final ObjectMapper objectMapper;
  private final HttpClient httpClient;

  public GoogleSpeechClient(GoogleSpeechProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Google Speech client: endpoint={}, apiKeyConfigured={}, languages={}/{}",
        properties.endpoint(),
        properties.hasApiKey(),
        properties.primaryLanguage(),
        properties.fallbackLanguage());
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public BackendTranscript transcribe(Path audioFile, TranscriptionOptions options) {
    if (!properties.hasApiKey()) {
      throw new SpeechBackendException("Google Speech API 키가 설정되지 않았습니다");
    }

    Path wav = convertToWav(audioFile);
    try {
      String content = Base64.getEncoder().encodeToString(Files.readAllBytes(wav));

      Optional<String> text = recognize(content, properties.primaryLanguage());
      if (text.isEmpty()) {
        LOGGER.info(
            "Nothing recognized in {}, retrying in {}",
            properties.primaryLanguage(),
            properties.fallbackLanguage());
        text = recognize(content, properties.fallbackLanguage());
      }

      return new BackendTranscript(
          text.orElseThrow(() -> new SpeechNotRecognizedException("음성을 인식할 수 없습니다")),
          properties.primaryLanguage(),
          List.of());
    } catch (IOException e) {
      throw new SpeechBackendException("오디오 파일을 읽을 수 없습니다: " + e.getMessage(), e);
    } finally {
      try {
        Files.deleteIfExists(wav);
      } catch (IOException e) {
        LOGGER.warn("Failed to delete temporary WAV {}: {}", wav, e.getMessage());
      }
    }
  }

  /** Run one recognize request; empty when the API found no speech. */
  private Optional<String> recognize(String base64Audio, String languageCode) {
    ObjectNode request = objectMapper.createObjectNode();
    ObjectNode config = request.putObject("config");
    config.put("encoding", "LINEAR16");
    config.put("sampleRateHertz", SAMPLE_RATE_HERTZ);
    config.put("languageCode", languageCode);
    config.put("enableAutomaticPunctuation", true);
    request.putObject("audio").put("content", base64Audio);

    try {
      String body = postRecognize(objectMapper.writeValueAsString(request));
      return parseTranscript(objectMapper.readTree(body));
    } catch (IOException e) {
      throw new SpeechBackendException("Google API 오류: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SpeechBackendException("Google 음성 인식이 중단되었습니다", e);
    }
  }

  /**
   * POST a recognize request and return the response body.
   *
   * @throws IOException on transport failure or a non-200 response
   */
  protected String postRecognize(String requestJson) throws IOException, InterruptedException {
    URI uri =
        URI.create(
            properties.endpoint()
                + "?key="
                + URLEncoder.encode(properties.apiKey(), StandardCharsets.UTF_8));

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json; charset=utf-8")
            .POST(HttpRequest.BodyPublishers.ofString(requestJson, StandardCharsets.UTF_8))
            .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    if (response.statusCode() != 200) {
      throw new IOException(
          String.format("status %d: %s", response.statusCode(), response.body()));
    }
    return response.body();
  }

  /**
   * Convert audio to 16 kHz mono LINEAR16 WAV in a temporary file.
   *
   * @throws SpeechBackendException if ffmpeg fails or times out
   */
  protected Path convertToWav(Path audioFile) {
    Path wav;
    try {
      wav = Files.createTempFile("google-speech-", ".wav");
    } catch (IOException e) {
      throw new SpeechBackendException("임시 파일을 만들 수 없습니다: " + e.getMessage(), e);
    }

    List<String> cmd = new ArrayList<>();
    cmd.add(properties.ffmpegBinary());
    cmd.addAll(
        List.of(
            "-y",
            "-loglevel", "error",
            "-i", audioFile.toString(),
            "-ac", "1",
            "-ar", String.valueOf(SAMPLE_RATE_HERTZ),
            "-acodec", "pcm_s16le",
            wav.toString()));

    LOGGER.debug("Executing: {}", String.join(" ", cmd));

    try {
      Process process =
          new ProcessBuilder(cmd)
              .redirectErrorStream(true)
              .redirectOutput(ProcessBuilder.Redirect.DISCARD)
              .start();
      boolean finished =
          process.waitFor(properties.conversionTimeoutSeconds(), TimeUnit.SECONDS);
      if (!finished) {
        process.destroyForcibly();
        throw new SpeechBackendException("오디오 변환 시간이 초과되었습니다");
      }
      if (process.exitValue() != 0) {
        throw new SpeechBackendException("오디오 변환 실패: ffmpeg exit " + process.exitValue());
      }
      return wav;
    } catch (IOException e) {
      deleteQuietly(wav);
      throw new SpeechBackendException("오디오 변환 실패: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      deleteQuietly(wav);
      throw new SpeechBackendException("오디오 변환이 중단되었습니다", e);
    } catch (SpeechBackendException e) {
      deleteQuietly(wav);
      throw e;
    }
  }

  /** Join the best alternative of every result; empty when there is no transcript. */
  static Optional<String> parseTranscript(JsonNode response) {
    List<String> parts = new ArrayList<>();
    for (JsonNode result : response.path("results")) {
      String transcript = result.path("alternatives").path(0).path("transcript").asText("");
      if (!transcript.isBlank()) {
        parts.add(transcript.trim());
      }
    }
    return parts.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", parts));
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
    }
  }
}
