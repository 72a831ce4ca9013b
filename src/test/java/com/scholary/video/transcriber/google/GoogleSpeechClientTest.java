package com.scholary.video.transcriber.google;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.transcriber.transcription.BackendTranscript;
import com.scholary.video.transcriber.transcription.SpeechBackendException;
import com.scholary.video.transcriber.transcription.SpeechNotRecognizedException;
import com.scholary.video.transcriber.transcription.TranscriptionOptions;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GoogleSpeechClientTest {

  private static final String EMPTY_RESPONSE = "{}";

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private Path audio;

  @BeforeEach
  void setUp() throws IOException {
    audio = Files.write(tempDir.resolve("audio.mp3"), new byte[] {1, 2, 3});
  }

  @Test
  void transcribe_shouldUsePrimaryLanguageResult() {
    FakeGoogleSpeechClient client = new FakeGoogleSpeechClient(properties("key"));
    client.responses.add(
        "{\"results\": [{\"alternatives\": [{\"transcript\": \"안녕하세요\"}]},"
            + " {\"alternatives\": [{\"transcript\": \"반갑습니다\"}]}]}");

    BackendTranscript transcript = client.transcribe(audio, TranscriptionOptions.ofModel("base"));

    assertThat(transcript.text()).isEqualTo("안녕하세요 반갑습니다");
    assertThat(transcript.language()).isEqualTo("ko-KR");
    assertThat(transcript.segments()).isEmpty();
    assertThat(client.requests).hasSize(1);
    assertThat(client.requests.get(0)).contains("\"languageCode\":\"ko-KR\"", "LINEAR16");
  }

  @Test
  void transcribe_shouldRetryInFallbackLanguage() {
    FakeGoogleSpeechClient client = new FakeGoogleSpeechClient(properties("key"));
    client.responses.add(EMPTY_RESPONSE);
    client.responses.add("{\"results\": [{\"alternatives\": [{\"transcript\": \"hello\"}]}]}");

    BackendTranscript transcript = client.transcribe(audio, TranscriptionOptions.ofModel("base"));

    assertThat(transcript.text()).isEqualTo("hello");
    assertThat(client.requests.get(1)).contains("\"languageCode\":\"en-US\"");
  }

  @Test
  void transcribe_shouldReportNotRecognizedAndDeleteWav() {
    FakeGoogleSpeechClient client = new FakeGoogleSpeechClient(properties("key"));
    client.responses.add(EMPTY_RESPONSE);
    client.responses.add(EMPTY_RESPONSE);

    assertThatThrownBy(() -> client.transcribe(audio, TranscriptionOptions.ofModel("base")))
        .isInstanceOf(SpeechNotRecognizedException.class)
        .hasMessage("음성을 인식할 수 없습니다");
    assertThat(client.wav).doesNotExist();
  }

  @Test
  void transcribe_shouldWrapApiError() {
    FakeGoogleSpeechClient client = new FakeGoogleSpeechClient(properties("key"));
    client.failure = new IOException("status 403: forbidden");

    assertThatThrownBy(() -> client.transcribe(audio, TranscriptionOptions.ofModel("base")))
        .isInstanceOf(SpeechBackendException.class)
        .hasMessageContaining("Google API 오류")
        .hasMessageContaining("403");
    assertThat(client.wav).doesNotExist();
  }

  @Test
  void transcribe_shouldReportAudioTooLongForSyncRecognize() {
    FakeGoogleSpeechClient client = new FakeGoogleSpeechClient(properties("key"));
    client.failure =
        new IOException(
            "status 400: Sync input too long. For audio longer than 1 min use"
                + " LongRunningRecognize with a 'uri' parameter.");

    assertThatThrownBy(() -> client.transcribe(audio, TranscriptionOptions.ofModel("base")))
        .isInstanceOf(SpeechBackendException.class)
        .hasMessageContaining("Google API 오류")
        .hasMessageContaining("Sync input too long");
    assertThat(client.requests).hasSize(1);
    assertThat(client.wav).doesNotExist();
  }

  @Test
  void transcribe_shouldFailWithoutApiKey() {
    FakeGoogleSpeechClient client = new FakeGoogleSpeechClient(properties(" "));

    assertThatThrownBy(() -> client.transcribe(audio, TranscriptionOptions.ofModel("base")))
        .isInstanceOf(SpeechBackendException.class)
        .hasMessageContaining("API 키");
    assertThat(client.wav).isNull();
  }

  @Test
  void parseTranscript_shouldSkipBlankAlternatives() throws IOException {
    String json =
        "{\"results\": [{\"alternatives\": [{\"transcript\": \" \"}]}, {\"alternatives\": []}]}";

    assertThat(GoogleSpeechClient.parseTranscript(objectMapper.readTree(json))).isEmpty();
  }

  private GoogleSpeechProperties properties(String apiKey) {
    return new GoogleSpeechProperties(
        "http://localhost/v1/speech:recognize", apiKey, "ko-KR", "en-US", "ffmpeg", 60, 5, 30);
  }

  private class FakeGoogleSpeechClient extends GoogleSpeechClient {

    final Deque<String> responses = new ArrayDeque<>();
    final List<String> requests = new ArrayList<>();
    IOException failure;
    Path wav;

    FakeGoogleSpeechClient(GoogleSpeechProperties properties) {
      super(properties, objectMapper);
    }

    @Override
    protected Path convertToWav(Path audioFile) {
      try {
        wav = Files.write(tempDir.resolve("converted.wav"), new byte[] {0, 0, 0, 0});
        return wav;
      } catch (IOException e) {
        throw new SpeechBackendException(e.getMessage(), e);
      }
    }

    @Override
    protected String postRecognize(String requestJson) throws IOException {
      requests.add(requestJson);
      if (failure != null) {
        throw failure;
      }
      return responses.removeFirst();
    }
  }
}
