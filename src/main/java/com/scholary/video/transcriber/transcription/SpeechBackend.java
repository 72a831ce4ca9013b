package com.scholary.video.transcriber.transcription;

import java.nio.file.Path;

/**
 * A speech-to-text engine.
 *
 * <p>Implementations are registered as Spring beans and looked up by {@link #name()}, which is
 * also the name used in requests ({@code whisper}, {@code google}).
 */
public interface SpeechBackend {

  String name();

  /**
   * Transcribe an audio file.
   *
   * @param audioFile an existing, non-empty audio file
   * @param options request hints
   * @return the recognized transcript
   * @throws SpeechBackendException if the backend is unavailable or cannot recognize speech
   */
  BackendTranscript transcribe(Path audioFile, TranscriptionOptions options);
}
