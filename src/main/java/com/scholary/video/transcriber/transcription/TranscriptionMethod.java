package com.scholary.video.transcriber.transcription;

import java.util.List;
import java.util.Locale;

/**
 * Transcription method requested by a client: a single backend, or several run side by side.
 */
public enum TranscriptionMethod {
  WHISPER("whisper", List.of("whisper")),
  GOOGLE("google", List.of("google")),
  BOTH("both", List.of("whisper", "google"));

  private final String value;
  private final List<String> backendNames;

  TranscriptionMethod(String value, List<String> backendNames) {
    this.value = value;
    this.backendNames = backendNames;
  }

  public String value() {
    return value;
  }

  /** Names of the backends this method runs, in reporting order. */
  public List<String> backendNames() {
    return backendNames;
  }

  /**
   * Resolve a method from its wire value.
   *
   * @throws IllegalArgumentException if the value is not a supported method
   */
  public static TranscriptionMethod fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (TranscriptionMethod method : values()) {
        if (method.value.equals(normalized)) {
          return method;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported transcription method: " + value);
  }
}
