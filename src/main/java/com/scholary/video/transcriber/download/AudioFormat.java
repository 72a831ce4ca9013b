package com.scholary.video.transcriber.download;

import java.util.Locale;

/** Audio container formats the downloader can extract to. */
public enum AudioFormat {
  MP3("mp3"),
  WAV("wav");

  private final String value;

  AudioFormat(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Resolve a format from its wire value.
   *
   * @throws IllegalArgumentException if the value is not a supported format
   */
  public static AudioFormat fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (AudioFormat format : values()) {
        if (format.value.equals(normalized)) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported audio format: " + value);
  }
}
