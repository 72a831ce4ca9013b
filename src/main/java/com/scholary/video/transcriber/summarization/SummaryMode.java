package com.scholary.video.transcriber.summarization;

import java.util.Locale;

/** Summary shapes a client can request. */
public enum SummaryMode {
  KEY_SUMMARY("key_summary"),
  CURATOR("curator"),
  TIMELINE_SUMMARY("timeline_summary");

  private final String value;

  SummaryMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Resolve a mode from its path value. {@code timeline} is accepted for {@link
   * #TIMELINE_SUMMARY}.
   *
   * @throws IllegalArgumentException if the value is not a supported mode
   */
  public static SummaryMode fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      if (normalized.equals("timeline")) {
        return TIMELINE_SUMMARY;
      }
      for (SummaryMode mode : values()) {
        if (mode.value.equals(normalized)) {
          return mode;
        }
      }
    }
    throw new IllegalArgumentException("Unsupported summary mode: " + value);
  }
}
