package com.scholary.video.transcriber.transcription;

import java.util.List;

/**
 * Raw output of a speech backend.
 *
 * <p>Backends that do not produce timing information return an empty segment list.
 */
public record BackendTranscript(String text, String language, List<TranscriptSegment> segments) {

  public BackendTranscript {
    text = text == null ? "" : text.trim();
    segments = segments == null ? List.of() : List.copyOf(segments);
  }
}
