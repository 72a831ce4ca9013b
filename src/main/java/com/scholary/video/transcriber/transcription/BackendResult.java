package com.scholary.video.transcriber.transcription;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Result of running a single speech backend.
 *
 * <p>A failed result carries empty text and the failure cause in {@code error}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackendResult(
    String text,
    String language,
    List<TranscriptSegment> segments,
    boolean success,
    String method,
    String error)
    implements TranscriptionResult {

  public static BackendResult of(String method, BackendTranscript transcript) {
    return new BackendResult(
        transcript.text(), transcript.language(), transcript.segments(), true, method, null);
  }

  public static BackendResult failure(String method, String error) {
    return new BackendResult("", null, null, false, method, error);
  }
}
