package com.scholary.video.transcriber.transcription;

/**
 * Outcome of a transcription request.
 *
 * <p>Either a {@link BackendResult} (one backend requested) or a {@link MultiBackendResult}
 * (several backends requested, one nested result per backend).
 */
public interface TranscriptionResult {

  boolean success();

  /** The requested method ({@code whisper}, {@code google} or {@code both}). */
  String method();

  /** Human-readable failure cause; null on success. */
  String error();
}
