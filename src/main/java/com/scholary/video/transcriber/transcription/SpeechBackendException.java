package com.scholary.video.transcriber.transcription;

/**
 * Exception thrown when a speech backend cannot produce a transcript.
 *
 * <p>This could be due to network issues, service unavailability, or invalid responses. The
 * message is shown to the user as the backend's error.
 */
public class SpeechBackendException extends RuntimeException {

  public SpeechBackendException(String message) {
    super(message);
  }

  public SpeechBackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
