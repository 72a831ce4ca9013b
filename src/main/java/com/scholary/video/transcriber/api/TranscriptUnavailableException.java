package com.scholary.video.transcriber.api;

/** The job exists but has no transcript to download yet, or none in the requested format. */
public class TranscriptUnavailableException extends RuntimeException {

  public TranscriptUnavailableException(String message) {
    super(message);
  }
}
