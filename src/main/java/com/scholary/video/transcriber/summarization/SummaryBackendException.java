package com.scholary.video.transcriber.summarization;

/** A generative model call failed: transport error, bad status or unusable response. */
public class SummaryBackendException extends RuntimeException {

  public SummaryBackendException(String message) {
    super(message);
  }

  public SummaryBackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
