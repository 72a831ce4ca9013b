package com.scholary.video.transcriber.summarization;

/**
 * Exception thrown when no summary could be produced because the last-resort summarizer itself
 * failed.
 */
public class SummarizationException extends RuntimeException {

  public SummarizationException(String message) {
    super(message);
  }

  public SummarizationException(String message, Throwable cause) {
    super(message, cause);
  }
}
