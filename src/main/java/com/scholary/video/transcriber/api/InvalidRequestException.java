package com.scholary.video.transcriber.api;

/** A request was rejected before any work started. The message is shown to the client. */
public class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }

  public InvalidRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
