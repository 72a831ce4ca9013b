package com.scholary.video.transcriber.service;

/** Stops a job's pipeline at the next stage boundary after it was cancelled. */
public class JobCancelledException extends RuntimeException {

  public JobCancelledException() {
    super("Job cancelled");
  }
}
