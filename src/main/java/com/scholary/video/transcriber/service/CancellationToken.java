package com.scholary.video.transcriber.service;

/** Cooperative cancellation flag shared between a job's pipeline and whoever cancels it. */
public class CancellationToken {

  private volatile boolean cancelled;

  public void cancel() {
    cancelled = true;
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Called by the pipeline at stage boundaries.
   *
   * @throws JobCancelledException if the job has been cancelled
   */
  public void throwIfCancelled() {
    if (cancelled) {
      throw new JobCancelledException();
    }
  }
}
