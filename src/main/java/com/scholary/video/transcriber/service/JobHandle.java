package com.scholary.video.transcriber.service;

import java.util.concurrent.Future;

/**
 * Handle to a submitted job.
 *
 * @param jobId id to poll the job store with
 * @param future the scheduled pipeline run
 * @param token cancellation flag checked by the pipeline between stages
 */
public record JobHandle(String jobId, Future<?> future, CancellationToken token) {

  /** Flag the job as cancelled and interrupt its worker if it is running. */
  public void cancel() {
    token.cancel();
    future.cancel(true);
  }
}
