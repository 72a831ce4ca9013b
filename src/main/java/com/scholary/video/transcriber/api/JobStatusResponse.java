package com.scholary.video.transcriber.api;

import com.scholary.video.transcriber.download.VideoInfo;
import com.scholary.video.transcriber.job.Job;
import com.scholary.video.transcriber.job.JobStage;
import com.scholary.video.transcriber.transcription.TranscriptionResult;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job. {@code result} is set once the job completed and
 * {@code error} once it failed.
 */
public record JobStatusResponse(
    String jobId,
    String status,
    JobStage stage,
    boolean completed,
    boolean success,
    TranscriptionResult result,
    String error,
    VideoInfo video,
    Instant createdAt) {

  public static JobStatusResponse from(Job job) {
    return new JobStatusResponse(
        job.id(),
        job.status(),
        job.stage(),
        job.completed(),
        job.success(),
        job.result(),
        job.error(),
        job.video(),
        job.createdAt());
  }
}
