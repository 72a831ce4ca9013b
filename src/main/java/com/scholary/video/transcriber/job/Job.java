package com.scholary.video.transcriber.job;

import com.scholary.video.transcriber.download.VideoInfo;
import com.scholary.video.transcriber.transcription.TranscriptionResult;
import java.time.Instant;

/**
 * Snapshot of an asynchronous transcription job.
 *
 * <p>Jobs are immutable: every update produces a new snapshot that replaces the previous one in
 * the {@link JobStore}. {@code result} is only present on a completed job and {@code error} only
 * on a failed one.
 */
public record Job(
    String id,
    JobStage stage,
    String status,
    boolean completed,
    boolean success,
    TranscriptionResult result,
    String error,
    VideoInfo video,
    Instant createdAt) {

  public static Job submitted(String id, Instant createdAt) {
    return new Job(
        id,
        JobStage.SUBMITTED,
        JobStage.SUBMITTED.statusText(),
        false,
        false,
        null,
        null,
        null,
        createdAt);
  }

  /** Whether the update respects the stage ordering and terminal-state rules. */
  public boolean accepts(JobUpdate update) {
    if (completed) {
      return false;
    }
    return update.stage() == null || stage.canAdvanceTo(update.stage());
  }

  /** Merge the non-null fields of the update into a new snapshot. */
  public Job apply(JobUpdate update) {
    JobStage nextStage = update.stage() != null ? update.stage() : stage;
    String nextStatus =
        update.stage() != null ? update.stage().statusText(update.statusDetail()) : status;
    VideoInfo nextVideo = update.video() != null ? update.video() : video;

    return new Job(
        id,
        nextStage,
        nextStatus,
        nextStage.isTerminal(),
        nextStage == JobStage.COMPLETED,
        nextStage == JobStage.COMPLETED ? update.result() : null,
        nextStage == JobStage.FAILED ? update.error() : null,
        nextVideo,
        createdAt);
  }
}
