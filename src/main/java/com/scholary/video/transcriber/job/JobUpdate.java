package com.scholary.video.transcriber.job;

import com.scholary.video.transcriber.download.VideoInfo;
import com.scholary.video.transcriber.transcription.TranscriptionResult;

/**
 * Partial set of job fields to merge into a stored {@link Job}. Null fields are left untouched.
 */
public record JobUpdate(
    JobStage stage,
    String statusDetail,
    VideoInfo video,
    TranscriptionResult result,
    String error) {

  public static JobUpdate stage(JobStage stage, String statusDetail) {
    return new JobUpdate(stage, statusDetail, null, null, null);
  }

  public static JobUpdate video(VideoInfo video) {
    return new JobUpdate(null, null, video, null, null);
  }

  public static JobUpdate completed(TranscriptionResult result) {
    return new JobUpdate(JobStage.COMPLETED, null, null, result, null);
  }

  public static JobUpdate failed(String error) {
    return new JobUpdate(JobStage.FAILED, null, null, null, error);
  }
}
