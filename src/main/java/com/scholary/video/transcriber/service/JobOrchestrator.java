package com.scholary.video.transcriber.service;

import com.scholary.video.transcriber.download.VideoDownloader;
import com.scholary.video.transcriber.download.VideoInfo;
import com.scholary.video.transcriber.job.Job;
import com.scholary.video.transcriber.job.JobNotFoundException;
import com.scholary.video.transcriber.job.JobStage;
import com.scholary.video.transcriber.job.JobStore;
import com.scholary.video.transcriber.job.JobUpdate;
import com.scholary.video.transcriber.logging.StructuredLogger;
import com.scholary.video.transcriber.transcription.TranscriptionCoordinator;
import com.scholary.video.transcriber.transcription.TranscriptionOptions;
import com.scholary.video.transcriber.transcription.TranscriptionResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.FutureTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

/**
 * Drives transcription jobs through their pipeline.
 *
 * <p>A submitted job runs on the job executor: fetch metadata, extract audio, transcribe. Each
 * stage is recorded in the {@link JobStore} before it starts so pollers can follow along. A stage
 * that comes back empty fails the job with a stage-specific message and skips the rest. Every
 * fault is caught and recorded on the job; nothing escapes the worker thread.
 *
 * <p>The extracted audio file is deleted on every exit path.
 */
@Service
public class JobOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String ERROR_METADATA = "비디오 정보를 가져올 수 없습니다";
  static final String ERROR_EXTRACTION = "오디오 추출에 실패했습니다";
  static final String ERROR_UNKNOWN = "알 수 없는 오류";
  static final String ERROR_CANCELLED = "작업이 취소되었습니다";
  static final String ERROR_REJECTED = "작업 대기열이 가득 찼습니다. 잠시 후 다시 시도해주세요";

  private final JobStore jobStore;
  private final VideoDownloader downloader;
  private final TranscriptionCoordinator coordinator;
  private final TaskExecutor taskExecutor;

  private final Map<String, JobHandle> activeJobs = new ConcurrentHashMap<>();

  public JobOrchestrator(
      JobStore jobStore,
      VideoDownloader downloader,
      TranscriptionCoordinator coordinator,
      @Qualifier("taskExecutor") TaskExecutor taskExecutor) {
    this.jobStore = jobStore;
    this.downloader = downloader;
    this.coordinator = coordinator;
    this.taskExecutor = taskExecutor;
  }

  /**
   * Create a job and schedule its pipeline.
   *
   * <p>Returns as soon as the job is stored; the pipeline runs in the background.
   */
  public JobHandle submit(JobRequest request) {
    String jobId = UUID.randomUUID().toString();
    jobStore.create(jobId);
    LOGGER.info(
        "Created job {}: url={}, format={}, method={}, model={}",
        jobId,
        request.url(),
        request.format().value(),
        request.method().value(),
        request.model());

    CancellationToken token = new CancellationToken();
    FutureTask<Void> task = new FutureTask<>(() -> run(jobId, request, token), null);
    JobHandle handle = new JobHandle(jobId, task, token);
    activeJobs.put(jobId, handle);
    try {
      taskExecutor.execute(task);
    } catch (TaskRejectedException e) {
      LOGGER.warn("Job executor rejected job {}: {}", jobId, e.getMessage());
      activeJobs.remove(jobId);
      task.cancel(false);
      jobStore.update(jobId, JobUpdate.failed(ERROR_REJECTED));
    }
    return handle;
  }

  /**
   * Cancel a job.
   *
   * <p>The job is recorded as failed right away; its pipeline stops at the next stage boundary
   * and still releases its audio file.
   *
   * @throws JobNotFoundException if the job does not exist
   */
  public CancelOutcome cancel(String jobId) {
    Job job = jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    if (job.completed()) {
      return CancelOutcome.ALREADY_FINISHED;
    }

    JobHandle handle = activeJobs.remove(jobId);
    if (handle != null) {
      handle.cancel();
    }
    if (!jobStore.update(jobId, JobUpdate.failed(ERROR_CANCELLED))) {
      return CancelOutcome.ALREADY_FINISHED;
    }
    LOGGER.info("Cancelled job {}", jobId);
    return CancelOutcome.CANCELLED;
  }

  /** Run the pipeline for one job. Never throws. */
  void run(String jobId, JobRequest request, CancellationToken token) {
    long startMs = System.currentTimeMillis();
    StructuredLogger.setJobContext(jobId, request.url(), request.method().value());
    Path audio = null;

    try {
      token.throwIfCancelled();
      enterStage(jobId, JobStage.FETCHING_INFO, null);
      Optional<VideoInfo> info = downloader.fetchMetadata(request.url());
      if (info.isEmpty()) {
        finish(jobId, token, JobUpdate.failed(ERROR_METADATA), startMs);
        return;
      }
      jobStore.update(jobId, JobUpdate.video(info.get()));

      token.throwIfCancelled();
      enterStage(jobId, JobStage.EXTRACTING_AUDIO, request.format().value());
      Optional<Path> extracted =
          downloader.extractAudio(request.url(), request.format(), info.get().title());
      if (extracted.isEmpty()) {
        finish(jobId, token, JobUpdate.failed(ERROR_EXTRACTION), startMs);
        return;
      }
      audio = extracted.get();

      token.throwIfCancelled();
      enterStage(jobId, JobStage.TRANSCRIBING, request.method().value());
      TranscriptionResult result =
          coordinator.transcribe(
              audio, request.method(), TranscriptionOptions.ofModel(request.model()));

      release(audio);
      audio = null;

      if (result.success()) {
        finish(jobId, token, JobUpdate.completed(result), startMs);
      } else {
        String error = result.error() != null ? result.error() : ERROR_UNKNOWN;
        finish(jobId, token, JobUpdate.failed(error), startMs);
      }
    } catch (JobCancelledException e) {
      LOGGER.info("Job {} stopped after cancellation", jobId);
    } catch (Exception e) {
      LOGGER.error("Pipeline failed for job {}", jobId, e);
      String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
      finish(jobId, token, JobUpdate.failed(error), startMs);
    } finally {
      release(audio);
      activeJobs.remove(jobId);
      StructuredLogger.clearJobContext();
    }
  }

  private void enterStage(String jobId, JobStage stage, String detail) {
    jobStore.update(jobId, JobUpdate.stage(stage, detail));
    structuredLogger.logStageEntered(jobId, stage.name(), stage.statusText(detail));
  }

  /** Record the terminal update unless a cancel request already did. */
  private void finish(String jobId, CancellationToken token, JobUpdate update, long startMs) {
    if (token.isCancelled()) {
      LOGGER.info("Job {} was cancelled, dropping {} outcome", jobId, update.stage());
      return;
    }
    jobStore.update(jobId, update);
    structuredLogger.logJobFinished(
        jobId,
        update.stage() == JobStage.COMPLETED,
        System.currentTimeMillis() - startMs,
        update.error());
  }

  private void release(Path audio) {
    if (audio == null) {
      return;
    }
    try {
      if (Files.deleteIfExists(audio)) {
        LOGGER.debug("Deleted audio file {}", audio);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to delete audio file {}: {}", audio, e.getMessage());
    }
  }
}
