package com.scholary.video.transcriber.api;

import com.scholary.video.transcriber.config.TranscriberProperties;
import com.scholary.video.transcriber.download.AudioFormat;
import com.scholary.video.transcriber.job.Job;
import com.scholary.video.transcriber.job.JobNotFoundException;
import com.scholary.video.transcriber.job.JobStore;
import com.scholary.video.transcriber.service.CancelOutcome;
import com.scholary.video.transcriber.service.JobHandle;
import com.scholary.video.transcriber.service.JobOrchestrator;
import com.scholary.video.transcriber.service.JobRequest;
import com.scholary.video.transcriber.service.TranscriptWriter;
import com.scholary.video.transcriber.transcription.TranscriptSegment;
import com.scholary.video.transcriber.transcription.TranscriptionMethod;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for video transcription.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a transcription job (returns job ID immediately)
 *   <li>Job status polling
 *   <li>Downloading a finished transcript as text or subtitles
 *   <li>Cancelling a running job
 * </ul>
 */
@RestController
@Tag(name = "Transcription", description = "YouTube audio transcription API")
public class TranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionController.class);

  static final String INVALID_URL = "유효한 YouTube URL을 입력해주세요";

  private static final MediaType TEXT_UTF8 = new MediaType("text", "plain", StandardCharsets.UTF_8);

  private final JobOrchestrator jobOrchestrator;
  private final JobStore jobStore;
  private final TranscriptWriter transcriptWriter;
  private final List<String> allowedHosts;

  public TranscriptionController(
      JobOrchestrator jobOrchestrator,
      JobStore jobStore,
      TranscriptWriter transcriptWriter,
      TranscriberProperties properties) {
    this.jobOrchestrator = jobOrchestrator;
    this.jobStore = jobStore;
    this.transcriptWriter = transcriptWriter;
    this.allowedHosts = properties.allowedHosts();
  }

  /** Start asynchronous transcription job. */
  @PostMapping("/transcribe")
  @Operation(
      summary = "Start transcription",
      description =
          "Validate the video URL, start an asynchronous transcription job and return its ID for"
              + " status polling")
  public ResponseEntity<AsyncJobResponse> transcribe(
      @RequestParam("url") String url,
      @RequestParam(value = "format", defaultValue = "mp3") String format,
      @RequestParam(value = "method", defaultValue = "whisper") String method,
      @RequestParam(value = "model", defaultValue = "base") String model) {
    JobRequest request = validate(url, format, method, model);

    LOGGER.info(
        "Transcription request: url={}, format={}, method={}, model={}",
        request.url(),
        request.format().value(),
        request.method().value(),
        request.model());

    JobHandle handle = jobOrchestrator.submit(request);
    return ResponseEntity.accepted().body(new AsyncJobResponse(handle.jobId()));
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async job. If the job is completed, includes the full
   * transcription result.
   */
  @GetMapping("/status/{jobId}")
  @Operation(summary = "Get job status", description = "Check the status of a transcription job")
  public JobStatusResponse getJobStatus(@PathVariable String jobId) {
    return JobStatusResponse.from(findJob(jobId));
  }

  /** Download the transcript of a successfully completed job. */
  @GetMapping("/status/{jobId}/transcript")
  @Operation(
      summary = "Download transcript",
      description = "Plain text (txt) or SubRip subtitles (srt) of a completed job")
  public ResponseEntity<String> getTranscript(
      @PathVariable String jobId,
      @RequestParam(value = "format", defaultValue = "txt") String format) {
    Job job = findJob(jobId);
    if (!job.completed() || !job.success()) {
      throw new TranscriptUnavailableException("변환이 완료되지 않은 작업입니다");
    }

    String body;
    String extension = format.trim().toLowerCase(Locale.ROOT);
    switch (extension) {
      case "txt":
        body = transcriptWriter.writeText(job.result());
        break;
      case "srt":
        List<TranscriptSegment> segments = transcriptWriter.segmentsOf(job.result());
        if (segments.isEmpty()) {
          throw new TranscriptUnavailableException("자막을 만들 수 있는 구간 정보가 없습니다");
        }
        body = transcriptWriter.writeSrt(segments);
        break;
      default:
        throw new InvalidRequestException("지원하지 않는 형식입니다: " + format);
    }

    return ResponseEntity.ok()
        .contentType(TEXT_UTF8)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            "attachment; filename=\"transcript-" + jobId + "." + extension + "\"")
        .body(body);
  }

  /** Cancel a running job. */
  @PostMapping("/cancel/{jobId}")
  @Operation(summary = "Cancel job", description = "Stop a running transcription job")
  public ResponseEntity<JobStatusResponse> cancel(@PathVariable String jobId) {
    CancelOutcome outcome = jobOrchestrator.cancel(jobId);
    HttpStatus status =
        outcome == CancelOutcome.CANCELLED ? HttpStatus.ACCEPTED : HttpStatus.CONFLICT;
    return ResponseEntity.status(status).body(JobStatusResponse.from(findJob(jobId)));
  }

  private Job findJob(String jobId) {
    return jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private JobRequest validate(String url, String format, String method, String model) {
    if (url == null || allowedHosts.stream().noneMatch(url::contains)) {
      throw new InvalidRequestException(INVALID_URL);
    }

    AudioFormat audioFormat;
    try {
      audioFormat = AudioFormat.fromValue(format);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("지원하지 않는 오디오 형식입니다: " + format, e);
    }

    TranscriptionMethod transcriptionMethod;
    try {
      transcriptionMethod = TranscriptionMethod.fromValue(method);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("지원하지 않는 변환 방법입니다: " + method, e);
    }

    if (model == null || model.isBlank()) {
      throw new InvalidRequestException("모델을 지정해주세요");
    }

    return new JobRequest(url.trim(), audioFormat, transcriptionMethod, model.trim());
  }
}
