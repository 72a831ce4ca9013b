package com.scholary.video.transcriber.api;

import com.scholary.video.transcriber.job.JobNotFoundException;
import com.scholary.video.transcriber.summarization.SummarizationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 problem responses.
 *
 * <p>The {@code detail} field carries the message shown to the user.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String JOB_NOT_FOUND = "작업을 찾을 수 없습니다";

  @ExceptionHandler(InvalidRequestException.class)
  public ProblemDetail handleInvalidRequest(InvalidRequestException ex) {
    LOGGER.warn("Rejected request: {}", ex.getMessage());
    return problem(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ProblemDetail handleMissingParameter(MissingServletRequestParameterException ex) {
    LOGGER.warn("Missing request parameter: {}", ex.getParameterName());
    String detail =
        "url".equals(ex.getParameterName())
            ? TranscriptionController.INVALID_URL
            : "필수 항목이 없습니다: " + ex.getParameterName();
    return problem(HttpStatus.BAD_REQUEST, "Invalid request", detail);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getDefaultMessage())
            .orElse("잘못된 요청입니다");
    LOGGER.warn("Invalid request body: {}", detail);
    return problem(HttpStatus.BAD_REQUEST, "Invalid request", detail);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return problem(HttpStatus.BAD_REQUEST, "Invalid request", "요청 본문을 읽을 수 없습니다");
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ProblemDetail handleJobNotFound(JobNotFoundException ex) {
    LOGGER.debug("Unknown job: {}", ex.getJobId());
    return problem(HttpStatus.NOT_FOUND, "Job not found", JOB_NOT_FOUND);
  }

  @ExceptionHandler(TranscriptUnavailableException.class)
  public ProblemDetail handleTranscriptUnavailable(TranscriptUnavailableException ex) {
    return problem(HttpStatus.CONFLICT, "Transcript unavailable", ex.getMessage());
  }

  @ExceptionHandler(SummarizationException.class)
  public ProblemDetail handleSummarization(SummarizationException ex) {
    LOGGER.error("Summarization failed", ex);
    return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Summarization failed", ex.getMessage());
  }

  private static ProblemDetail problem(HttpStatus status, String title, String detail) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(title);
    return problem;
  }
}
