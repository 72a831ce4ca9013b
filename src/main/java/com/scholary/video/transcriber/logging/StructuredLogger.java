package com.scholary.video.transcriber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each event puts its fields into the MDC for the duration of one log call, so log shippers
 * can index them, and removes them again afterwards. Job context (id, url, method) stays in the
 * MDC for as long as a job's pipeline runs on the current thread.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a job entering a pipeline stage. */
  public void logStageEntered(String jobId, String stage, String status) {
    try {
      MDC.put("event_type", "job_stage");
      MDC.put("stage", stage);

      logger.info("Job stage: jobId={}, stage={}, status={}", jobId, stage, status);
    } finally {
      clearEventFields();
    }
  }

  /** Log a job reaching a terminal stage. */
  public void logJobFinished(String jobId, boolean success, long durationMs, String error) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("success", String.valueOf(success));
      MDC.put("durationMs", String.valueOf(durationMs));

      if (success) {
        logger.info("Job finished: jobId={}, duration={}ms", jobId, durationMs);
      } else {
        logger.warn("Job failed: jobId={}, duration={}ms, error={}", jobId, durationMs, error);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log the outcome of one speech backend call. */
  public void logBackendResult(String backend, boolean success, long durationMs, String error) {
    try {
      MDC.put("event_type", "backend_result");
      MDC.put("backend", backend);
      MDC.put("success", String.valueOf(success));
      MDC.put("durationMs", String.valueOf(durationMs));

      if (success) {
        logger.info("Backend finished: backend={}, duration={}ms", backend, durationMs);
      } else {
        logger.warn(
            "Backend failed: backend={}, duration={}ms, error={}", backend, durationMs, error);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log which summarization tier answered, or why one was skipped. */
  public void logSummaryTier(String mode, String tier, String outcome) {
    try {
      MDC.put("event_type", "summary_tier");
      MDC.put("mode", mode);
      MDC.put("tier", tier);
      MDC.put("outcome", outcome);

      logger.info("Summary tier: mode={}, tier={}, outcome={}", mode, tier, outcome);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String url, String method) {
    MDC.put("jobId", jobId);
    MDC.put("url", url);
    MDC.put("method", method);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("url");
    MDC.remove("method");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("success");
    MDC.remove("durationMs");
    MDC.remove("backend");
    MDC.remove("mode");
    MDC.remove("tier");
    MDC.remove("outcome");
  }
}
