package com.scholary.video.transcriber.service;

/** What a cancel request did. */
public enum CancelOutcome {
  /** The job was still running and has been told to stop. */
  CANCELLED,
  /** The job had already completed or failed; nothing changed. */
  ALREADY_FINISHED
}
