package com.scholary.video.transcriber.api;

/**
 * Response for async transcription request.
 *
 * <p>Returns a job ID that can be used to poll for status.
 */
public record AsyncJobResponse(String jobId) {}
