package com.scholary.video.transcriber.job;

/** Thrown when a job id is not (or no longer) present in the job store. */
public class JobNotFoundException extends RuntimeException {

  private final String jobId;

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
