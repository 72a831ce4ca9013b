package com.scholary.video.transcriber.job;

import java.util.Optional;

/**
 * Keyed registry of job snapshots.
 *
 * <p>Only create, update and lookup by id are exposed; how (and when) jobs are evicted is up to
 * the implementation.
 */
public interface JobStore {

  /**
   * Register a new job in the {@link JobStage#SUBMITTED} stage.
   *
   * @param id unique job id
   * @return the created job
   */
  Job create(String id);

  /**
   * Merge fields into an existing job.
   *
   * <p>Updates for unknown ids, updates that would move the stage backwards and updates to a job
   * that already reached a terminal stage are ignored.
   *
   * @param id the job id
   * @param update the fields to merge
   * @return true if the update was applied
   */
  boolean update(String id, JobUpdate update);

  /**
   * Look up a job.
   *
   * @param id the job id
   * @return the current snapshot, or empty if the job is unknown or was evicted
   */
  Optional<Job> get(String id);
}
