package com.cario.insight.app.queue;

/** Hands a submitted job to a worker and returns immediately. */
public interface JobQueue {

  /**
   * @return false when the job is already queued or running
   * @throws com.cario.insight.app.exception.PipelineException when no worker can accept the job
   */
  boolean enqueue(String jobId);
}
