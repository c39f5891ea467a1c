package com.cario.insight.app.queue;

import com.cario.insight.app.exception.PipelineException;
import com.cario.insight.app.service.InsightPipelineService;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.log4j.Log4j2;

/**
 * Worker-pool queue. A job id is admitted only while it is not already queued or running, so at
 * most one pipeline execution per job exists at any time.
 */
@Log4j2
public class ExecutorJobQueue implements JobQueue {

  private final Executor workers;
  private final InsightPipelineService pipeline;
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  public ExecutorJobQueue(Executor workers, InsightPipelineService pipeline) {
    this.workers = workers;
    this.pipeline = pipeline;
  }

  @Override
  public boolean enqueue(String jobId) {
    if (!inFlight.add(jobId)) {
      log.info("queue.duplicate jobId={}", jobId);
      return false;
    }
    try {
      workers.execute(() -> run(jobId));
      log.info("queue.enqueued jobId={} inFlight={}", jobId, inFlight.size());
      return true;
    } catch (RejectedExecutionException e) {
      inFlight.remove(jobId);
      log.error("queue.rejected jobId={} msg={}", jobId, e.getMessage());
      throw new PipelineException("Worker queue is full, try again later", e);
    }
  }

  public boolean isInFlight(String jobId) {
    return inFlight.contains(jobId);
  }

  private void run(String jobId) {
    try {
      pipeline.process(jobId);
    } catch (RuntimeException e) {
      log.error("queue.jobError jobId={} msg={}", jobId, e.getMessage(), e);
    } finally {
      inFlight.remove(jobId);
    }
  }
}
