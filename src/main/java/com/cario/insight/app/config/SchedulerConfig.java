package com.cario.insight.app.config;

import com.cario.insight.app.queue.StaleJobSweeper;
import com.cario.insight.app.repository.InsightRecordStore;
import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools of the service.
 *
 * <ul>
 *   <li>{@code insightWorkerExecutor} - runs whole jobs taken from the queue.
 *   <li>{@code insightAnalyzerExecutor} - runs the stages of each job so they can be interrupted.
 *   <li>{@code taskScheduler} - drives the stale job sweeper.
 * </ul>
 *
 * @author Shaji Nair
 * @version 1.0
 * @since 2025-10-02
 */
@Log4j2
@Configuration
@EnableScheduling
public class SchedulerConfig {

  @Value("${scheduled.threadpool.size:2}")
  private int poolSize;

  @Value("${scheduled.threadpool.await-termination-seconds:30}")
  private int awaitTerminationSeconds;

  /** Dedicated scheduler pool for @Scheduled jobs with graceful shutdown and error logging. */
  @Bean
  public ThreadPoolTaskScheduler taskScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(poolSize);
    scheduler.setThreadNamePrefix("insight-sweeper-");

    // Log any uncaught exception thrown by @Scheduled methods
    scheduler.setErrorHandler(t -> log.error("Uncaught exception in scheduled task", t));

    scheduler.setWaitForTasksToCompleteOnShutdown(true);
    scheduler.setAwaitTerminationSeconds(awaitTerminationSeconds);
    scheduler.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

    scheduler.initialize();
    log.info(
        "ThreadPoolTaskScheduler initialized poolSize={} awaitTerminationSeconds={}",
        poolSize,
        awaitTerminationSeconds);
    return scheduler;
  }

  /** Runs whole jobs; a full queue rejects the submission instead of blocking the caller. */
  @Bean
  public ThreadPoolTaskExecutor insightWorkerExecutor(InsightProperties props) {
    InsightProperties.Pipeline p = props.getPipeline();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(p.getWorkerThreads());
    executor.setMaxPoolSize(p.getWorkerThreads());
    executor.setQueueCapacity(p.getQueueCapacity());
    executor.setThreadNamePrefix("insight-worker-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
    executor.initialize();
    log.info(
        "insight.workers initialized threads={} queueCapacity={}",
        p.getWorkerThreads(),
        p.getQueueCapacity());
    return executor;
  }

  /** Runs the analyzers of a job concurrently. Unbounded queue: never runs on the caller. */
  @Bean
  public ThreadPoolTaskExecutor insightAnalyzerExecutor(InsightProperties props) {
    InsightProperties.Pipeline p = props.getPipeline();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(p.getAnalyzerThreads());
    executor.setMaxPoolSize(p.getAnalyzerThreads());
    executor.setThreadNamePrefix("insight-analyzer-");
    executor.initialize();
    log.info("insight.analyzers initialized threads={}", p.getAnalyzerThreads());
    return executor;
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "insight.sweeper",
      name = "enabled",
      havingValue = "true",
      matchIfMissing = true)
  public StaleJobSweeper staleJobSweeper(
      InsightRecordStore store, InsightProperties props, Clock clock) {
    return new StaleJobSweeper(
        store, props.getPipeline().getJobTimeout(), props.getSweeper().getGrace(), clock);
  }
}
