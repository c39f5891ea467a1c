package com.cario.insight.app.queue;

import com.cario.insight.app.model.FailureReason;
import com.cario.insight.app.model.InsightRecord;
import com.cario.insight.app.repository.InsightRecordStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Fails records left in {@code processing} past the job timeout plus a grace period, e.g. after a
 * worker crash, with reason {@code timeout}.
 */
@Log4j2
public class StaleJobSweeper {

  private final InsightRecordStore store;
  private final Duration maxAge;
  private final Clock clock;

  public StaleJobSweeper(
      InsightRecordStore store, Duration jobTimeout, Duration grace, Clock clock) {
    this.store = store;
    this.maxAge = jobTimeout.plus(grace);
    this.clock = clock;
  }

  @Scheduled(cron = "${insight.sweeper.cron:0 * * * * *}")
  public int sweep() {
    Instant now = Instant.now(clock);
    List<InsightRecord> stale = store.findProcessingCreatedBefore(now.minus(maxAge));
    int failed = 0;
    for (InsightRecord r : stale) {
      long ageMs = Duration.between(r.getCreatedAt(), now).toMillis();
      if (store.markFailed(r.getJobId(), FailureReason.TIMEOUT, ageMs)) {
        failed++;
        log.warn("sweeper.timeout jobId={} ageMs={}", r.getJobId(), ageMs);
      }
    }
    log.debug("sweeper.run candidates={} failed={}", stale.size(), failed);
    return failed;
  }
}
