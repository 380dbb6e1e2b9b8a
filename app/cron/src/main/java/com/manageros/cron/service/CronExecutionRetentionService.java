/*
 * Where: Cron service layer
 * What: Applies the retention policy to execution records
 * Why: Keep the audit table bounded and report records a crashed run left RUNNING before they go
 */
package com.manageros.cron.service;

import com.manageros.cron.config.CronRetentionProperties;
import com.manageros.cron.repository.CronJobExecutionRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CronExecutionRetentionService {

  private static final Logger logger =
      LoggerFactory.getLogger(CronExecutionRetentionService.class);

  private final CronJobExecutionRepository executionRepository;
  private final CronJobExecutionService executionService;
  private final CronRetentionProperties properties;
  private final Clock clock;

  /** Returns the number of deleted records, or 0 when retention is disabled. */
  public int cleanup() {
    if (!properties.enabled()) {
      return 0;
    }
    final Instant threshold =
        Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int staleRunningCount = executionRepository.countStaleRunning(threshold);
    if (staleRunningCount > 0) {
      logger.error(
          "cron retention deleting stale running executions count={} threshold={}",
          staleRunningCount,
          threshold);
    }
    return executionService.cleanupOldExecutions(properties.retentionDays());
  }
}
