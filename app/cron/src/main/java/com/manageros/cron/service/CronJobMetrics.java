/*
 * Where: Cron service layer
 * What: Records per-job execution outcomes, durations and notification counts
 * Why: Batch health is observable from Prometheus without reading the audit table
 */
package com.manageros.cron.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class CronJobMetrics {

  static final String METRIC_EXECUTIONS_TOTAL = "cron.job.executions.total";
  static final String METRIC_EXECUTION_DURATION = "cron.job.execution.duration";
  static final String METRIC_NOTIFICATIONS_CREATED = "cron.job.notifications.created";
  static final String METRIC_NOTIFICATIONS_SUPPRESSED = "cron.job.notifications.suppressed";

  private final MeterRegistry meterRegistry;

  public CronJobMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordExecution(String jobId, boolean success, Duration duration) {
    Counter.builder(METRIC_EXECUTIONS_TOTAL)
        .description("Cron job executions by outcome")
        .tags(Tags.of("job", jobId, "result", success ? "completed" : "failed"))
        .register(meterRegistry)
        .increment();
    if (duration != null && !duration.isNegative()) {
      Timer.builder(METRIC_EXECUTION_DURATION)
          .description("Wall time of one job execution for one organization")
          .tags(Tags.of("job", jobId))
          .register(meterRegistry)
          .record(duration);
    }
  }

  public void recordNotifications(String jobId, int created, int suppressed) {
    if (created > 0) {
      Counter.builder(METRIC_NOTIFICATIONS_CREATED)
          .description("Notifications created by cron jobs")
          .tags(Tags.of("job", jobId))
          .register(meterRegistry)
          .increment(created);
    }
    if (suppressed > 0) {
      Counter.builder(METRIC_NOTIFICATIONS_SUPPRESSED)
          .description("Notifications skipped because an equivalent one fired recently")
          .tags(Tags.of("job", jobId))
          .register(meterRegistry)
          .increment(suppressed);
    }
  }
}
