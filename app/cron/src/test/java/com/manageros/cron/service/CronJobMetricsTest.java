package com.manageros.cron.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class CronJobMetricsTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final CronJobMetrics metrics = new CronJobMetrics(registry);

  @Test
  void executionsAreCountedPerJobAndOutcome() {
    metrics.recordExecution("birthday-notification", true, Duration.ofMillis(40));
    metrics.recordExecution("birthday-notification", true, Duration.ofMillis(60));
    metrics.recordExecution("birthday-notification", false, Duration.ofMillis(10));

    assertThat(
            registry
                .get(CronJobMetrics.METRIC_EXECUTIONS_TOTAL)
                .tags("job", "birthday-notification", "result", "completed")
                .counter()
                .count())
        .isEqualTo(2.0);
    assertThat(
            registry
                .get(CronJobMetrics.METRIC_EXECUTIONS_TOTAL)
                .tags("job", "birthday-notification", "result", "failed")
                .counter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            registry
                .get(CronJobMetrics.METRIC_EXECUTION_DURATION)
                .tags("job", "birthday-notification")
                .timer()
                .count())
        .isEqualTo(3);
  }

  @Test
  void notificationCountsSkipZeroes() {
    metrics.recordNotifications("overdue-tasks-notification", 3, 0);

    assertThat(
            registry
                .get(CronJobMetrics.METRIC_NOTIFICATIONS_CREATED)
                .tags("job", "overdue-tasks-notification")
                .counter()
                .count())
        .isEqualTo(3.0);
    assertThat(registry.find(CronJobMetrics.METRIC_NOTIFICATIONS_SUPPRESSED).counter()).isNull();
  }
}
