package com.manageros.cron.model;

/**
 * Aggregated execution counts over a reporting window.
 *
 * <p>{@code successRate} is a percentage of completed executions among terminal ones; running
 * executions are not counted against it.
 */
public record CronJobExecutionStats(
    int totalExecutions,
    int completedExecutions,
    int failedExecutions,
    int runningExecutions,
    double successRate,
    long totalNotifications) {

  public static CronJobExecutionStats of(
      int completed, int failed, int running, long totalNotifications) {
    final int terminal = completed + failed;
    final double successRate = terminal == 0 ? 0.0d : (completed * 100.0d) / terminal;
    return new CronJobExecutionStats(
        completed + failed + running, completed, failed, running, successRate, totalNotifications);
  }
}
