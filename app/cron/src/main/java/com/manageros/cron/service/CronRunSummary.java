package com.manageros.cron.service;

import java.util.List;

public record CronRunSummary(
    String runId,
    boolean dryRun,
    int totalJobs,
    int successfulJobs,
    int failedJobs,
    int totalNotifications,
    List<CronRunOutcome> results) {

  public CronRunSummary {
    results = results == null ? List.of() : List.copyOf(results);
  }

  public static CronRunSummary of(String runId, boolean dryRun, List<CronRunOutcome> results) {
    int successful = 0;
    int notifications = 0;
    for (CronRunOutcome outcome : results) {
      if (outcome.success()) {
        successful++;
      }
      notifications += outcome.notificationsCreated();
    }
    return new CronRunSummary(
        runId,
        dryRun,
        results.size(),
        successful,
        results.size() - successful,
        notifications,
        results);
  }

  public boolean hasFailures() {
    return failedJobs > 0;
  }
}
