/*
 * Where: Cron API model
 * What: Response of a triggered batch run
 * Why: Keeps the summary shape the scheduler integration already reads
 */
package com.manageros.cron.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.manageros.cron.service.CronRunOutcome;
import com.manageros.cron.service.CronRunSummary;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record CronRunResponse(
    boolean success,
    String message,
    String runId,
    boolean dryRun,
    Summary summary,
    Instant timestamp) {

  public static CronRunResponse from(CronRunSummary summary, boolean verbose, Instant timestamp) {
    final List<Result> results =
        summary.results().stream().map(outcome -> Result.from(outcome, verbose)).toList();
    return new CronRunResponse(
        true,
        "Cron jobs executed successfully",
        summary.runId(),
        summary.dryRun(),
        new Summary(
            summary.totalJobs(),
            summary.successfulJobs(),
            summary.failedJobs(),
            summary.totalNotifications(),
            results),
        timestamp);
  }

  public record Summary(
      int totalJobs,
      int successfulJobs,
      int failedJobs,
      int totalNotifications,
      List<Result> results) {

    public Summary {
      results = results == null ? List.of() : List.copyOf(results);
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Result(
      String jobId,
      String jobName,
      String organizationId,
      UUID executionId,
      boolean success,
      int notificationsCreated,
      String error,
      Map<String, Object> metadata) {

    static Result from(CronRunOutcome outcome, boolean verbose) {
      return new Result(
          outcome.jobId(),
          outcome.jobName(),
          outcome.organizationId(),
          outcome.executionId(),
          outcome.success(),
          outcome.notificationsCreated(),
          outcome.error(),
          verbose ? outcome.metadata() : null);
    }
  }
}
