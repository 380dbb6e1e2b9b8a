/*
 * Where: Cron domain model
 * What: Snapshot of a cron_job_executions row
 * Why: Shared by the runner bookkeeping and the reporting endpoints
 */
package com.manageros.cron.model;

import java.time.Instant;
import java.util.UUID;

public record CronJobExecutionRecord(
    UUID executionId,
    String jobId,
    String jobName,
    String organizationId,
    ExecutionStatus status,
    Instant startedAt,
    Instant completedAt,
    int notificationsCreated,
    String error,
    String metadataJson) {

  public boolean isTerminal() {
    return status != ExecutionStatus.RUNNING;
  }
}
