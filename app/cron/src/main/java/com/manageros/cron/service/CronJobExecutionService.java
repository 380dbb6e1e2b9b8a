/*
 * Where: Cron service layer
 * What: Opens, closes and reports on execution records
 * Why: Every (job, organization) invocation leaves exactly one auditable record
 */
package com.manageros.cron.service;

import com.google.common.annotations.VisibleForTesting;
import com.manageros.cron.config.CronExecutionProperties;
import com.manageros.cron.model.CronJobExecutionRecord;
import com.manageros.cron.model.CronJobExecutionStats;
import com.manageros.cron.model.ExecutionStatus;
import com.manageros.cron.repository.CronJobExecutionRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CronJobExecutionService {

  private static final Logger logger = LoggerFactory.getLogger(CronJobExecutionService.class);

  private final CronJobExecutionRepository executionRepository;
  private final MetadataJson metadataJson;
  private final CronExecutionProperties properties;
  private final Clock clock;

  public UUID startExecution(
      String jobId, String jobName, String organizationId, Map<String, Object> metadata) {
    final CronJobExecutionRecord record =
        new CronJobExecutionRecord(
            UUID.randomUUID(),
            jobId,
            jobName,
            organizationId,
            ExecutionStatus.RUNNING,
            Instant.now(clock),
            null,
            0,
            null,
            metadataJson.write(metadata));
    final UUID executionId = executionRepository.insert(record);
    logger.debug(
        "cron execution started executionId={} jobId={} organizationId={}",
        executionId,
        jobId,
        organizationId);
    return executionId;
  }

  /** Returns false when the record was not RUNNING, in which case nothing changed. */
  public boolean completeExecution(
      UUID executionId, int notificationsCreated, Map<String, Object> metadata) {
    final int updated =
        executionRepository.markCompleted(
            executionId, Instant.now(clock), notificationsCreated, metadataJson.write(metadata));
    return transitioned(updated, executionId, ExecutionStatus.COMPLETED);
  }

  public boolean failExecution(UUID executionId, String error, Map<String, Object> metadata) {
    return failExecution(executionId, error, 0, metadata);
  }

  public boolean failExecution(
      UUID executionId, String error, int notificationsCreated, Map<String, Object> metadata) {
    final int updated =
        executionRepository.markFailed(
            executionId,
            Instant.now(clock),
            notificationsCreated,
            truncate(error),
            metadataJson.write(metadata));
    return transitioned(updated, executionId, ExecutionStatus.FAILED);
  }

  public Optional<CronJobExecutionRecord> getExecution(UUID executionId) {
    return executionRepository.findById(executionId);
  }

  /** Newest first; {@code organizationId} null means every organization. */
  public List<CronJobExecutionRecord> getRecentExecutions(String organizationId, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return executionRepository.findRecent(
        organizationId, Math.min(limit, properties.maxListLimit()));
  }

  public CronJobExecutionStats getExecutionStats(String organizationId, int daysBack) {
    if (daysBack <= 0) {
      throw new IllegalArgumentException("daysBack must be positive");
    }
    final Instant since = Instant.now(clock).minus(Duration.ofDays(daysBack));
    return executionRepository.aggregateSince(organizationId, since);
  }

  /** Deletes every record started before the horizon, including abandoned RUNNING rows. */
  public int cleanupOldExecutions(int daysToKeep) {
    if (daysToKeep <= 0) {
      throw new IllegalArgumentException("daysToKeep must be positive");
    }
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(daysToKeep));
    final int deleted = executionRepository.deleteOlderThan(threshold);
    logger.info("cron execution cleanup deleted={} threshold={}", deleted, threshold);
    return deleted;
  }

  @VisibleForTesting
  String truncate(String error) {
    if (error == null) {
      return null;
    }
    final int max = properties.errorMessageMaxLength();
    return error.length() <= max ? error : error.substring(0, max);
  }

  private boolean transitioned(int updated, UUID executionId, ExecutionStatus target) {
    if (updated == 0) {
      logger.warn(
          "cron execution transition ignored because record is not running executionId={} target={}",
          executionId,
          target);
      return false;
    }
    return true;
  }
}
