/*
 * Where: Cron job engine
 * What: Base contract every periodic notification job implements
 * Why: The engine runs, validates and deduplicates jobs without knowing their business rules
 */
package com.manageros.cron.job;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class CronJob {

  public static final String METADATA_DEDUPLICATION_KEY = "deduplicationKey";
  public static final String METADATA_JOB_ID = "jobId";
  static final String MISSING_ORGANIZATION_MESSAGE = "Organization ID is required";

  private static final Logger logger = LoggerFactory.getLogger(CronJob.class);

  private final NotificationStore notificationStore;
  protected final Clock clock;

  protected CronJob(NotificationStore notificationStore, Clock clock) {
    this.notificationStore = notificationStore;
    this.clock = clock;
  }

  public abstract String id();

  public abstract String name();

  public abstract String description();

  /** Cron expression describing when the job is meant to run. Informational only. */
  public abstract String schedule();

  public abstract Map<String, Object> getDefaultConfig();

  public abstract boolean validateConfig(Map<String, Object> config);

  /**
   * Runs the job for the organization in {@code context}. Never throws: a missing organization
   * or an exception from the job body becomes a failed result that still reports how many
   * notifications were created before the failure.
   */
  public final JobExecutionResult execute(JobExecutionContext context) {
    final String organizationId = context.organizationId();
    if (organizationId == null || organizationId.isBlank()) {
      return JobExecutionResult.failed(MISSING_ORGANIZATION_MESSAGE);
    }
    final ExecutionTally tally = new ExecutionTally();
    try {
      run(context, tally);
      return JobExecutionResult.succeeded(tally.notificationsCreated(), tally.snapshot());
    } catch (RuntimeException ex) {
      logger.warn(
          "cron job body failed jobId={} organizationId={} notificationsCreated={}",
          id(),
          organizationId,
          tally.notificationsCreated(),
          ex);
      return JobExecutionResult.failed(
          describe(ex), tally.notificationsCreated(), tally.snapshot());
    }
  }

  /** Job body. {@code context.organizationId()} is guaranteed non-blank here. */
  protected abstract void run(JobExecutionContext context, ExecutionTally tally);

  protected boolean shouldNotify(
      String userId, String organizationId, String deduplicationKey, int lookbackHours) {
    final Instant since = Instant.now(clock).minus(Duration.ofHours(lookbackHours));
    return !notificationStore.existsWithDeduplicationKeySince(
        userId, organizationId, deduplicationKey, since);
  }

  protected NotificationDraft buildNotification(NotificationDraft draft, String deduplicationKey) {
    final Map<String, Object> metadata = new LinkedHashMap<>(draft.metadata());
    metadata.put(METADATA_DEDUPLICATION_KEY, deduplicationKey);
    metadata.put(METADATA_JOB_ID, id());
    return draft.withMetadata(metadata);
  }

  /**
   * Creates {@code draft} unless the run is a dry run, in which case the notification is only
   * logged. Returns whether a notification was stored.
   */
  protected boolean publish(JobExecutionContext context, NotificationDraft draft) {
    if (context.dryRun()) {
      logger.info(
          "dry run skipped notification jobId={} organizationId={} userId={} title={} key={}",
          id(),
          draft.organizationId(),
          draft.userId(),
          draft.title(),
          draft.metadata().get(METADATA_DEDUPLICATION_KEY));
      return false;
    }
    notificationStore.create(draft);
    return true;
  }

  /**
   * Deduplicates, stamps and publishes one notification, keeping {@code tally} in step. Returns
   * whether the notification was new within the lookback window.
   */
  protected boolean notifyOnce(
      JobExecutionContext context,
      ExecutionTally tally,
      NotificationDraft draft,
      String deduplicationKey,
      int lookbackHours) {
    if (!shouldNotify(draft.userId(), draft.organizationId(), deduplicationKey, lookbackHours)) {
      tally.recordSuppressed();
      logger.debug(
          "notification suppressed jobId={} userId={} key={}",
          id(),
          draft.userId(),
          deduplicationKey);
      return false;
    }
    if (publish(context, buildNotification(draft, deduplicationKey))) {
      tally.recordCreated();
    } else {
      tally.recordSkippedForDryRun();
    }
    return true;
  }

  static String describe(RuntimeException ex) {
    final String message = ex.getMessage();
    return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
  }
}
