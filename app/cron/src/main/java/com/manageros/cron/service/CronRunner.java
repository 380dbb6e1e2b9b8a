/*
 * Where: Cron service layer
 * What: Runs jobs across organizations and keeps an execution record for every pair
 * Why: The only component that sees every organization; the CLI and HTTP trigger share it
 */
package com.manageros.cron.service;

import com.google.common.annotations.VisibleForTesting;
import com.manageros.common.RunIds;
import com.manageros.cron.config.CronRunnerProperties;
import com.manageros.cron.job.CronJob;
import com.manageros.cron.job.CronJobRegistry;
import com.manageros.cron.job.JobExecutionResult;
import com.manageros.cron.job.JobInvocation;
import com.manageros.cron.model.Organization;
import com.manageros.cron.repository.OrganizationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class CronRunner {

  private static final Logger logger = LoggerFactory.getLogger(CronRunner.class);
  static final String MDC_RUN_ID = "run_id";
  static final String MDC_JOB_ID = "job_id";
  static final String MDC_ORGANIZATION_ID = "organization_id";

  private final CronJobRegistry registry;
  private final OrganizationRepository organizationRepository;
  private final CronJobExecutionService executionService;
  private final CronExecutionRetentionService retentionService;
  private final CronJobMetrics metrics;
  private final CronRunnerProperties properties;
  private final Clock clock;

  /**
   * Runs the requested jobs for the requested organizations. Failures of a single pair are
   * recorded and reported in the summary; only failures to list organizations or to open or
   * close an execution record propagate.
   */
  public CronRunSummary run(CronRunRequest request) {
    final String runId = RunIds.newRunId(clock);
    MDC.put(MDC_RUN_ID, runId);
    try {
      final Instant startedAt = Instant.now(clock);
      final List<OrganizationTarget> organizations = resolveOrganizations(request);
      final List<JobTarget> jobs = resolveJobs(request);
      logger.info(
          "cron run started runId={} jobs={} organizations={} dryRun={}",
          runId,
          jobs.size(),
          organizations.size(),
          request.dryRun());

      final List<CronRunOutcome> outcomes =
          properties.parallelism() > 1 && organizations.size() > 1
              ? runInParallel(runId, organizations, jobs, startedAt, request.dryRun())
              : runSequentially(runId, organizations, jobs, startedAt, request.dryRun());

      final CronRunSummary summary = CronRunSummary.of(runId, request.dryRun(), outcomes);
      logger.info(
          "cron run finished runId={} totalJobs={} successfulJobs={} failedJobs={} totalNotifications={}",
          runId,
          summary.totalJobs(),
          summary.successfulJobs(),
          summary.failedJobs(),
          summary.totalNotifications());
      applyRetention();
      return summary;
    } finally {
      MDC.remove(MDC_RUN_ID);
    }
  }

  private List<OrganizationTarget> resolveOrganizations(CronRunRequest request) {
    if (request.organizationId() != null) {
      return List.of(
          new OrganizationTarget(
              request.organizationId(),
              organizationRepository.existsById(request.organizationId())));
    }
    return organizationRepository.findAll().stream()
        .map(Organization::id)
        .map(id -> new OrganizationTarget(id, true))
        .toList();
  }

  private List<JobTarget> resolveJobs(CronRunRequest request) {
    if (request.jobId() != null) {
      final String jobName =
          registry.getJob(request.jobId()).map(CronJob::name).orElse(request.jobId());
      return List.of(new JobTarget(request.jobId(), jobName));
    }
    return registry.getAllJobs().stream().map(job -> new JobTarget(job.id(), job.name())).toList();
  }

  private List<CronRunOutcome> runSequentially(
      String runId,
      List<OrganizationTarget> organizations,
      List<JobTarget> jobs,
      Instant startedAt,
      boolean dryRun) {
    final List<CronRunOutcome> outcomes = new ArrayList<>();
    for (OrganizationTarget organization : organizations) {
      outcomes.addAll(runOrganization(runId, organization, jobs, startedAt, dryRun));
    }
    return outcomes;
  }

  private List<CronRunOutcome> runInParallel(
      String runId,
      List<OrganizationTarget> organizations,
      List<JobTarget> jobs,
      Instant startedAt,
      boolean dryRun) {
    final int threads = Math.min(properties.parallelism(), organizations.size());
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      final List<Future<List<CronRunOutcome>>> futures = new ArrayList<>();
      for (OrganizationTarget organization : organizations) {
        futures.add(
            executor.submit(
                () -> {
                  MDC.put(MDC_RUN_ID, runId);
                  try {
                    return runOrganization(runId, organization, jobs, startedAt, dryRun);
                  } finally {
                    MDC.remove(MDC_RUN_ID);
                  }
                }));
      }
      final List<CronRunOutcome> outcomes = new ArrayList<>();
      for (Future<List<CronRunOutcome>> future : futures) {
        outcomes.addAll(await(future));
      }
      return outcomes;
    } finally {
      executor.shutdownNow();
    }
  }

  private List<CronRunOutcome> await(Future<List<CronRunOutcome>> future) {
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("cron run interrupted", ex);
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("cron organization run failed", ex.getCause());
    }
  }

  /** Jobs of one organization always run one after another. */
  private List<CronRunOutcome> runOrganization(
      String runId,
      OrganizationTarget organization,
      List<JobTarget> jobs,
      Instant startedAt,
      boolean dryRun) {
    final List<CronRunOutcome> outcomes = new ArrayList<>();
    for (JobTarget job : jobs) {
      outcomes.add(runPair(runId, job, organization, startedAt, dryRun));
    }
    return outcomes;
  }

  @VisibleForTesting
  CronRunOutcome runPair(
      String runId,
      JobTarget job,
      OrganizationTarget organization,
      Instant startedAt,
      boolean dryRun) {
    MDC.put(MDC_JOB_ID, job.id());
    MDC.put(MDC_ORGANIZATION_ID, organization.id());
    try {
      final Map<String, Object> startMetadata = new LinkedHashMap<>();
      startMetadata.put("runId", runId);
      startMetadata.put("dryRun", dryRun);
      final UUID executionId =
          executionService.startExecution(job.id(), job.name(), organization.id(), startMetadata);
      final Instant began = Instant.now(clock);

      final JobExecutionResult result = execute(job, organization, startedAt, dryRun);

      if (result.success()) {
        executionService.completeExecution(
            executionId, result.notificationsCreated(), result.metadata());
        logger.info(
            "cron job completed jobId={} organizationId={} notificationsCreated={}",
            job.id(),
            organization.id(),
            result.notificationsCreated());
      } else {
        executionService.failExecution(
            executionId, result.error(), result.notificationsCreated(), result.metadata());
        logger.warn(
            "cron job failed jobId={} organizationId={} notificationsCreated={} error={}",
            job.id(),
            organization.id(),
            result.notificationsCreated(),
            result.error());
      }
      metrics.recordExecution(
          job.id(), result.success(), Duration.between(began, Instant.now(clock)));
      metrics.recordNotifications(
          job.id(), result.notificationsCreated(), suppressedCount(result.metadata()));
      return new CronRunOutcome(
          job.id(),
          job.name(),
          organization.id(),
          executionId,
          result.success(),
          result.notificationsCreated(),
          result.error(),
          result.metadata());
    } finally {
      MDC.remove(MDC_JOB_ID);
      MDC.remove(MDC_ORGANIZATION_ID);
    }
  }

  private JobExecutionResult execute(
      JobTarget job, OrganizationTarget organization, Instant startedAt, boolean dryRun) {
    if (!organization.known()) {
      return JobExecutionResult.failed("Organization '" + organization.id() + "' not found");
    }
    try {
      return registry.executeJob(job.id(), new JobInvocation(startedAt, organization.id(), dryRun));
    } catch (RuntimeException ex) {
      logger.error(
          "cron job invocation threw jobId={} organizationId={}", job.id(), organization.id(), ex);
      final String message = ex.getMessage();
      return JobExecutionResult.failed(
          message == null ? ex.getClass().getSimpleName() : message);
    }
  }

  private void applyRetention() {
    try {
      retentionService.cleanup();
    } catch (RuntimeException ex) {
      logger.error("cron retention cleanup failed", ex);
    }
  }

  private static int suppressedCount(Map<String, Object> metadata) {
    final Object value = metadata.get("notificationsSuppressed");
    return value instanceof Number number ? number.intValue() : 0;
  }

  @VisibleForTesting
  record JobTarget(String id, String name) {}

  @VisibleForTesting
  record OrganizationTarget(String id, boolean known) {}
}
