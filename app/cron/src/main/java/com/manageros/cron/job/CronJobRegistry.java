/*
 * Where: Cron job engine
 * What: Ordered catalog of jobs with config resolution and failure containment
 * Why: Callers address jobs by id and always get a result back, never an exception
 */
package com.manageros.cron.job;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CronJobRegistry {

  private static final Logger logger = LoggerFactory.getLogger(CronJobRegistry.class);

  private final Map<String, CronJob> jobs = new LinkedHashMap<>();
  private final Map<String, Map<String, Object>> configOverrides;
  private final Clock clock;

  public CronJobRegistry(Clock clock, Map<String, Map<String, Object>> configOverrides) {
    this.clock = clock;
    this.configOverrides = configOverrides == null ? Map.of() : Map.copyOf(configOverrides);
  }

  /** Registers {@code job}; a job with the same id is replaced in its original position. */
  public synchronized void register(CronJob job) {
    final CronJob previous = jobs.put(job.id(), job);
    if (previous != null && previous != job) {
      logger.warn("cron job replaced jobId={}", job.id());
    }
  }

  public synchronized Optional<CronJob> getJob(String jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  public synchronized List<CronJob> getAllJobs() {
    return List.copyOf(jobs.values());
  }

  public JobExecutionResult executeJob(String jobId, JobInvocation invocation) {
    final Optional<CronJob> job = getJob(jobId);
    if (job.isEmpty()) {
      return JobExecutionResult.failed("Job with ID '" + jobId + "' not found");
    }
    final CronJob cronJob = job.get();
    try {
      final Map<String, Object> config = resolveConfig(cronJob);
      if (!cronJob.validateConfig(config)) {
        logger.warn("cron job config rejected jobId={} config={}", jobId, config);
        return JobExecutionResult.failed("Invalid configuration for job '" + jobId + "'");
      }
      final JobExecutionContext context =
          new JobExecutionContext(
              config, invocation.startedAt(), invocation.organizationId(), invocation.dryRun());
      return cronJob.execute(context);
    } catch (RuntimeException ex) {
      logger.error(
          "cron job escaped with exception jobId={} organizationId={}",
          jobId,
          invocation.organizationId(),
          ex);
      return JobExecutionResult.failed(CronJob.describe(ex));
    }
  }

  public Map<String, JobExecutionResult> executeAllJobs(String organizationId) {
    return executeAllJobs(JobInvocation.forOrganization(Instant.now(clock), organizationId));
  }

  public Map<String, JobExecutionResult> executeAllJobs(JobInvocation invocation) {
    final Map<String, JobExecutionResult> results = new LinkedHashMap<>();
    for (CronJob job : getAllJobs()) {
      results.put(job.id(), executeJob(job.id(), invocation));
    }
    return results;
  }

  /**
   * Job defaults overlaid with any configured overrides for that job. Override keys match a
   * default key ignoring case and dashes, so {@code days-ahead} and {@code daysahead} both set
   * {@code daysAhead}.
   */
  public Map<String, Object> resolveConfig(CronJob job) {
    final Map<String, Object> config = new LinkedHashMap<>(job.getDefaultConfig());
    final Map<String, Object> overrides = configOverrides.get(job.id());
    if (overrides != null) {
      overrides.forEach((key, value) -> config.put(canonicalKey(config, key), value));
    }
    return config;
  }

  private static String canonicalKey(Map<String, Object> config, String key) {
    final String uniform = uniform(key);
    for (String candidate : config.keySet()) {
      if (uniform(candidate).equals(uniform)) {
        return candidate;
      }
    }
    return key;
  }

  private static String uniform(String key) {
    return key.replace("-", "").toLowerCase(Locale.ROOT);
  }

  public List<String> jobIds() {
    return getAllJobs().stream().map(CronJob::id).toList();
  }
}
