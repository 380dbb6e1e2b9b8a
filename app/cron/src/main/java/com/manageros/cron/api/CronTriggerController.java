/*
 * Where: Cron HTTP API
 * What: Triggers batch runs and reports on jobs and past executions
 * Why: Lets an external scheduler drive the runner over HTTP instead of the CLI
 */
package com.manageros.cron.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.manageros.cron.job.CronJobRegistry;
import com.manageros.cron.model.CronJobExecutionRecord;
import com.manageros.cron.model.CronJobExecutionStats;
import com.manageros.cron.service.CronJobExecutionService;
import com.manageros.cron.service.CronRunRequest;
import com.manageros.cron.service.CronRunSummary;
import com.manageros.cron.service.CronRunner;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
public class CronTriggerController {

  private static final Logger logger = LoggerFactory.getLogger(CronTriggerController.class);

  private final CronRunner cronRunner;
  private final CronJobRegistry registry;
  private final CronJobExecutionService executionService;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @GetMapping("/notifications")
  public CronRunResponse runNotifications(
      @RequestParam(name = "job", required = false) String jobId,
      @RequestParam(name = "org", required = false) String organizationId,
      @RequestParam(name = "verbose", defaultValue = "false") boolean verbose,
      @RequestParam(name = "dryRun", defaultValue = "false") boolean dryRun) {
    logger.info(
        "cron run requested via api jobId={} organizationId={} dryRun={}",
        jobId == null ? "all" : jobId,
        organizationId == null ? "all" : organizationId,
        dryRun);
    final CronRunSummary summary =
        cronRunner.run(new CronRunRequest(jobId, organizationId, dryRun));
    return CronRunResponse.from(summary, verbose, Instant.now(clock));
  }

  @GetMapping("/jobs")
  public List<CronJobInfo> jobs() {
    return registry.getAllJobs().stream()
        .map(job -> CronJobInfo.from(job, registry.resolveConfig(job)))
        .toList();
  }

  @GetMapping("/executions")
  public List<ExecutionSummary> executions(
      @RequestParam(name = "org", required = false) String organizationId,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    return executionService.getRecentExecutions(blankToNull(organizationId), limit).stream()
        .map(this::toSummary)
        .toList();
  }

  @GetMapping("/executions/stats")
  public CronJobExecutionStats stats(
      @RequestParam(name = "org", required = false) String organizationId,
      @RequestParam(name = "daysBack", defaultValue = "7") int daysBack) {
    return executionService.getExecutionStats(blankToNull(organizationId), daysBack);
  }

  private ExecutionSummary toSummary(CronJobExecutionRecord record) {
    try {
      return new ExecutionSummary(
          record.executionId(),
          record.jobId(),
          record.jobName(),
          record.organizationId(),
          record.status(),
          record.startedAt(),
          record.completedAt(),
          record.notificationsCreated(),
          record.error(),
          objectMapper.readTree(record.metadataJson() == null ? "{}" : record.metadataJson()));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("execution metadata parse failure", ex);
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
