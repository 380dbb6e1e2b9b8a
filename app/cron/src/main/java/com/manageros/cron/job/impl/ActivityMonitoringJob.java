/*
 * Where: Cron jobs
 * What: Warns managers about active reports with no recent activity
 * Why: Stagnant reports should surface once a week, not on every run
 */
package com.manageros.cron.job.impl;

import com.google.common.annotations.VisibleForTesting;
import com.manageros.cron.job.ConfigValues;
import com.manageros.cron.job.CronJob;
import com.manageros.cron.job.DeduplicationKeys;
import com.manageros.cron.job.ExecutionTally;
import com.manageros.cron.job.JobExecutionContext;
import com.manageros.cron.job.NotificationDraft;
import com.manageros.cron.job.NotificationPayload;
import com.manageros.cron.job.NotificationStore;
import com.manageros.cron.model.ActivitySignal;
import com.manageros.cron.model.ManagerReports;
import com.manageros.cron.model.NotificationType;
import com.manageros.cron.model.PersonSummary;
import com.manageros.cron.repository.ActivityRepository;
import com.manageros.cron.repository.PersonRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ActivityMonitoringJob extends CronJob {

  private static final Logger logger = LoggerFactory.getLogger(ActivityMonitoringJob.class);

  public static final String JOB_ID = "activity-monitoring";
  static final String CONFIG_DAYS_BACK = "daysBack";
  static final int DEFAULT_DAYS_BACK = 14;
  static final int LOOKBACK_HOURS = 168;

  private final PersonRepository personRepository;
  private final ActivityRepository activityRepository;

  public ActivityMonitoringJob(
      NotificationStore notificationStore,
      Clock clock,
      PersonRepository personRepository,
      ActivityRepository activityRepository) {
    super(notificationStore, clock);
    this.personRepository = personRepository;
    this.activityRepository = activityRepository;
  }

  @Override
  public String id() {
    return JOB_ID;
  }

  @Override
  public String name() {
    return "Activity Monitoring";
  }

  @Override
  public String description() {
    return "Notifies managers about team members with no recent tasks, one-on-ones or feedback";
  }

  @Override
  public String schedule() {
    return "0 10 * * 1";
  }

  @Override
  public Map<String, Object> getDefaultConfig() {
    return Map.of(CONFIG_DAYS_BACK, DEFAULT_DAYS_BACK);
  }

  @Override
  public boolean validateConfig(Map<String, Object> config) {
    return ConfigValues.isIntegerBetween(config, CONFIG_DAYS_BACK, 1, 90);
  }

  @Override
  protected void run(JobExecutionContext context, ExecutionTally tally) {
    final String organizationId = context.organizationId();
    final int daysBack =
        ConfigValues.intValue(context.config(), CONFIG_DAYS_BACK, DEFAULT_DAYS_BACK);
    final Instant cutoff = Instant.now(clock).minus(Duration.ofDays(daysBack));
    final List<ManagerReports> managers =
        personRepository.findActiveManagersWithActiveReports(organizationId);
    tally.put("managersProcessed", managers.size());

    int inactiveReportsFound = 0;
    final Map<String, Integer> activeReportsBySignal = new TreeMap<>();
    for (ManagerReports manager : managers) {
      final List<String> inactive = new ArrayList<>();
      for (PersonSummary report : manager.reports()) {
        final Optional<ActivitySignal> signal = findRecentActivity(report.id(), cutoff);
        if (signal.isEmpty()) {
          inactive.add(report.name());
          continue;
        }
        activeReportsBySignal.merge(signal.get().activityType(), 1, Integer::sum);
        logger.debug(
            "activity found personId={} activityType={} occurredAt={}",
            report.id(),
            signal.get().activityType(),
            signal.get().occurredAt());
      }
      if (inactive.isEmpty()) {
        continue;
      }
      inactive.sort(Comparator.naturalOrder());
      inactiveReportsFound += inactive.size();
      final String key = DeduplicationKeys.of("activity", inactive);
      notifyOnce(
          context,
          tally,
          toDraft(organizationId, manager.userId(), inactive, daysBack),
          key,
          LOOKBACK_HOURS);
    }
    tally.put("inactiveReportsFound", inactiveReportsFound);
    tally.put("activeReportsBySignal", activeReportsBySignal);
  }

  /** First signal found wins, checked as tasks, then one-on-ones, then feedback. */
  @VisibleForTesting
  Optional<ActivitySignal> findRecentActivity(String personId, Instant cutoff) {
    final Optional<Instant> task = activityRepository.findLatestTaskActivity(personId, cutoff);
    if (task.isPresent()) {
      return task.map(at -> new ActivitySignal(ActivitySignal.TASK, at));
    }
    final Optional<Instant> oneOnOne = activityRepository.findLatestOneOnOne(personId, cutoff);
    if (oneOnOne.isPresent()) {
      return oneOnOne.map(at -> new ActivitySignal(ActivitySignal.ONE_ON_ONE, at));
    }
    return activityRepository
        .findLatestFeedback(personId, cutoff)
        .map(at -> new ActivitySignal(ActivitySignal.FEEDBACK, at));
  }

  private NotificationDraft toDraft(
      String organizationId, String userId, List<String> inactive, int daysBack) {
    final String title;
    final String message;
    if (inactive.size() == 1) {
      title = "Team Member Activity Check";
      message =
          inactive.get(0)
              + " hasn't had any recent activity in the last "
              + daysBack
              + " days. Consider checking in with them.";
    } else {
      title = "Team Activity Check";
      message =
          inactive.size()
              + " team members haven't had recent activity in the last "
              + daysBack
              + " days: "
              + String.join(", ", inactive)
              + ". Consider checking in with them.";
    }
    return NotificationDraft.of(
        title,
        message,
        NotificationType.WARNING,
        organizationId,
        userId,
        new InactivityPayload(daysBack, inactive));
  }

  record InactivityPayload(int daysBack, List<String> inactiveReports)
      implements NotificationPayload {

    @Override
    public Map<String, Object> toMetadata() {
      final Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("daysBack", daysBack);
      metadata.put(
          "inactiveReports",
          inactiveReports.stream().map(name -> Map.of("name", name)).collect(Collectors.toList()));
      return metadata;
    }
  }
}
