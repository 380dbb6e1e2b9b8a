/*
 * Where: Cron jobs
 * What: Tells managers about upcoming birthdays of their reports
 * Why: One reminder per manager per distinct set of upcoming birthdays
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
import com.manageros.cron.model.ManagerReports;
import com.manageros.cron.model.NotificationType;
import com.manageros.cron.model.PersonSummary;
import com.manageros.cron.repository.PersonRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class BirthdayNotificationJob extends CronJob {

  public static final String JOB_ID = "birthday-notification";
  static final String CONFIG_DAYS_AHEAD = "daysAhead";
  static final int DEFAULT_DAYS_AHEAD = 7;
  static final int LOOKBACK_HOURS = 24;

  private final PersonRepository personRepository;

  public BirthdayNotificationJob(
      NotificationStore notificationStore, Clock clock, PersonRepository personRepository) {
    super(notificationStore, clock);
    this.personRepository = personRepository;
  }

  @Override
  public String id() {
    return JOB_ID;
  }

  @Override
  public String name() {
    return "Birthday Notifications";
  }

  @Override
  public String description() {
    return "Notifies managers about upcoming birthdays of their reports";
  }

  @Override
  public String schedule() {
    return "0 9 * * *";
  }

  @Override
  public Map<String, Object> getDefaultConfig() {
    return Map.of(CONFIG_DAYS_AHEAD, DEFAULT_DAYS_AHEAD);
  }

  @Override
  public boolean validateConfig(Map<String, Object> config) {
    return ConfigValues.isIntegerBetween(config, CONFIG_DAYS_AHEAD, 1, 365);
  }

  @Override
  protected void run(JobExecutionContext context, ExecutionTally tally) {
    final String organizationId = context.organizationId();
    final int daysAhead =
        ConfigValues.intValue(context.config(), CONFIG_DAYS_AHEAD, DEFAULT_DAYS_AHEAD);
    final LocalDate today = LocalDate.now(clock);
    final List<ManagerReports> managers =
        personRepository.findManagersWithBirthdayReports(organizationId);
    tally.put("managersProcessed", managers.size());

    int managersWithUpcomingBirthdays = 0;
    for (ManagerReports manager : managers) {
      final List<UpcomingBirthday> upcoming = findUpcoming(manager.reports(), today, daysAhead);
      if (upcoming.isEmpty()) {
        continue;
      }
      managersWithUpcomingBirthdays++;
      final String key =
          DeduplicationKeys.of(
              "birthday",
              upcoming.stream().map(b -> b.name() + ":" + b.daysUntil()).toList());
      notifyOnce(
          context,
          tally,
          toDraft(organizationId, manager.userId(), upcoming, daysAhead),
          key,
          LOOKBACK_HOURS);
    }
    tally.put("managersWithUpcomingBirthdays", managersWithUpcomingBirthdays);
  }

  @VisibleForTesting
  static List<UpcomingBirthday> findUpcoming(
      List<PersonSummary> reports, LocalDate today, int daysAhead) {
    final List<UpcomingBirthday> upcoming = new ArrayList<>();
    for (PersonSummary report : reports) {
      if (report.birthday() == null) {
        continue;
      }
      final LocalDate next = nextOccurrence(report.birthday(), today);
      final long daysUntil = ChronoUnit.DAYS.between(today, next);
      if (daysUntil <= daysAhead) {
        upcoming.add(new UpcomingBirthday(report.name(), next, (int) daysUntil));
      }
    }
    upcoming.sort(
        Comparator.comparingInt(UpcomingBirthday::daysUntil).thenComparing(UpcomingBirthday::name));
    return upcoming;
  }

  /** MonthDay.atYear maps Feb 29 to Feb 28 outside leap years. */
  @VisibleForTesting
  static LocalDate nextOccurrence(LocalDate birthday, LocalDate today) {
    final MonthDay monthDay = MonthDay.from(birthday);
    final LocalDate thisYear = monthDay.atYear(today.getYear());
    return thisYear.isBefore(today) ? monthDay.atYear(today.getYear() + 1) : thisYear;
  }

  private NotificationDraft toDraft(
      String organizationId, String userId, List<UpcomingBirthday> upcoming, int daysAhead) {
    final String title;
    final String message;
    if (upcoming.size() == 1) {
      final UpcomingBirthday person = upcoming.get(0);
      if (person.daysUntil() == 0) {
        title = "Birthday Today!";
        message = person.name() + " has a birthday today!";
      } else if (person.daysUntil() == 1) {
        title = "Birthday Tomorrow!";
        message = person.name() + " has a birthday tomorrow!";
      } else {
        title = "Upcoming Birthday";
        message =
            person.name()
                + " has a birthday in "
                + person.daysUntil()
                + " days ("
                + person.date()
                + ")";
      }
    } else {
      final String names =
          upcoming.stream().map(UpcomingBirthday::name).collect(Collectors.joining(", "));
      if (upcoming.stream().anyMatch(b -> b.daysUntil() == 0)) {
        title = "Birthdays This Week!";
        message = "Multiple team members have birthdays this week: " + names;
      } else {
        title = "Upcoming Birthdays";
        message =
            "Multiple team members have birthdays in the next " + daysAhead + " days: " + names;
      }
    }
    return NotificationDraft.of(
        title,
        message,
        NotificationType.INFO,
        organizationId,
        userId,
        new BirthdayPayload(upcoming));
  }

  @VisibleForTesting
  record UpcomingBirthday(String name, LocalDate date, int daysUntil) {}

  record BirthdayPayload(List<UpcomingBirthday> upcomingBirthdays) implements NotificationPayload {

    @Override
    public Map<String, Object> toMetadata() {
      final List<Map<String, Object>> entries =
          upcomingBirthdays.stream()
              .map(
                  b -> {
                    final Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("name", b.name());
                    entry.put("birthday", b.date().toString());
                    entry.put("daysUntil", b.daysUntil());
                    return entry;
                  })
              .toList();
      return Map.of("upcomingBirthdays", entries);
    }
  }
}
