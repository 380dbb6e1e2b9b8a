/*
 * Where: Cron jobs
 * What: Reminds assignees about their overdue tasks
 * Why: A changed set of overdue tasks is a new reminder; an unchanged one waits a day
 */
package com.manageros.cron.job.impl;

import com.manageros.cron.job.CronJob;
import com.manageros.cron.job.DeduplicationKeys;
import com.manageros.cron.job.ExecutionTally;
import com.manageros.cron.job.JobExecutionContext;
import com.manageros.cron.job.NotificationDraft;
import com.manageros.cron.job.NotificationPayload;
import com.manageros.cron.job.NotificationStore;
import com.manageros.cron.model.NotificationType;
import com.manageros.cron.model.OverdueTask;
import com.manageros.cron.repository.TaskRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class OverdueTasksNotificationJob extends CronJob {

  public static final String JOB_ID = "overdue-tasks-notification";
  static final int LOOKBACK_HOURS = 24;

  private final TaskRepository taskRepository;

  public OverdueTasksNotificationJob(
      NotificationStore notificationStore, Clock clock, TaskRepository taskRepository) {
    super(notificationStore, clock);
    this.taskRepository = taskRepository;
  }

  @Override
  public String id() {
    return JOB_ID;
  }

  @Override
  public String name() {
    return "Overdue Tasks Notification";
  }

  @Override
  public String description() {
    return "Notifies assignees about tasks that are past their due date";
  }

  @Override
  public String schedule() {
    return "0 9 * * *";
  }

  @Override
  public Map<String, Object> getDefaultConfig() {
    return Map.of();
  }

  @Override
  public boolean validateConfig(Map<String, Object> config) {
    return true;
  }

  @Override
  protected void run(JobExecutionContext context, ExecutionTally tally) {
    final String organizationId = context.organizationId();
    final Instant startOfToday = LocalDate.now(clock).atStartOfDay(clock.getZone()).toInstant();
    final List<OverdueTask> overdue = taskRepository.findOverdue(organizationId, startOfToday);
    tally.put("overdueTasksFound", overdue.size());

    final Map<String, List<OverdueTask>> tasksByUser = new LinkedHashMap<>();
    for (OverdueTask task : overdue) {
      if (task.assigneeUserId() == null) {
        continue;
      }
      tasksByUser.computeIfAbsent(task.assigneeUserId(), ignored -> new ArrayList<>()).add(task);
    }
    tally.put("usersWithOverdueTasks", tasksByUser.size());

    for (Map.Entry<String, List<OverdueTask>> entry : tasksByUser.entrySet()) {
      final List<OverdueTask> tasks = entry.getValue();
      final String key =
          DeduplicationKeys.of("overdue-tasks", tasks.stream().map(OverdueTask::id).toList());
      notifyOnce(
          context, tally, toDraft(organizationId, entry.getKey(), tasks), key, LOOKBACK_HOURS);
    }
  }

  private NotificationDraft toDraft(String organizationId, String userId, List<OverdueTask> tasks) {
    final String title;
    final String message;
    if (tasks.size() == 1) {
      title = "Overdue Task";
      message = "Task \"" + tasks.get(0).title() + "\" is overdue";
    } else {
      title = "Overdue Tasks";
      message = "You have " + tasks.size() + " overdue task(s)";
    }
    return NotificationDraft.of(
        title,
        message,
        NotificationType.WARNING,
        organizationId,
        userId,
        new OverdueTasksPayload(tasks));
  }

  record OverdueTasksPayload(List<OverdueTask> tasks) implements NotificationPayload {

    @Override
    public Map<String, Object> toMetadata() {
      final Map<String, Object> metadata = new LinkedHashMap<>();
      metadata.put("overdueTaskIds", tasks.stream().map(OverdueTask::id).toList());
      metadata.put("taskCount", tasks.size());
      metadata.put(
          "tasks",
          tasks.stream()
              .map(
                  task -> {
                    final Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("id", task.id());
                    entry.put("title", task.title());
                    entry.put("dueDate", String.valueOf(task.dueDate()));
                    return entry;
                  })
              .toList());
      return metadata;
    }
  }
}
