package com.manageros.cron.job;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running counts and observability metadata for a single job execution. Owned by one execution
 * on one thread; survives a failure so the partial count can be reported.
 */
public final class ExecutionTally {

  private int notificationsCreated;
  private int notificationsSuppressed;
  private int notificationsSkippedForDryRun;
  private final Map<String, Object> metadata = new LinkedHashMap<>();

  void recordCreated() {
    notificationsCreated++;
  }

  void recordSuppressed() {
    notificationsSuppressed++;
  }

  void recordSkippedForDryRun() {
    notificationsSkippedForDryRun++;
  }

  public void put(String key, Object value) {
    metadata.put(key, value);
  }

  public int notificationsCreated() {
    return notificationsCreated;
  }

  public int notificationsSuppressed() {
    return notificationsSuppressed;
  }

  public Map<String, Object> snapshot() {
    final Map<String, Object> copy = new LinkedHashMap<>(metadata);
    copy.put("notificationsSuppressed", notificationsSuppressed);
    if (notificationsSkippedForDryRun > 0) {
      copy.put("notificationsSkippedForDryRun", notificationsSkippedForDryRun);
    }
    return copy;
  }
}
