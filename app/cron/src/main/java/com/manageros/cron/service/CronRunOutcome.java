package com.manageros.cron.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Result of one (job, organization) pair within a batch run. */
public record CronRunOutcome(
    String jobId,
    String jobName,
    String organizationId,
    UUID executionId,
    boolean success,
    int notificationsCreated,
    String error,
    Map<String, Object> metadata) {

  public CronRunOutcome {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
