/*
 * Where: Cron job engine
 * What: Outcome of one job execution
 * Why: The single source of truth the runner maps onto an execution record
 */
package com.manageros.cron.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record JobExecutionResult(
    boolean success, int notificationsCreated, String error, Map<String, Object> metadata) {

  public JobExecutionResult {
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static JobExecutionResult succeeded(
      int notificationsCreated, Map<String, Object> metadata) {
    return new JobExecutionResult(true, notificationsCreated, null, metadata);
  }

  public static JobExecutionResult failed(
      String error, int notificationsCreated, Map<String, Object> metadata) {
    return new JobExecutionResult(false, notificationsCreated, error, metadata);
  }

  public static JobExecutionResult failed(String error) {
    return failed(error, 0, Map.of());
  }
}
