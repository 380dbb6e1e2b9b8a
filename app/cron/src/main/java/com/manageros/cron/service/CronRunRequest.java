package com.manageros.cron.service;

/**
 * What a batch run should cover. A null {@code jobId} means every registered job, a null
 * {@code organizationId} means every organization.
 */
public record CronRunRequest(String jobId, String organizationId, boolean dryRun) {

  public CronRunRequest {
    jobId = blankToNull(jobId);
    organizationId = blankToNull(organizationId);
  }

  public static CronRunRequest all() {
    return new CronRunRequest(null, null, false);
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
