package com.manageros.cron.api;

import com.manageros.cron.job.CronJob;
import java.util.Map;

public record CronJobInfo(
    String id,
    String name,
    String description,
    String schedule,
    Map<String, Object> defaultConfig,
    Map<String, Object> effectiveConfig) {

  public static CronJobInfo from(CronJob job, Map<String, Object> effectiveConfig) {
    return new CronJobInfo(
        job.id(),
        job.name(),
        job.description(),
        job.schedule(),
        job.getDefaultConfig(),
        effectiveConfig);
  }
}
