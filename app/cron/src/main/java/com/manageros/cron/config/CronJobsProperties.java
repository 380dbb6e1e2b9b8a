/*
 * Where: Cron application configuration binding
 * What: Per-job configuration overrides keyed by job id
 * Why: Operators tune look-ahead/look-back windows without a code change
 */
package com.manageros.cron.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cron.jobs")
public record CronJobsProperties(Map<String, Map<String, String>> overrides) {

  public CronJobsProperties {
    overrides =
        overrides == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(overrides));
  }

  /** Overrides widened to the value type the job registry works with. */
  public Map<String, Map<String, Object>> asRegistryOverrides() {
    final Map<String, Map<String, Object>> widened = new LinkedHashMap<>();
    overrides.forEach((jobId, values) -> widened.put(jobId, new LinkedHashMap<>(values)));
    return widened;
  }
}
