/*
 * Where: Cron application configuration binding
 * What: Holds execution record retention settings
 * Why: Keep the retention horizon tunable per environment
 */
package com.manageros.cron.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "cron.retention")
@Validated
public record CronRetentionProperties(boolean enabled, @Positive int retentionDays) {

  public CronRetentionProperties {
    retentionDays = retentionDays == 0 ? 90 : retentionDays;
  }
}
