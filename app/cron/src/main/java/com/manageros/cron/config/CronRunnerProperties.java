/*
 * Where: Cron application configuration binding
 * What: Holds batch runner settings
 * Why: Organizations may run concurrently; the degree is an operational choice
 */
package com.manageros.cron.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "cron.runner")
@Validated
public record CronRunnerProperties(@Min(1) @Max(64) int parallelism) {

  public CronRunnerProperties {
    parallelism = parallelism == 0 ? 1 : parallelism;
  }
}
