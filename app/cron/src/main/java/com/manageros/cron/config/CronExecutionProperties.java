/*
 * Where: Cron application configuration binding
 * What: Holds execution record settings
 * Why: Bound error text so one failing job cannot bloat the audit table
 */
package com.manageros.cron.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "cron.execution")
@Validated
public record CronExecutionProperties(
    @Positive int errorMessageMaxLength, @Positive int maxListLimit) {

  public CronExecutionProperties {
    errorMessageMaxLength = errorMessageMaxLength == 0 ? 2000 : errorMessageMaxLength;
    maxListLimit = maxListLimit == 0 ? 500 : maxListLimit;
  }
}
