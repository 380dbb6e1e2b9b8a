package com.manageros.cron.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "cron.trigger")
public record CronTriggerProperties(String secret, String pathPrefix) {

  public CronTriggerProperties {
    secret = secret == null ? "" : secret;
    pathPrefix = pathPrefix == null || pathPrefix.isBlank() ? "/api/cron/" : pathPrefix;
  }

  public boolean isSecretConfigured() {
    return !secret.isBlank();
  }
}
