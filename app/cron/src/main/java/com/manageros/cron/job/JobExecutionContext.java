package com.manageros.cron.job;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one job execution needs: the resolved configuration, when the invocation started,
 * the target organization (null only for runs that are not organization scoped) and whether
 * notifications should only be reported instead of created.
 */
public record JobExecutionContext(
    Map<String, Object> config, Instant startedAt, String organizationId, boolean dryRun) {

  public JobExecutionContext {
    config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
  }
}
