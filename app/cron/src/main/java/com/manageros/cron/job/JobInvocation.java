package com.manageros.cron.job;

import java.time.Instant;

/** Per-call parameters the runner hands to the registry. */
public record JobInvocation(Instant startedAt, String organizationId, boolean dryRun) {

  public static JobInvocation forOrganization(Instant startedAt, String organizationId) {
    return new JobInvocation(startedAt, organizationId, false);
  }
}
