/*
 * Where: Shared utilities
 * What: Generates identifiers for batch runs
 * Why: A run id that starts with its UTC start time sorts and reads well in logs and audit rows
 */
package com.manageros.common;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

public final class RunIds {

  private static final DateTimeFormatter PREFIX =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'").withZone(ZoneOffset.UTC);
  private static final int SUFFIX_LENGTH = 8;

  private RunIds() {}

  /** Returns e.g. {@code 20260302T090000Z-1a2b3c4d}. */
  public static String newRunId(Clock clock) {
    final String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, SUFFIX_LENGTH);
    return PREFIX.format(clock.instant()) + "-" + suffix;
  }
}
