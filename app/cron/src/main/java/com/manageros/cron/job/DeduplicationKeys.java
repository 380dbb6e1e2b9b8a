package com.manageros.cron.job;

import java.util.Collection;
import java.util.stream.Collectors;

public final class DeduplicationKeys {

  private static final String SEPARATOR = "|";

  private DeduplicationKeys() {}

  /**
   * Builds {@code prefix:part1|part2|...} with the parts sorted, so the key depends only on which
   * parts are present and not on query order.
   */
  public static String of(String prefix, Collection<String> parts) {
    return prefix
        + ":"
        + parts.stream().sorted().collect(Collectors.joining(SEPARATOR));
  }
}
