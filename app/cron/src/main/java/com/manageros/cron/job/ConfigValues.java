package com.manageros.cron.job;

import java.util.Map;
import java.util.Optional;

/** Reads job configuration values that may arrive as numbers (defaults) or strings (overrides). */
public final class ConfigValues {
  private ConfigValues() {}

  public static Optional<Integer> asInteger(Object value) {
    if (value instanceof Integer integer) {
      return Optional.of(integer);
    }
    if (value instanceof Long || value instanceof Short || value instanceof Byte) {
      final long longValue = ((Number) value).longValue();
      if (longValue < Integer.MIN_VALUE || longValue > Integer.MAX_VALUE) {
        return Optional.empty();
      }
      return Optional.of((int) longValue);
    }
    if (value instanceof String text) {
      try {
        return Optional.of(Integer.parseInt(text.trim()));
      } catch (NumberFormatException ex) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  public static boolean isIntegerBetween(Map<String, Object> config, String key, int min, int max) {
    return asInteger(config.get(key)).map(value -> value >= min && value <= max).orElse(false);
  }

  public static int intValue(Map<String, Object> config, String key, int fallback) {
    return asInteger(config.get(key)).orElse(fallback);
  }
}
