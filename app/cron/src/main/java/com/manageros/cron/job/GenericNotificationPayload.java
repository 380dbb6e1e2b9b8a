package com.manageros.cron.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record GenericNotificationPayload(Map<String, Object> values)
    implements NotificationPayload {

  public GenericNotificationPayload {
    values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  @Override
  public Map<String, Object> toMetadata() {
    return values;
  }
}
