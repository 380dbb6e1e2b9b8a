/*
 * Where: Cron job engine
 * What: A notification a job intends to create
 * Why: Separates what a job wants to say from how the store persists it
 */
package com.manageros.cron.job;

import com.manageros.cron.model.NotificationType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record NotificationDraft(
    String title,
    String message,
    NotificationType type,
    String organizationId,
    String userId,
    Map<String, Object> metadata) {

  public NotificationDraft {
    type = type == null ? NotificationType.INFO : type;
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static NotificationDraft of(
      String title,
      String message,
      NotificationType type,
      String organizationId,
      String userId,
      NotificationPayload payload) {
    return new NotificationDraft(
        title,
        message,
        type,
        organizationId,
        userId,
        payload == null ? null : payload.toMetadata());
  }

  public NotificationDraft withMetadata(Map<String, Object> replacement) {
    return new NotificationDraft(title, message, type, organizationId, userId, replacement);
  }
}
