package com.manageros.cron.job;

import java.util.Map;

/**
 * Typed notification content produced by a job. Each job contributes its own payload record;
 * {@link GenericNotificationPayload} covers anything else.
 */
public interface NotificationPayload {

  Map<String, Object> toMetadata();
}
