/*
 * Where: Cron domain model
 * What: Snapshot of a notifications row
 * Why: Returned by the notification store after a job creates a notification
 */
package com.manageros.cron.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String title,
    String message,
    NotificationType type,
    String organizationId,
    String userId,
    String metadataJson,
    Instant createdAt) {}
