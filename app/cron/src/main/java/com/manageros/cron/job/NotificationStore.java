/*
 * Where: Cron job engine
 * What: The notification operations a job may use
 * Why: Jobs only create notifications and ask whether an equivalent one fired recently
 */
package com.manageros.cron.job;

import com.manageros.cron.model.NotificationRecord;
import java.time.Instant;

public interface NotificationStore {

  NotificationRecord create(NotificationDraft draft);

  /**
   * Whether a notification for {@code userId} in {@code organizationId} created at or after
   * {@code since} carries {@code deduplicationKey} in its metadata. A null user matches
   * organization-wide notifications only.
   */
  boolean existsWithDeduplicationKeySince(
      String userId, String organizationId, String deduplicationKey, Instant since);
}
