/*
 * Where: Cron data access
 * What: Inserts notifications and looks up prior ones by deduplication key
 * Why: Backs the notification store the jobs use for idempotent notifying
 */
package com.manageros.cron.repository;

import static com.manageros.common.JdbcTimestampUtils.toTimestamp;

import com.manageros.cron.model.NotificationRecord;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          title,
          message,
          type,
          organization_id,
          user_id,
          metadata_json,
          created_at
        ) VALUES (
          :notificationId,
          :title,
          :message,
          :type,
          :organizationId,
          :userId,
          :metadataJson::jsonb,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("title", record.title())
            .addValue("message", record.message())
            .addValue("type", record.type().name())
            .addValue("organizationId", record.organizationId())
            .addValue("userId", record.userId())
            .addValue("metadataJson", record.metadataJson())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public boolean existsWithDeduplicationKeySince(
      String userId, String organizationId, String deduplicationKey, Instant since) {
    // A null user means an organization-wide notification, matched with IS NULL.
    final String userPredicate = userId == null ? "user_id IS NULL" : "user_id = :userId";
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM notifications
          WHERE %s
            AND organization_id = :organizationId
            AND created_at >= :since
            AND metadata_json ->> 'deduplicationKey' = :deduplicationKey
        )
        """
            .formatted(userPredicate);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("organizationId", organizationId)
            .addValue("since", toTimestamp(since))
            .addValue("deduplicationKey", deduplicationKey);
    if (userId != null) {
      params.addValue("userId", userId);
    }
    final Boolean exists = jdbcTemplate.queryForObject(sql, params, Boolean.class);
    return Boolean.TRUE.equals(exists);
  }
}
