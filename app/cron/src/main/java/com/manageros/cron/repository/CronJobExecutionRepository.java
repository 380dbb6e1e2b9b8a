/*
 * Where: Cron data access
 * What: Inserts, transitions and reports on cron_job_executions rows
 * Why: Audit trail for every (job, organization) invocation
 */
package com.manageros.cron.repository;

import static com.manageros.common.JdbcTimestampUtils.toInstant;
import static com.manageros.common.JdbcTimestampUtils.toTimestamp;

import com.manageros.cron.model.CronJobExecutionRecord;
import com.manageros.cron.model.CronJobExecutionStats;
import com.manageros.cron.model.ExecutionStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CronJobExecutionRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT execution_id, job_id, job_name, organization_id, status, started_at, completed_at,
             notifications_created, error, metadata_json::text AS metadata_json_text
      FROM cron_job_executions
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(CronJobExecutionRecord record) {
    final String sql =
        """
        INSERT INTO cron_job_executions (
          execution_id,
          job_id,
          job_name,
          organization_id,
          status,
          started_at,
          completed_at,
          notifications_created,
          error,
          metadata_json
        ) VALUES (
          :executionId,
          :jobId,
          :jobName,
          :organizationId,
          :status,
          :startedAt,
          :completedAt,
          :notificationsCreated,
          :error,
          :metadataJson::jsonb
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("executionId", record.executionId())
            .addValue("jobId", record.jobId())
            .addValue("jobName", record.jobName())
            .addValue("organizationId", record.organizationId())
            .addValue("status", record.status().name())
            .addValue("startedAt", toTimestamp(record.startedAt()))
            .addValue("completedAt", toTimestamp(record.completedAt()))
            .addValue("notificationsCreated", record.notificationsCreated())
            .addValue("error", record.error())
            .addValue("metadataJson", record.metadataJson());
    jdbcTemplate.update(sql, params);
    return record.executionId();
  }

  public int markCompleted(
      UUID executionId, Instant completedAt, int notificationsCreated, String metadataJson) {
    // Only a RUNNING row may move to a terminal state; a second transition updates nothing.
    final String sql =
        """
        UPDATE cron_job_executions
        SET status = 'COMPLETED',
            completed_at = :completedAt,
            notifications_created = :notificationsCreated,
            metadata_json = metadata_json || :metadataJson::jsonb
        WHERE execution_id = :executionId
          AND status = 'RUNNING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("executionId", executionId)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("notificationsCreated", notificationsCreated)
            .addValue("metadataJson", metadataJson);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(
      UUID executionId,
      Instant completedAt,
      int notificationsCreated,
      String error,
      String metadataJson) {
    final String sql =
        """
        UPDATE cron_job_executions
        SET status = 'FAILED',
            completed_at = :completedAt,
            notifications_created = :notificationsCreated,
            error = :error,
            metadata_json = metadata_json || :metadataJson::jsonb
        WHERE execution_id = :executionId
          AND status = 'RUNNING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("executionId", executionId)
            .addValue("completedAt", toTimestamp(completedAt))
            .addValue("notificationsCreated", notificationsCreated)
            .addValue("error", error)
            .addValue("metadataJson", metadataJson);
    return jdbcTemplate.update(sql, params);
  }

  public Optional<CronJobExecutionRecord> findById(UUID executionId) {
    final String sql = SELECT_COLUMNS + " WHERE execution_id = :executionId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("executionId", executionId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<CronJobExecutionRecord> findRecent(String organizationId, int limit) {
    final StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append(" WHERE 1 = 1");
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    if (organizationId != null) {
      sql.append(" AND organization_id = :organizationId");
      params.addValue("organizationId", organizationId);
    }
    sql.append(" ORDER BY started_at DESC LIMIT :limit");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public CronJobExecutionStats aggregateSince(String organizationId, Instant since) {
    final StringBuilder sql =
        new StringBuilder(
            """
            SELECT COUNT(*) FILTER (WHERE status = 'COMPLETED') AS completed,
                   COUNT(*) FILTER (WHERE status = 'FAILED') AS failed,
                   COUNT(*) FILTER (WHERE status = 'RUNNING') AS running,
                   COALESCE(SUM(notifications_created), 0) AS total_notifications
            FROM cron_job_executions
            WHERE started_at >= :since
            """);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    if (organizationId != null) {
      sql.append(" AND organization_id = :organizationId");
      params.addValue("organizationId", organizationId);
    }
    return jdbcTemplate.queryForObject(
        sql.toString(),
        params,
        (rs, rowNum) ->
            CronJobExecutionStats.of(
                rs.getInt("completed"),
                rs.getInt("failed"),
                rs.getInt("running"),
                rs.getLong("total_notifications")));
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM cron_job_executions
        WHERE started_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleRunning(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM cron_job_executions
        WHERE started_at < :threshold
          AND status = 'RUNNING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private CronJobExecutionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CronJobExecutionRecord(
        UUID.fromString(rs.getString("execution_id")),
        rs.getString("job_id"),
        rs.getString("job_name"),
        rs.getString("organization_id"),
        ExecutionStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("completed_at")),
        rs.getInt("notifications_created"),
        rs.getString("error"),
        rs.getString("metadata_json_text"));
  }
}
