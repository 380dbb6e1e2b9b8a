/*
 * Where: Cron data access
 * What: Finds the most recent activity signals recorded for a person
 * Why: The activity monitoring job flags reports without any recent signal
 */
package com.manageros.cron.repository;

import static com.manageros.common.JdbcTimestampUtils.toInstant;
import static com.manageros.common.JdbcTimestampUtils.toTimestamp;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ActivityRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Instant> findLatestTaskActivity(String personId, Instant cutoff) {
    final String sql =
        """
        SELECT MAX(GREATEST(t.updated_at, t.created_at))
        FROM tasks t
        JOIN people p ON p.id = t.assignee_id
        WHERE t.assignee_id = :personId
          AND p.status = 'active'
          AND (t.updated_at >= :cutoff OR t.created_at >= :cutoff)
        """;
    return latest(sql, personId, cutoff);
  }

  public Optional<Instant> findLatestOneOnOne(String personId, Instant cutoff) {
    final String sql =
        """
        SELECT MAX(o.scheduled_at)
        FROM one_on_ones o
        JOIN people p ON p.id = o.report_id
        WHERE o.report_id = :personId
          AND p.status = 'active'
          AND o.scheduled_at >= :cutoff
        """;
    return latest(sql, personId, cutoff);
  }

  public Optional<Instant> findLatestFeedback(String personId, Instant cutoff) {
    final String sql =
        """
        SELECT MAX(f.created_at)
        FROM feedback f
        JOIN people p ON p.id = f.about_id
        WHERE f.about_id = :personId
          AND p.status = 'active'
          AND f.created_at >= :cutoff
        """;
    return latest(sql, personId, cutoff);
  }

  private Optional<Instant> latest(String sql, String personId, Instant cutoff) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("personId", personId)
            .addValue("cutoff", toTimestamp(cutoff));
    final Timestamp latest = jdbcTemplate.queryForObject(sql, params, Timestamp.class);
    return Optional.ofNullable(toInstant(latest));
  }
}
