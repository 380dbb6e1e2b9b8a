package com.manageros.cron.repository;

import static com.manageros.common.JdbcTimestampUtils.toInstant;
import static com.manageros.common.JdbcTimestampUtils.toTimestamp;

import com.manageros.cron.model.OverdueTask;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class TaskRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Tasks due strictly before {@code dueBefore} that are neither done nor dropped, assigned to an
   * active person with a linked user, and owned by the organization through their initiative or
   * their objective's initiative.
   */
  public List<OverdueTask> findOverdue(String organizationId, Instant dueBefore) {
    final String sql =
        """
        SELECT t.id, t.title, t.due_date, p.id AS assignee_id, p.name AS assignee_name,
               p.user_id AS assignee_user_id
        FROM tasks t
        JOIN people p ON p.id = t.assignee_id
        LEFT JOIN initiatives i ON i.id = t.initiative_id
        LEFT JOIN objectives o ON o.id = t.objective_id
        LEFT JOIN initiatives oi ON oi.id = o.initiative_id
        WHERE t.due_date < :dueBefore
          AND t.status NOT IN ('done', 'dropped')
          AND p.organization_id = :organizationId
          AND p.status = 'active'
          AND p.user_id IS NOT NULL
          AND (i.organization_id = :organizationId OR oi.organization_id = :organizationId)
        ORDER BY t.due_date, t.id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("organizationId", organizationId)
            .addValue("dueBefore", toTimestamp(dueBefore));
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new OverdueTask(
                rs.getString("id"),
                rs.getString("title"),
                toInstant(rs.getTimestamp("due_date")),
                rs.getString("assignee_id"),
                rs.getString("assignee_name"),
                rs.getString("assignee_user_id")));
  }
}
