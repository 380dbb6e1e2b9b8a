package com.manageros.cron.support;

import static com.manageros.common.JdbcTimestampUtils.toTimestamp;

import java.sql.Date;
import java.time.Instant;
import java.time.LocalDate;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Inserts rows into the domain tables the jobs read. */
public class DomainFixtures {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public DomainFixtures(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public void reset() {
    jdbcTemplate.update(
        """
        TRUNCATE feedback, one_on_ones, tasks, objectives, initiatives, people, organizations,
                 notifications, cron_job_executions
        """,
        new MapSqlParameterSource());
  }

  public void organization(String id, Instant createdAt) {
    jdbcTemplate.update(
        "INSERT INTO organizations (id, name, created_at) VALUES (:id, :name, :createdAt)",
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("name", "Org " + id)
            .addValue("createdAt", toTimestamp(createdAt)));
  }

  public void person(
      String id,
      String organizationId,
      String name,
      String status,
      String managerId,
      String userId,
      LocalDate birthday) {
    jdbcTemplate.update(
        """
        INSERT INTO people (id, organization_id, name, status, manager_id, user_id, birthday)
        VALUES (:id, :organizationId, :name, :status, :managerId, :userId, :birthday)
        """,
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("organizationId", organizationId)
            .addValue("name", name)
            .addValue("status", status)
            .addValue("managerId", managerId)
            .addValue("userId", userId)
            .addValue("birthday", birthday == null ? null : Date.valueOf(birthday)));
  }

  public void initiative(String id, String organizationId) {
    jdbcTemplate.update(
        "INSERT INTO initiatives (id, organization_id, title) VALUES (:id, :organizationId, :id)",
        new MapSqlParameterSource().addValue("id", id).addValue("organizationId", organizationId));
  }

  public void objective(String id, String initiativeId) {
    jdbcTemplate.update(
        "INSERT INTO objectives (id, initiative_id, title) VALUES (:id, :initiativeId, :id)",
        new MapSqlParameterSource().addValue("id", id).addValue("initiativeId", initiativeId));
  }

  public void task(
      String id,
      String status,
      Instant dueDate,
      String assigneeId,
      String initiativeId,
      String objectiveId,
      Instant touchedAt) {
    jdbcTemplate.update(
        """
        INSERT INTO tasks (
          id, title, status, due_date, assignee_id, initiative_id, objective_id,
          created_at, updated_at
        ) VALUES (
          :id, :title, :status, :dueDate, :assigneeId, :initiativeId, :objectiveId,
          :touchedAt, :touchedAt
        )
        """,
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("title", "Task " + id)
            .addValue("status", status)
            .addValue("dueDate", toTimestamp(dueDate))
            .addValue("assigneeId", assigneeId)
            .addValue("initiativeId", initiativeId)
            .addValue("objectiveId", objectiveId)
            .addValue("touchedAt", toTimestamp(touchedAt)));
  }

  public void oneOnOne(String id, String managerId, String reportId, Instant scheduledAt) {
    jdbcTemplate.update(
        """
        INSERT INTO one_on_ones (id, manager_id, report_id, scheduled_at)
        VALUES (:id, :managerId, :reportId, :scheduledAt)
        """,
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("managerId", managerId)
            .addValue("reportId", reportId)
            .addValue("scheduledAt", toTimestamp(scheduledAt)));
  }

  public void feedback(String id, String aboutId, Instant createdAt) {
    jdbcTemplate.update(
        "INSERT INTO feedback (id, about_id, created_at) VALUES (:id, :aboutId, :createdAt)",
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("aboutId", aboutId)
            .addValue("createdAt", toTimestamp(createdAt)));
  }
}
