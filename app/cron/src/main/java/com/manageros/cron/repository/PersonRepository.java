/*
 * Where: Cron data access
 * What: Reads managers with linked user accounts together with their direct reports
 * Why: Birthday and activity jobs notify managers about their reports
 */
package com.manageros.cron.repository;

import com.manageros.cron.model.ManagerReports;
import com.manageros.cron.model.PersonSummary;
import java.sql.Date;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PersonRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<ManagerReports> findManagersWithBirthdayReports(String organizationId) {
    final String sql =
        """
        SELECT m.id AS manager_id, m.name AS manager_name, m.user_id,
               r.id AS report_id, r.name AS report_name, r.birthday
        FROM people m
        JOIN people r ON r.manager_id = m.id
        WHERE m.organization_id = :organizationId
          AND m.user_id IS NOT NULL
          AND r.birthday IS NOT NULL
        ORDER BY m.id, r.name
        """;
    return queryGrouped(sql, organizationId);
  }

  public List<ManagerReports> findActiveManagersWithActiveReports(String organizationId) {
    final String sql =
        """
        SELECT m.id AS manager_id, m.name AS manager_name, m.user_id,
               r.id AS report_id, r.name AS report_name, r.birthday
        FROM people m
        JOIN people r ON r.manager_id = m.id
        WHERE m.organization_id = :organizationId
          AND m.status = 'active'
          AND m.user_id IS NOT NULL
          AND r.status = 'active'
        ORDER BY m.id, r.name
        """;
    return queryGrouped(sql, organizationId);
  }

  private List<ManagerReports> queryGrouped(String sql, String organizationId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("organizationId", organizationId);
    final List<ManagerReportRow> rows =
        jdbcTemplate.query(
            sql,
            params,
            (rs, rowNum) -> {
              final Date birthday = rs.getDate("birthday");
              return new ManagerReportRow(
                  rs.getString("manager_id"),
                  rs.getString("manager_name"),
                  rs.getString("user_id"),
                  new PersonSummary(
                      rs.getString("report_id"),
                      rs.getString("report_name"),
                      birthday == null ? null : birthday.toLocalDate()));
            });
    final Map<String, ManagerReportRow> managers = new LinkedHashMap<>();
    final Map<String, List<PersonSummary>> reportsByManager = new LinkedHashMap<>();
    for (ManagerReportRow row : rows) {
      managers.putIfAbsent(row.managerId(), row);
      reportsByManager
          .computeIfAbsent(row.managerId(), ignored -> new ArrayList<>())
          .add(row.report());
    }
    final List<ManagerReports> result = new ArrayList<>(managers.size());
    for (ManagerReportRow manager : managers.values()) {
      result.add(
          new ManagerReports(
              manager.managerId(),
              manager.managerName(),
              manager.userId(),
              reportsByManager.get(manager.managerId())));
    }
    return result;
  }

  private record ManagerReportRow(
      String managerId, String managerName, String userId, PersonSummary report) {}
}
