package com.manageros.cron.repository;

import com.manageros.cron.model.Organization;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OrganizationRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Organization> findAll() {
    final String sql =
        """
        SELECT id, external_id, name
        FROM organizations
        ORDER BY created_at, id
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new Organization(
                rs.getString("id"), rs.getString("external_id"), rs.getString("name")));
  }

  public boolean existsById(String organizationId) {
    final String sql = "SELECT EXISTS (SELECT 1 FROM organizations WHERE id = :organizationId)";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("organizationId", organizationId);
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }
}
