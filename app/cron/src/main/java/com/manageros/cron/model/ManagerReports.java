/*
 * Where: Cron domain model
 * What: A manager with a linked user account and the reports a job inspects
 * Why: Jobs notify the manager's user about conditions found on the reports
 */
package com.manageros.cron.model;

import java.util.List;

public record ManagerReports(
    String managerId, String managerName, String userId, List<PersonSummary> reports) {

  public ManagerReports {
    reports = reports == null ? List.of() : List.copyOf(reports);
  }
}
