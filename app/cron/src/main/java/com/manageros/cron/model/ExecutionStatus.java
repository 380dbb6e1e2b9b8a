/*
 * Where: Cron domain model
 * What: Lifecycle states of a cron job execution record
 * Why: Keep the stored status and the runner's transitions in one vocabulary
 */
package com.manageros.cron.model;

public enum ExecutionStatus {
  RUNNING,
  COMPLETED,
  FAILED
}
