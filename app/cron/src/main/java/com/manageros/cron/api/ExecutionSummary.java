/*
 * Where: Cron API model
 * What: One execution record as returned by the reporting endpoint
 * Why: Exposes metadata as JSON rather than an escaped string
 */
package com.manageros.cron.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.manageros.cron.model.ExecutionStatus;
import java.time.Instant;
import java.util.UUID;

public record ExecutionSummary(
    UUID executionId,
    String jobId,
    String jobName,
    String organizationId,
    ExecutionStatus status,
    Instant startedAt,
    Instant completedAt,
    int notificationsCreated,
    String error,
    JsonNode metadata) {}
