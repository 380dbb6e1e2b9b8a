package com.manageros.cron.model;

import java.time.Instant;

public record OverdueTask(
    String id,
    String title,
    Instant dueDate,
    String assigneeId,
    String assigneeName,
    String assigneeUserId) {}
