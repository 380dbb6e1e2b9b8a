package com.manageros.cron.model;

import java.time.Instant;

/** Most recent qualifying activity found for a person: its kind and when it happened. */
public record ActivitySignal(String activityType, Instant occurredAt) {

  public static final String TASK = "task";
  public static final String ONE_ON_ONE = "one-on-one";
  public static final String FEEDBACK = "feedback";
}
