package com.manageros.cron.model;

import java.time.LocalDate;

/** A report as seen by the jobs: identity, display name and an optional birthday. */
public record PersonSummary(String id, String name, LocalDate birthday) {}
