package com.manageros.cron.model;

public record Organization(String id, String externalId, String name) {}
