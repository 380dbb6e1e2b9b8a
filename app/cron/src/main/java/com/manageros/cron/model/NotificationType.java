package com.manageros.cron.model;

public enum NotificationType {
  INFO,
  WARNING,
  SUCCESS,
  ERROR
}
