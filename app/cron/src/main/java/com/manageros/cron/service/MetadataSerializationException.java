/*
 * Where: Cron service layer
 * What: Signals that metadata could not be written as JSON
 * Why: Lets a job or the runner report the failure instead of storing a broken record
 */
package com.manageros.cron.service;

public class MetadataSerializationException extends RuntimeException {

  public MetadataSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
