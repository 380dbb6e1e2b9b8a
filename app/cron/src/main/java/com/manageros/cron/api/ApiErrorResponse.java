/*
 * Where: Cron API model
 * What: Common error body
 * Why: Callers branch on a stable code instead of parsing messages
 */
package com.manageros.cron.api;

public record ApiErrorResponse(String code, String message) {}
