package com.manageros.cron.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Tags log lines of an API call with its request id, path and the requested job/organization
 * filters. The request id is echoed back in the {@code X-Request-Id} response header.
 */
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String KEY_REQUEST_ID = "request_id";
  static final String KEY_PATH = "http_path";
  static final String KEY_JOB = "requested_job";
  static final String KEY_ORG = "requested_org";

  private static final List<String> KEYS = List.of(KEY_REQUEST_ID, KEY_PATH, KEY_JOB, KEY_ORG);

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String header = request.getHeader(REQUEST_ID_HEADER);
    final String requestId =
        header == null || header.isBlank() ? UUID.randomUUID().toString() : header.trim();
    response.setHeader(REQUEST_ID_HEADER, requestId);
    MDC.put(KEY_REQUEST_ID, requestId);
    MDC.put(KEY_PATH, request.getRequestURI());
    putIfPresent(KEY_JOB, request.getParameter("job"));
    putIfPresent(KEY_ORG, request.getParameter("org"));
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    KEYS.forEach(MDC::remove);
  }

  private static void putIfPresent(String key, @Nullable String value) {
    if (value != null && !value.isBlank()) {
      MDC.put(key, value);
    }
  }
}
