package com.manageros.cron.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates calls to the cron trigger API with a shared bearer secret. An unset secret is a
 * deployment error and answers 500; a wrong or missing token answers 401.
 */
public class CronTriggerAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(CronTriggerAuthenticationFilter.class);
  static final String CRON_ROLE = "ROLE_CRON";
  private static final String BEARER_PREFIX = "Bearer ";

  private final CronTriggerProperties properties;

  public CronTriggerAuthenticationFilter(CronTriggerProperties properties) {
    this.properties = properties;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    return uri == null || !uri.startsWith(properties.pathPrefix());
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (!properties.isSecretConfigured()) {
      logger.error("cron trigger secret is not configured path={}", request.getRequestURI());
      response.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
      return;
    }
    if (!isValidBearer(request.getHeader(HttpHeaders.AUTHORIZATION))) {
      logger.warn("cron trigger request rejected: invalid token path={}", request.getRequestURI());
      response.sendError(HttpServletResponse.SC_UNAUTHORIZED);
      return;
    }
    SecurityContextHolder.getContext()
        .setAuthentication(
            new UsernamePasswordAuthenticationToken(
                "cron-trigger", "N/A", List.of(new SimpleGrantedAuthority(CRON_ROLE))));
    filterChain.doFilter(request, response);
  }

  private boolean isValidBearer(String authorization) {
    if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
      return false;
    }
    final byte[] actual =
        authorization.substring(BEARER_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
    final byte[] expected = properties.secret().getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(actual, expected);
  }
}
