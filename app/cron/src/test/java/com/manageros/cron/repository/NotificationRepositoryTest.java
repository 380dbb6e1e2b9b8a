package com.manageros.cron.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.manageros.cron.AbstractPostgresContainerTest;
import com.manageros.cron.model.NotificationRecord;
import com.manageros.cron.model.NotificationType;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NotificationRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant BASE_TIME = Instant.parse("2026-03-02T09:00:00Z");
  private static final String KEY = "birthday:Ann:0";

  @Autowired private NotificationRepository repository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
  }

  @Test
  void matchingKeyInsideWindowIsFound() {
    repository.insert(notification("org-1", "user-1", KEY, BASE_TIME));

    assertThat(
            repository.existsWithDeduplicationKeySince(
                "user-1", "org-1", KEY, BASE_TIME.minus(Duration.ofHours(24))))
        .isTrue();
  }

  @Test
  void notificationOlderThanWindowIsIgnored() {
    repository.insert(notification("org-1", "user-1", KEY, BASE_TIME.minus(Duration.ofHours(25))));

    assertThat(
            repository.existsWithDeduplicationKeySince(
                "user-1", "org-1", KEY, BASE_TIME.minus(Duration.ofHours(24))))
        .isFalse();
  }

  @Test
  void lookupIsScopedByKeyUserAndOrganization() {
    repository.insert(notification("org-1", "user-1", KEY, BASE_TIME));
    final Instant since = BASE_TIME.minus(Duration.ofHours(24));

    assertThat(
            repository.existsWithDeduplicationKeySince("user-1", "org-1", "birthday:Ann:1", since))
        .isFalse();
    assertThat(repository.existsWithDeduplicationKeySince("user-2", "org-1", KEY, since)).isFalse();
    assertThat(repository.existsWithDeduplicationKeySince("user-1", "org-2", KEY, since)).isFalse();
    assertThat(repository.existsWithDeduplicationKeySince(null, "org-1", KEY, since)).isFalse();
  }

  @Test
  void organizationWideNotificationsMatchNullUser() {
    repository.insert(notification("org-1", null, KEY, BASE_TIME));

    assertThat(
            repository.existsWithDeduplicationKeySince(
                null, "org-1", KEY, BASE_TIME.minus(Duration.ofHours(1))))
        .isTrue();
  }

  private static NotificationRecord notification(
      String organizationId, String userId, String key, Instant createdAt) {
    return new NotificationRecord(
        UUID.randomUUID(),
        "Birthday Today!",
        "Ann has a birthday today!",
        NotificationType.INFO,
        organizationId,
        userId,
        "{\"deduplicationKey\":\"" + key + "\",\"jobId\":\"birthday-notification\"}",
        createdAt);
  }
}
