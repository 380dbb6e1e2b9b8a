package com.manageros.cron.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.manageros.cron.job.NotificationDraft;
import com.manageros.cron.model.NotificationRecord;
import com.manageros.cron.model.NotificationType;
import com.manageros.cron.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-02T09:00:00Z");

  @Mock private NotificationRepository notificationRepository;

  private NotificationService service() {
    return new NotificationService(
        notificationRepository,
        new MetadataJson(new ObjectMapper()),
        Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void createStampsClockAndSerializesMetadata() {
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("deduplicationKey", "overdue-tasks:t-1");
    metadata.put("jobId", "overdue-tasks-notification");
    final NotificationDraft draft =
        new NotificationDraft(
            "Overdue Task",
            "Task \"Ship\" is overdue",
            NotificationType.WARNING,
            "org-1",
            "user-1",
            metadata);
    when(notificationRepository.insert(any()))
        .thenAnswer(invocation -> invocation.<NotificationRecord>getArgument(0).notificationId());

    final NotificationRecord created = service().create(draft);

    final ArgumentCaptor<NotificationRecord> captor =
        ArgumentCaptor.forClass(NotificationRecord.class);
    verify(notificationRepository).insert(captor.capture());
    final NotificationRecord stored = captor.getValue();
    assertThat(stored).isEqualTo(created);
    assertThat(stored.createdAt()).isEqualTo(FIXED_NOW);
    assertThat(stored.type()).isEqualTo(NotificationType.WARNING);
    assertThat(stored.metadataJson())
        .isEqualTo(
            "{\"deduplicationKey\":\"overdue-tasks:t-1\",\"jobId\":\"overdue-tasks-notification\"}");
  }

  @Test
  void deduplicationLookupDelegatesToRepository() {
    final Instant since = FIXED_NOW.minusSeconds(3600);
    when(notificationRepository.existsWithDeduplicationKeySince(
            "user-1", "org-1", "birthday:Ann:0", since))
        .thenReturn(true);

    assertThat(
            service().existsWithDeduplicationKeySince("user-1", "org-1", "birthday:Ann:0", since))
        .isTrue();
  }
}
