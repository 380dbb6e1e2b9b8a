/*
 * Where: Cron service layer
 * What: Stores notifications created by jobs and answers deduplication lookups
 * Why: Backs the job engine's notification contract with the notifications table
 */
package com.manageros.cron.service;

import com.manageros.cron.job.NotificationDraft;
import com.manageros.cron.job.NotificationStore;
import com.manageros.cron.model.NotificationRecord;
import com.manageros.cron.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationService implements NotificationStore {

  private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

  private final NotificationRepository notificationRepository;
  private final MetadataJson metadataJson;
  private final Clock clock;

  @Override
  public NotificationRecord create(NotificationDraft draft) {
    final NotificationRecord record =
        new NotificationRecord(
            UUID.randomUUID(),
            draft.title(),
            draft.message(),
            draft.type(),
            draft.organizationId(),
            draft.userId(),
            metadataJson.write(draft.metadata()),
            Instant.now(clock));
    notificationRepository.insert(record);
    logger.info(
        "notification created notificationId={} organizationId={} userId={} type={}",
        record.notificationId(),
        record.organizationId(),
        record.userId(),
        record.type());
    return record;
  }

  @Override
  public boolean existsWithDeduplicationKeySince(
      String userId, String organizationId, String deduplicationKey, Instant since) {
    return notificationRepository.existsWithDeduplicationKeySince(
        userId, organizationId, deduplicationKey, since);
  }
}
