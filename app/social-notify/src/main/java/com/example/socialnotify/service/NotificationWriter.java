/*
 * どこで: Social Notify サービス層
 * 何を: 重複抑止を通過した受信者 1 人分の通知を組み立てて保存する
 * なぜ: 受信者ごとの書き込みを 1 回の永続化に閉じ、失敗を受信者単位に局所化するため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.config.FanoutProperties;
import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.NotificationData;
import com.example.socialnotify.model.NotificationRecord;
import com.example.socialnotify.model.NotificationStatus;
import com.example.socialnotify.model.UserRecord;
import com.example.socialnotify.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.IdGenerator;

@Component
@RequiredArgsConstructor
public class NotificationWriter {

  private static final Logger logger = LoggerFactory.getLogger(NotificationWriter.class);

  private final DeduplicationGate deduplicationGate;
  private final NotificationContentRenderer renderer;
  private final NotificationRepository notificationRepository;
  private final FanoutProperties properties;
  private final IdGenerator idGenerator;
  private final Clock clock;

  /** Empty when an equivalent notification was written inside the dedup window. */
  public Optional<NotificationRecord> write(
      ActivityEventRecord event, UserRecord sourceUser, UserRecord recipient) {
    final String postId = event.data().postId();
    if (deduplicationGate.isDuplicate(
        recipient.userId(), sourceUser.userId(), event.type(), postId)) {
      logger.info(
          "duplicate notification suppressed userId={} sourceUserId={} type={} postId={}",
          recipient.userId(),
          sourceUser.userId(),
          event.type(),
          postId);
      return Optional.empty();
    }
    final Instant now = Instant.now(clock);
    final NotificationRecord record =
        new NotificationRecord(
            idGenerator.generateId(),
            recipient.userId(),
            event.type(),
            renderer.content(event, sourceUser),
            NotificationStatus.UNREAD,
            sourceUser.userId(),
            event.eventId(),
            new NotificationData(
                postId, event.data().commentId(), renderer.url(event), event.data().metadata()),
            now,
            null,
            null,
            now.plus(properties.notificationTtl()));
    notificationRepository.insert(record);
    logger.debug(
        "notification created id={} userId={} eventId={}",
        record.notificationId(),
        record.userId(),
        event.eventId());
    return Optional.of(record);
  }
}
