/*
 * どこで: Social Notify サービス層
 * 何を: 受信者向けの通知一覧/未読数/既読化/一括既読化/非表示化を提供する
 * なぜ: 配信は pull 型の読み取りで行い、状態遷移の単調性を 1 箇所で守るため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.api.NotificationNotFoundException;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.NotificationCount;
import com.example.socialnotify.model.NotificationRecord;
import com.example.socialnotify.model.NotificationStatus;
import com.example.socialnotify.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationInboxService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationInboxService.class);

  private final NotificationRepository notificationRepository;
  private final Clock clock;

  public NotificationPage list(
      String userId,
      NotificationStatus status,
      Collection<EventType> types,
      int limit,
      int skip) {
    final List<NotificationRecord> notifications =
        notificationRepository.findByUser(userId, status, types, limit, skip);
    return new NotificationPage(notifications, notificationRepository.countUnread(userId));
  }

  /** Idempotent: a notification that is no longer unread is returned unchanged. */
  public NotificationRecord markRead(UUID notificationId) {
    requireExisting(notificationId);
    final int updated = notificationRepository.markRead(notificationId, Instant.now(clock));
    if (updated == 0) {
      logger.debug("notification already read or dismissed id={}", notificationId);
    }
    return requireExisting(notificationId);
  }

  public int markAllRead(String userId) {
    final int updated = notificationRepository.markAllRead(userId, Instant.now(clock));
    logger.info("notifications marked read userId={} count={}", userId, updated);
    return updated;
  }

  public NotificationRecord dismiss(UUID notificationId) {
    requireExisting(notificationId);
    final int updated = notificationRepository.dismiss(notificationId, Instant.now(clock));
    if (updated == 0) {
      logger.debug("notification already dismissed id={}", notificationId);
    }
    return requireExisting(notificationId);
  }

  public List<NotificationCount> stats() {
    return notificationRepository.countByStatusAndType();
  }

  private NotificationRecord requireExisting(UUID notificationId) {
    return notificationRepository
        .findById(notificationId)
        .orElseThrow(() -> new NotificationNotFoundException(notificationId));
  }
}
