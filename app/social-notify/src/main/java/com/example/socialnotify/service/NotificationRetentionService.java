/*
 * Where: Social Notify service layer
 * What: Applies retention policy for notifications and processed activity events
 * Why: Prevent unbounded growth while never dropping unread notifications or unprocessed events
 */
package com.example.socialnotify.service;

import com.example.socialnotify.config.NotificationRetentionProperties;
import com.example.socialnotify.repository.ActivityEventRepository;
import com.example.socialnotify.repository.NotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationRepository notificationRepository;
  private final ActivityEventRepository eventRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  public RetentionResult cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final Instant eventThreshold = now.minus(Duration.ofDays(properties.eventRetentionDays()));
    final int staleUnread = notificationRepository.countStaleUnread(threshold);
    if (staleUnread > 0) {
      logger.info(
          "notification retention kept stale unread records count={} threshold={}",
          staleUnread,
          threshold);
    }
    final int deletedNotifications =
        notificationRepository.deleteReadOrDismissedOlderThan(threshold);
    final int deletedEvents = eventRepository.deleteProcessedOlderThan(eventThreshold);
    logger.info(
        "notification retention cleanup deleted notifications={} events={} threshold={}"
            + " eventThreshold={}",
        deletedNotifications,
        deletedEvents,
        threshold,
        eventThreshold);
    return new RetentionResult(deletedNotifications, deletedEvents, staleUnread);
  }

  /**
   * Storage-level expiry of any-status notifications past {@code expires_at}. Kept apart from
   * {@link #cleanup()}, which must never remove unread records.
   */
  public int purgeExpired() {
    final Instant now = Instant.now(clock);
    final int deleted = notificationRepository.deleteExpired(now);
    logger.info("expired notifications purged deleted={} now={}", deleted, now);
    return deleted;
  }

  public record RetentionResult(int deletedNotifications, int deletedEvents, int keptUnread) {}
}
