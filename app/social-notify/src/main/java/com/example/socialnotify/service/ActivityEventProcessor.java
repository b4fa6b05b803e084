/*
 * どこで: Social Notify サービス層
 * 何を: 1 件のイベントについて 発生元解決→受信者解決→購読フィルタ→重複抑止→書き込み→処理済み更新 を行う
 * なぜ: 途中でクラッシュしてもイベントを未処理のまま残し、リカバリと重複抑止で安全に再実行できるようにするため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.GeneratedNotification;
import com.example.socialnotify.model.NotificationRecord;
import com.example.socialnotify.model.UserRecord;
import com.example.socialnotify.repository.ActivityEventRepository;
import com.example.socialnotify.repository.UserRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ActivityEventProcessor {

  private static final Logger logger = LoggerFactory.getLogger(ActivityEventProcessor.class);

  private final ActivityEventRepository eventRepository;
  private final UserRepository userRepository;
  private final RecipientResolver recipientResolver;
  private final PreferenceFilter preferenceFilter;
  private final NotificationWriter notificationWriter;
  private final NotificationMetrics metrics;
  private final Clock clock;

  /** Re-fetches the event so that queued ids never act on stale state. */
  public FanoutResult process(UUID eventId) {
    final Optional<ActivityEventRecord> event = eventRepository.findById(eventId);
    if (event.isEmpty()) {
      logger.warn("activity event not found; nothing to process eventId={}", eventId);
      metrics.recordEventResult("missing");
      return FanoutResult.skipped(eventId);
    }
    return process(event.get());
  }

  /**
   * Fans the event out and marks it processed.
   *
   * @throws SourceUserNotFoundException when the acting user cannot be loaded; the event is left
   *     unprocessed
   * @throws org.springframework.dao.DataAccessException when the processed-marking write fails
   */
  public FanoutResult process(ActivityEventRecord event) {
    if (event.processed()) {
      logger.debug("activity event already processed eventId={}", event.eventId());
      metrics.recordEventResult("already_processed");
      return FanoutResult.skipped(event.eventId());
    }
    final Instant startedAt = Instant.now(clock);
    final UserRecord sourceUser =
        userRepository
            .findById(event.sourceUserId())
            .orElseThrow(
                () -> new SourceUserNotFoundException(event.eventId(), event.sourceUserId()));

    final List<String> candidates = recipientResolver.resolve(event, sourceUser);
    final List<UserRecord> recipients = preferenceFilter.filter(candidates, event.type());

    final List<NotificationRecord> written = new ArrayList<>();
    int suppressed = 0;
    int failed = 0;
    for (UserRecord recipient : recipients) {
      try {
        final Optional<NotificationRecord> notification =
            notificationWriter.write(event, sourceUser, recipient);
        if (notification.isPresent()) {
          written.add(notification.get());
        } else {
          suppressed++;
        }
      } catch (RuntimeException ex) {
        // 受信者 1 件の失敗はバッチを止めない。再送は行わず、この受信者には届かない
        failed++;
        logger.warn(
            "notification write failed eventId={} userId={}",
            event.eventId(),
            recipient.userId(),
            ex);
      }
    }

    final List<GeneratedNotification> generated =
        written.stream()
            .map(n -> new GeneratedNotification(n.notificationId(), n.userId()))
            .toList();
    final Instant processedAt = Instant.now(clock);
    final int updated = eventRepository.markProcessed(event.eventId(), generated, processedAt);
    if (updated == 0) {
      logger.warn(
          "activity event was already marked processed by another run eventId={}",
          event.eventId());
    }

    final int filtered = candidates.size() - recipients.size();
    metrics.recordFanout("created", written.size());
    metrics.recordFanout("suppressed", suppressed);
    metrics.recordFanout("failed", failed);
    metrics.recordFanout("filtered", filtered);
    metrics.recordEventResult(failed > 0 ? "partial" : "processed");
    metrics.recordFanoutDuration(Duration.between(startedAt, processedAt));
    logger.info(
        "activity event processed eventId={} type={} notifications={} suppressed={} failed={}"
            + " filtered={}",
        event.eventId(),
        event.type(),
        written.size(),
        suppressed,
        failed,
        filtered);
    return new FanoutResult(event.eventId(), written, suppressed, failed, filtered, false);
  }
}
