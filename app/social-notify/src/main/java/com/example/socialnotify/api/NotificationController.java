/*
 * どこで: Social Notify API
 * 何を: 受信者向けの通知一覧/既読化/非表示化/統計/クリーンアップのエンドポイントを提供する
 * なぜ: 配信を pull 型の参照 API として公開するため
 */
package com.example.socialnotify.api;

import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.NotificationStatus;
import com.example.socialnotify.service.NotificationInboxService;
import com.example.socialnotify.service.NotificationPage;
import com.example.socialnotify.service.NotificationRetentionService;
import com.example.socialnotify.service.NotificationRetentionService.RetentionResult;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class NotificationController {

  private final NotificationInboxService inboxService;
  private final NotificationRetentionService retentionService;
  private final Clock clock;

  @GetMapping("/users/{user_id}/notifications")
  public NotificationsResponse list(
      @PathVariable("user_id") String userId,
      @RequestParam(value = "status", required = false) String status,
      @RequestParam(value = "type", required = false) String types,
      @RequestParam(value = "limit", defaultValue = "50")
          @Min(value = 1, message = "limit must be between 1 and 200")
          @Max(value = 200, message = "limit must be between 1 and 200")
          int limit,
      @RequestParam(value = "skip", defaultValue = "0")
          @Min(value = 0, message = "skip must not be negative")
          int skip) {
    final NotificationPage page =
        inboxService.list(userId, parseStatus(status), parseTypes(types), limit, skip);
    final Instant now = Instant.now(clock);
    final List<NotificationSummary> items =
        page.notifications().stream().map(n -> NotificationSummary.from(n, now)).toList();
    return new NotificationsResponse(userId, items, items.size(), page.unreadCount());
  }

  @PutMapping("/notifications/{notification_id}/read")
  public NotificationSummary markRead(@PathVariable("notification_id") UUID notificationId) {
    return NotificationSummary.from(inboxService.markRead(notificationId), Instant.now(clock));
  }

  @PutMapping("/users/{user_id}/notifications/read-all")
  public MarkAllReadResponse markAllRead(@PathVariable("user_id") String userId) {
    return new MarkAllReadResponse(userId, inboxService.markAllRead(userId));
  }

  @DeleteMapping("/notifications/{notification_id}")
  public NotificationSummary dismiss(@PathVariable("notification_id") UUID notificationId) {
    return NotificationSummary.from(inboxService.dismiss(notificationId), Instant.now(clock));
  }

  @GetMapping("/notifications/stats")
  public NotificationStatsResponse stats() {
    return NotificationStatsResponse.of(inboxService.stats());
  }

  @PostMapping("/notifications/cleanup")
  public CleanupResponse cleanup(
      @RequestParam(value = "purge_expired", defaultValue = "false") boolean purgeExpired) {
    final RetentionResult result = retentionService.cleanup();
    final int purged = purgeExpired ? retentionService.purgeExpired() : 0;
    return new CleanupResponse(
        result.deletedNotifications(), result.deletedEvents(), result.keptUnread(), purged);
  }

  private NotificationStatus parseStatus(String status) {
    if (status == null || status.isBlank()) {
      return null;
    }
    try {
      return NotificationStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("invalid status: " + status, ex);
    }
  }

  // type=LIKE,COMMENT のカンマ区切りを受け付ける
  private List<EventType> parseTypes(String types) {
    if (types == null || types.isBlank()) {
      return List.of();
    }
    return Arrays.stream(types.split(","))
        .map(String::trim)
        .filter(value -> !value.isEmpty())
        .map(
            value ->
                EventType.fromValue(value)
                    .orElseThrow(() -> new IllegalArgumentException("invalid type: " + value)))
        .toList();
  }
}
