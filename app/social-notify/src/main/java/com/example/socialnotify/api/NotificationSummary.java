/*
 * どこで: Social Notify API モデル
 * 何を: 通知一覧の要素 (相対時刻付き)
 * なぜ: 期限 (expires_at) は内部管理用として露出しないため
 */
package com.example.socialnotify.api;

import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.NotificationData;
import com.example.socialnotify.model.NotificationRecord;
import com.example.socialnotify.model.NotificationStatus;
import com.example.socialnotify.service.RelativeAgeFormatter;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    String userId,
    EventType type,
    String content,
    NotificationStatus status,
    String sourceUserId,
    UUID relatedEventId,
    String postId,
    String commentId,
    String url,
    Map<String, String> metadata,
    Instant createdAt,
    Instant readAt,
    Instant dismissedAt,
    String timeAgo,
    long ageMinutes) {

  public static NotificationSummary from(NotificationRecord record, Instant now) {
    final NotificationData data = record.data();
    return new NotificationSummary(
        record.notificationId(),
        record.userId(),
        record.type(),
        record.content(),
        record.status(),
        record.sourceUserId(),
        record.relatedEventId(),
        data == null ? null : data.postId(),
        data == null ? null : data.commentId(),
        data == null ? null : data.url(),
        data == null ? Map.of() : data.metadata(),
        record.createdAt(),
        record.readAt(),
        record.dismissedAt(),
        RelativeAgeFormatter.timeAgo(record.createdAt(), now),
        RelativeAgeFormatter.ageInMinutes(record.createdAt(), now));
  }
}
