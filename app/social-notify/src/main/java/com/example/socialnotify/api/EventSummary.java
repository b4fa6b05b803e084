/*
 * どこで: Social Notify API モデル
 * 何を: 受け付けたイベントと、その処理結果 (生成された通知の対応表) の要素
 * なぜ: 処理状況をクライアントから確認できるようにするため
 */
package com.example.socialnotify.api;

import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.EventData;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.GeneratedNotification;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventSummary(
    UUID eventId,
    EventType type,
    String sourceUserId,
    String targetUserId,
    EventRequest.EventPayload data,
    Instant timestamp,
    boolean processed,
    Instant processedAt,
    int recoveryAttempts,
    List<GeneratedNotificationSummary> notificationsGenerated) {

  public EventSummary {
    notificationsGenerated =
        notificationsGenerated == null ? List.of() : List.copyOf(notificationsGenerated);
  }

  public static EventSummary from(ActivityEventRecord record) {
    final EventData data = record.data();
    return new EventSummary(
        record.eventId(),
        record.type(),
        record.sourceUserId(),
        record.targetUserId(),
        new EventRequest.EventPayload(
            data.postId(), data.commentId(), data.content(), data.mentionedUsers(),
            data.metadata()),
        record.occurredAt(),
        record.processed(),
        record.processedAt(),
        record.recoveryAttempts(),
        record.notificationsGenerated().stream().map(GeneratedNotificationSummary::from).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record GeneratedNotificationSummary(UUID notificationId, String userId) {

    static GeneratedNotificationSummary from(GeneratedNotification generated) {
      return new GeneratedNotificationSummary(generated.notificationId(), generated.userId());
    }
  }
}
