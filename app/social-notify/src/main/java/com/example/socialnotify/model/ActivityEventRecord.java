/*
 * どこで: Social Notify ドメインモデル
 * 何を: activity_events テーブルのスナップショット
 * なぜ: 受付/ファンアウト/リカバリで同じ形を使い回すため
 */
package com.example.socialnotify.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record ActivityEventRecord(
    UUID eventId,
    EventType type,
    String sourceUserId,
    String targetUserId,
    EventData data,
    Instant occurredAt,
    boolean processed,
    List<GeneratedNotification> notificationsGenerated,
    Instant processedAt,
    int recoveryAttempts,
    String lastError) {

  public ActivityEventRecord {
    data = data == null ? EventData.empty() : data;
    notificationsGenerated =
        notificationsGenerated == null ? List.of() : List.copyOf(notificationsGenerated);
  }

  public static ActivityEventRecord unprocessed(
      UUID eventId,
      EventType type,
      String sourceUserId,
      String targetUserId,
      EventData data,
      Instant occurredAt) {
    return new ActivityEventRecord(
        eventId, type, sourceUserId, targetUserId, data, occurredAt, false, List.of(), null, 0,
        null);
  }
}
