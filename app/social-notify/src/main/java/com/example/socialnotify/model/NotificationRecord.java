/*
 * どこで: Social Notify ドメインモデル
 * 何を: notifications テーブルのスナップショット
 * なぜ: ファンアウト書き込みと参照 API で共通化するため
 */
package com.example.socialnotify.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String userId,
    EventType type,
    String content,
    NotificationStatus status,
    String sourceUserId,
    UUID relatedEventId,
    NotificationData data,
    Instant createdAt,
    Instant readAt,
    Instant dismissedAt,
    Instant expiresAt) {}
