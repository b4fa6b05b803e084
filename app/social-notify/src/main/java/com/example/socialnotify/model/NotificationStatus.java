/*
 * どこで: Social Notify ドメインモデル
 * 何を: 通知の既読状態を表す列挙
 * なぜ: DB と処理ロジックの状態を一致させるため
 */
package com.example.socialnotify.model;

public enum NotificationStatus {
  UNREAD,
  READ,
  DISMISSED
}
