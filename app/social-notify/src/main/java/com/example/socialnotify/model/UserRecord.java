/*
 * どこで: Social Notify ドメインモデル
 * 何を: 受信者解決と購読フィルタが読むユーザ情報 (表示名/購読種別)
 * なぜ: ユーザのライフサイクルは外部所有のため、読み取り専用の射影として扱うため
 */
package com.example.socialnotify.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public record UserRecord(String userId, String username, Set<EventType> notificationTypes) {

  // SHARE は明示的に購読したユーザにだけ届ける
  public static final Set<EventType> DEFAULT_NOTIFICATION_TYPES =
      Collections.unmodifiableSet(
          EnumSet.of(
              EventType.LIKE,
              EventType.FOLLOW,
              EventType.COMMENT,
              EventType.POST_CREATE,
              EventType.MENTION));

  public UserRecord {
    notificationTypes = notificationTypes == null ? Set.of() : Set.copyOf(notificationTypes);
  }

  public boolean subscribes(EventType type) {
    return notificationTypes.contains(type);
  }
}
