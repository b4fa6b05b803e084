/*
 * どこで: Social Notify ドメインモデル
 * 何を: 通知の起点となるユーザ操作の種別を表す閉じた列挙
 * なぜ: 受付時の検証と受信者解決/文面生成の分岐を一箇所の型で揃えるため
 */
package com.example.socialnotify.model;

import java.util.Arrays;
import java.util.Optional;

public enum EventType {
  LIKE,
  FOLLOW,
  COMMENT,
  POST_CREATE,
  MENTION,
  SHARE;

  public static Optional<EventType> fromValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(type -> type.name().equals(value)).findFirst();
  }
}
