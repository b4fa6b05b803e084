/*
 * どこで: Social Notify ドメインモデル
 * 何を: イベントの種別ごとのペイロード (投稿/コメント/本文/メンション/拡張メタデータ)
 * なぜ: 自由形式の blob ではなく名前付きの任意項目として扱うため
 */
package com.example.socialnotify.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

public record EventData(
    String postId,
    String commentId,
    String content,
    List<String> mentionedUsers,
    Map<String, String> metadata) {

  public EventData {
    mentionedUsers =
        mentionedUsers == null
            ? List.of()
            : mentionedUsers.stream().filter(Objects::nonNull).toList();
    metadata = copyMetadata(metadata);
  }

  // null 値を含む JSON をそのまま受けても不変 Map に落とせるようにする
  static Map<String, String> copyMetadata(Map<String, String> metadata) {
    if (metadata == null) {
      return Map.of();
    }
    return metadata.entrySet().stream()
        .filter(entry -> entry.getKey() != null && entry.getValue() != null)
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
  }

  public static EventData empty() {
    return new EventData(null, null, null, List.of(), Map.of());
  }
}
