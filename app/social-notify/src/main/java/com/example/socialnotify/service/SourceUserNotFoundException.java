/*
 * どこで: Social Notify サービス層
 * 何を: イベント発生元ユーザが解決できないことを示す例外
 * なぜ: イベントを未処理のまま残し、リカバリで再試行させる判断に使うため
 */
package com.example.socialnotify.service;

import java.util.UUID;
import lombok.Getter;

@Getter
public class SourceUserNotFoundException extends RuntimeException {

  private final UUID eventId;
  private final String sourceUserId;

  public SourceUserNotFoundException(UUID eventId, String sourceUserId) {
    super("source user not found: " + sourceUserId);
    this.eventId = eventId;
    this.sourceUserId = sourceUserId;
  }
}
