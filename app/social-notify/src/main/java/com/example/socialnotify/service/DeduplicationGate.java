/*
 * どこで: Social Notify サービス層
 * 何を: 同一 (受信者, 発生元, 種別, 投稿) の通知が直近の窓内に作られていれば抑止する
 * なぜ: 連打やリカバリ再処理による重複通知を書き込み前に止めるため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.config.FanoutProperties;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DeduplicationGate {

  private final NotificationRepository notificationRepository;
  private final FanoutProperties properties;
  private final Clock clock;

  /**
   * The window trails the wall clock at processing time, not the event's own timestamp, so a
   * delayed recovery run evaluates a different window than the live path would have.
   */
  public boolean isDuplicate(
      String recipientId, String sourceUserId, EventType type, String postId) {
    final Instant since = Instant.now(clock).minus(properties.dedupWindow());
    return notificationRepository.existsRecent(recipientId, sourceUserId, type, postId, since);
  }
}
