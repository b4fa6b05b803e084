/*
 * どこで: Social Notify サービス層
 * 何を: イベント種別ごとのポリシーで通知候補のユーザ ID を決める
 * なぜ: 誰に届けるかの判断を書き込み処理から切り離し、単体で検証できるようにするため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.UserRecord;
import com.example.socialnotify.repository.UserRepository;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RecipientResolver {

  private static final Logger logger = LoggerFactory.getLogger(RecipientResolver.class);

  private final UserRepository userRepository;

  /**
   * Candidate recipient ids for {@code event}, without duplicates and in a deterministic order for
   * identical relationship data. Never contains the acting user for direct or mention events.
   */
  public List<String> resolve(ActivityEventRecord event, UserRecord sourceUser) {
    final String sourceUserId = sourceUser.userId();
    final Set<String> recipients = new LinkedHashSet<>();
    switch (event.type()) {
      case LIKE, COMMENT, SHARE, FOLLOW -> addDirectTarget(recipients, event, sourceUserId);
      case POST_CREATE -> recipients.addAll(userRepository.findFollowerIds(sourceUserId));
      case MENTION -> {
        for (String mentioned : event.data().mentionedUsers()) {
          if (!mentioned.isBlank() && !mentioned.equals(sourceUserId)) {
            recipients.add(mentioned);
          }
        }
      }
      default ->
          // 想定外の種別はエラーにせず、受信者なしとして処理を完了させる
          logger.warn(
              "unknown activity event type resolved to no recipients eventId={} type={}",
              event.eventId(),
              event.type());
    }
    return new ArrayList<>(recipients);
  }

  private void addDirectTarget(
      Set<String> recipients, ActivityEventRecord event, String sourceUserId) {
    final String targetUserId = event.targetUserId();
    if (targetUserId == null || targetUserId.isBlank() || targetUserId.equals(sourceUserId)) {
      return;
    }
    recipients.add(targetUserId);
  }
}
