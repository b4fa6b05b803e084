/*
 * どこで: Social Notify サービス層
 * 何を: 候補ユーザをまとめて読み込み、イベント種別を購読しているユーザだけを残す
 * なぜ: 存在しない受信者参照でファンアウト全体を止めず、フォロワー数に比例した往復を避けるため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.UserRecord;
import com.example.socialnotify.repository.UserRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PreferenceFilter {

  private static final Logger logger = LoggerFactory.getLogger(PreferenceFilter.class);

  private final UserRepository userRepository;

  /**
   * Subscribed recipients in candidate order. A storage failure propagates so that the event stays
   * unprocessed and is retried by recovery.
   */
  public List<UserRecord> filter(List<String> candidateIds, EventType type) {
    if (candidateIds.isEmpty()) {
      return List.of();
    }
    final Map<String, UserRecord> loaded = userRepository.findAllByIds(candidateIds);
    final List<UserRecord> accepted = new ArrayList<>();
    for (String candidateId : candidateIds) {
      final UserRecord candidate = loaded.get(candidateId);
      if (candidate == null) {
        logger.debug("recipient skipped because user does not exist userId={}", candidateId);
        continue;
      }
      if (candidate.subscribes(type)) {
        accepted.add(candidate);
      }
    }
    return accepted;
  }
}
