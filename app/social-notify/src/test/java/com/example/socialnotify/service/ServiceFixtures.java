package com.example.socialnotify.service;

import com.example.socialnotify.config.FanoutProperties;
import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.EventData;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.UserRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

// サービス層テスト共通のイベント/ユーザ生成
final class ServiceFixtures {

  static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");
  static final FanoutProperties FANOUT_PROPERTIES =
      new FanoutProperties(Duration.ofMinutes(5), Duration.ofDays(30), "http://localhost:3000", 50);

  private ServiceFixtures() {}

  static UserRecord user(String userId, String username) {
    return new UserRecord(userId, username, UserRecord.DEFAULT_NOTIFICATION_TYPES);
  }

  static UserRecord user(String userId, String username, Set<EventType> types) {
    return new UserRecord(userId, username, types);
  }

  static ActivityEventRecord event(EventType type, String source, String target) {
    return event(type, source, target, new EventData("p1", null, null, List.of(), Map.of()));
  }

  static ActivityEventRecord event(
      EventType type, String source, String target, EventData data) {
    return ActivityEventRecord.unprocessed(
        UUID.randomUUID(), type, source, target, data, FIXED_NOW);
  }
}
