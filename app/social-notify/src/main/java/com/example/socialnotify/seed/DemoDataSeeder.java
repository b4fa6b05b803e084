/*
 * どこで: Social Notify 起動時処理
 * 何を: users テーブルが空のときだけデモ用ユーザ/フォロー関係/処理済みイベントと通知を投入する
 * なぜ: ローカル環境で起動直後から受信箱の表示とイベント投入からのファンアウトを試せるようにするため
 */
package com.example.socialnotify.seed;

import com.example.socialnotify.config.FanoutProperties;
import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.EventData;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.GeneratedNotification;
import com.example.socialnotify.model.NotificationData;
import com.example.socialnotify.model.NotificationRecord;
import com.example.socialnotify.model.NotificationStatus;
import com.example.socialnotify.model.UserRecord;
import com.example.socialnotify.repository.ActivityEventRepository;
import com.example.socialnotify.repository.NotificationRepository;
import com.example.socialnotify.repository.UserRepository;
import com.example.socialnotify.service.NotificationContentRenderer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.IdGenerator;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "social-notify.seed.enabled", havingValue = "true")
public class DemoDataSeeder implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(DemoDataSeeder.class);

  static final Map<String, String> USERNAMES =
      Map.of(
          "user1", "alex_architect",
          "user2", "priya_designer",
          "user3", "rohit_urban",
          "user4", "maya_sustainable",
          "user5", "demo_user");

  // follower -> followees
  static final Map<String, List<String>> FOLLOWING =
      Map.of(
          "user1", List.of("user2", "user4"),
          "user2", List.of("user1"),
          "user3", List.of("user1", "user2"),
          "user4", List.of("user2", "user3"),
          "user5", List.of("user1", "user2"));

  // user1 は未読 3 件、user2 は未読 1 件と既読 1 件になる
  static final List<SampleActivity> HISTORY =
      List.of(
          new SampleActivity(
              EventType.FOLLOW, "user2", "user1", EventData.empty(), 60, "user1", null),
          new SampleActivity(
              EventType.LIKE,
              "user3",
              "user1",
              new EventData(
                  "post123", null, "Great sustainable design project!", List.of(), Map.of()),
              30,
              "user1",
              null),
          new SampleActivity(
              EventType.COMMENT,
              "user4",
              "user2",
              new EventData(
                  "post456",
                  "comment789",
                  "Love the use of natural lighting in this design!",
                  List.of(),
                  Map.of()),
              15,
              "user2",
              10L),
          new SampleActivity(
              EventType.POST_CREATE,
              "user1",
              null,
              new EventData(
                  "post789",
                  null,
                  "Just completed a sustainable office complex in Mumbai",
                  List.of(),
                  Map.of()),
              10,
              "user2",
              null),
          new SampleActivity(
              EventType.MENTION,
              "user2",
              "user1",
              new EventData(
                  "post999",
                  null,
                  "Thanks to @alex_architect for the inspiration!",
                  List.of("user1"),
                  Map.of()),
              5,
              "user1",
              null));

  private final UserRepository userRepository;
  private final ActivityEventRepository eventRepository;
  private final NotificationRepository notificationRepository;
  private final NotificationContentRenderer renderer;
  private final FanoutProperties fanoutProperties;
  private final IdGenerator idGenerator;
  private final Clock clock;

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    if (userRepository.countUsers() > 0) {
      logger.debug("demo seed skipped: users already present");
      return;
    }
    final Instant now = Instant.now(clock);
    USERNAMES.forEach(
        (userId, username) ->
            userRepository.upsertProfile(
                userId, username, UserRecord.DEFAULT_NOTIFICATION_TYPES, now));
    FOLLOWING.forEach(
        (followerId, followees) ->
            followees.forEach(followeeId -> userRepository.follow(followerId, followeeId, now)));
    for (SampleActivity activity : HISTORY) {
      seedActivity(activity, now);
    }
    logger.info(
        "demo data seeded users={} events={} notifications={}",
        USERNAMES.size(),
        HISTORY.size(),
        HISTORY.size());
  }

  private void seedActivity(SampleActivity activity, Instant now) {
    final Instant occurredAt = now.minus(Duration.ofMinutes(activity.minutesAgo()));
    final UUID eventId = idGenerator.generateId();
    final UUID notificationId = idGenerator.generateId();
    final ActivityEventRecord event =
        new ActivityEventRecord(
            eventId,
            activity.type(),
            activity.sourceUserId(),
            activity.targetUserId(),
            activity.data(),
            occurredAt,
            true,
            List.of(new GeneratedNotification(notificationId, activity.recipientId())),
            occurredAt,
            0,
            null);
    eventRepository.insert(event);

    final UserRecord sourceUser =
        new UserRecord(
            activity.sourceUserId(),
            USERNAMES.get(activity.sourceUserId()),
            UserRecord.DEFAULT_NOTIFICATION_TYPES);
    final boolean read = activity.readMinutesAgo() != null;
    notificationRepository.insert(
        new NotificationRecord(
            notificationId,
            activity.recipientId(),
            activity.type(),
            renderer.content(event, sourceUser),
            read ? NotificationStatus.READ : NotificationStatus.UNREAD,
            activity.sourceUserId(),
            eventId,
            new NotificationData(
                activity.data().postId(),
                activity.data().commentId(),
                renderer.url(event),
                Map.of()),
            occurredAt,
            read ? now.minus(Duration.ofMinutes(activity.readMinutesAgo())) : null,
            null,
            occurredAt.plus(fanoutProperties.notificationTtl())));
  }

  /** One already fanned-out event with the single notification it produced. */
  record SampleActivity(
      EventType type,
      String sourceUserId,
      String targetUserId,
      EventData data,
      long minutesAgo,
      String recipientId,
      Long readMinutesAgo) {}
}
