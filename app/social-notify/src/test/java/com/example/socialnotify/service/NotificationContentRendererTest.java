/*
 * どこで: NotificationContentRenderer のユニットテスト
 * 何を: 種別ごとの文面テンプレート/コメント抜粋/ディープリンクを検証する
 * なぜ: 表示文言と遷移先 URL の回帰を防ぐため
 */
package com.example.socialnotify.service;

import static com.example.socialnotify.service.ServiceFixtures.FANOUT_PROPERTIES;
import static com.example.socialnotify.service.ServiceFixtures.event;
import static com.example.socialnotify.service.ServiceFixtures.user;
import static org.assertj.core.api.Assertions.assertThat;

import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.EventData;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.UserRecord;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class NotificationContentRendererTest {

  private static final UserRecord ALEX = user("user1", "alex_architect");

  private final NotificationContentRenderer renderer =
      new NotificationContentRenderer(FANOUT_PROPERTIES);

  @Test
  void rendersTemplatePerType() {
    assertThat(renderer.content(event(EventType.LIKE, "user1", "user2"), ALEX))
        .isEqualTo("alex_architect liked your post");
    assertThat(renderer.content(event(EventType.FOLLOW, "user1", "user2"), ALEX))
        .isEqualTo("alex_architect started following you");
    assertThat(renderer.content(event(EventType.POST_CREATE, "user1", null), ALEX))
        .isEqualTo("alex_architect shared a new post");
    assertThat(renderer.content(event(EventType.MENTION, "user1", null), ALEX))
        .isEqualTo("alex_architect mentioned you in a post");
    assertThat(renderer.content(event(EventType.SHARE, "user1", "user2"), ALEX))
        .isEqualTo("alex_architect shared your post");
  }

  @Test
  void commentIsQuotedAndTruncatedAfterFiftyCharacters() {
    final String shortText = "Love the facade";
    final String longText = "x".repeat(60);

    assertThat(renderer.content(comment(shortText), ALEX))
        .isEqualTo("alex_architect commented: \"Love the facade\"");
    assertThat(renderer.content(comment(longText), ALEX))
        .isEqualTo("alex_architect commented: \"" + "x".repeat(50) + "...\"");
    assertThat(renderer.content(comment("y".repeat(50)), ALEX))
        .isEqualTo("alex_architect commented: \"" + "y".repeat(50) + "\"");
  }

  @Test
  void commentWithoutTextFallsBackToGenericWording() {
    assertThat(renderer.content(comment(null), ALEX))
        .isEqualTo("alex_architect commented on your post");
  }

  @Test
  void followLinksToSourceProfileAndOthersToPost() {
    assertThat(renderer.url(event(EventType.FOLLOW, "user1", "user2")))
        .isEqualTo("http://localhost:3000/profile/user1");
    assertThat(renderer.url(event(EventType.LIKE, "user1", "user2")))
        .isEqualTo("http://localhost:3000/posts/p1");
  }

  @Test
  void missingPostIdLinksToBaseUrl() {
    final EventData noPost = new EventData(null, null, null, List.of(), Map.of());

    assertThat(renderer.url(event(EventType.LIKE, "user1", "user2", noPost)))
        .isEqualTo("http://localhost:3000");
  }

  private static ActivityEventRecord comment(String text) {
    return event(
        EventType.COMMENT, "user1", "user2", new EventData("p1", "c1", text, List.of(), Map.of()));
  }
}
