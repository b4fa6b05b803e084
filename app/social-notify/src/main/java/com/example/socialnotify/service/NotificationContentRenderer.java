/*
 * どこで: Social Notify サービス層
 * 何を: 種別ごとのテンプレートで通知文面とディープリンク URL を生成する
 * なぜ: 作成時点の表示名で文面を固定し、後から再計算しないため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.config.FanoutProperties;
import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.UserRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

@Component
@RequiredArgsConstructor
public class NotificationContentRenderer {

  private static final String ELLIPSIS = "...";

  private final FanoutProperties properties;

  public String content(ActivityEventRecord event, UserRecord sourceUser) {
    final String username = sourceUser.username();
    return switch (event.type()) {
      case LIKE -> username + " liked your post";
      case COMMENT -> commentContent(username, event.data().content());
      case FOLLOW -> username + " started following you";
      case POST_CREATE -> username + " shared a new post";
      case MENTION -> username + " mentioned you in a post";
      case SHARE -> username + " shared your post";
    };
  }

  public String url(ActivityEventRecord event) {
    final String postId = event.data().postId();
    return switch (event.type()) {
      case FOLLOW -> link("profile", event.sourceUserId());
      case LIKE, COMMENT, SHARE, POST_CREATE, MENTION -> link("posts", postId);
    };
  }

  private String commentContent(String username, String comment) {
    if (comment == null || comment.isEmpty()) {
      return username + " commented on your post";
    }
    return username + " commented: \"" + excerpt(comment) + "\"";
  }

  // サロゲートペアを途中で切らないようコードポイント単位で数える
  private String excerpt(String comment) {
    final int maxLength = properties.commentExcerptLength();
    if (comment.codePointCount(0, comment.length()) <= maxLength) {
      return comment;
    }
    return comment.substring(0, comment.offsetByCodePoints(0, maxLength)) + ELLIPSIS;
  }

  private String link(String section, String id) {
    final String baseUrl = properties.frontendBaseUrl();
    if (id == null || id.isBlank()) {
      return baseUrl;
    }
    return UriComponentsBuilder.fromUriString(baseUrl)
        .pathSegment(section, id)
        .build()
        .encode()
        .toUriString();
  }
}
