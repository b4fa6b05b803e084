/*
 * どこで: Social Notify API モデル
 * 何を: イベント受付リクエスト
 * なぜ: 種別の妥当性はサービス層で判定し、400 の文言を 1 箇所に揃えるため
 */
package com.example.socialnotify.api;

import com.example.socialnotify.model.EventData;
import com.example.socialnotify.service.EventSubmission;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventRequest(
    String type, String sourceUserId, String targetUserId, EventPayload data) {

  public EventSubmission toSubmission() {
    final EventData eventData = data == null ? EventData.empty() : data.toEventData();
    return new EventSubmission(type, sourceUserId, targetUserId, eventData);
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record EventPayload(
      String postId,
      String commentId,
      String content,
      List<String> mentionedUsers,
      Map<String, String> metadata) {

    EventData toEventData() {
      return new EventData(postId, commentId, content, mentionedUsers, metadata);
    }
  }
}
