package com.example.socialnotify.model;

import java.util.Map;

/** Subject references and deep link copied onto a notification at creation time. */
public record NotificationData(
    String postId, String commentId, String url, Map<String, String> metadata) {

  public NotificationData {
    metadata = EventData.copyMetadata(metadata);
  }
}
