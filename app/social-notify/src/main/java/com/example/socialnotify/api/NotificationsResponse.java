package com.example.socialnotify.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationsResponse(
    String userId, List<NotificationSummary> notifications, int count, int unreadCount) {

  public NotificationsResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
