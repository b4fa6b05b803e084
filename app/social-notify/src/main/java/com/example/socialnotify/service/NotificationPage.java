package com.example.socialnotify.service;

import com.example.socialnotify.model.NotificationRecord;
import java.util.List;

public record NotificationPage(List<NotificationRecord> notifications, int unreadCount) {

  public NotificationPage {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
