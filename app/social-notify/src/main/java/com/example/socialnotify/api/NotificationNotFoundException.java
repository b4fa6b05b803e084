package com.example.socialnotify.api;

import java.util.UUID;

public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(UUID notificationId) {
    super("notification not found: " + notificationId);
  }
}
