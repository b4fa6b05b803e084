package com.example.socialnotify.service;

import com.example.socialnotify.model.NotificationRecord;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one {@link ActivityEventProcessor#process} call.
 *
 * @param skipped true when the event was missing or already processed and nothing was attempted
 * @param filtered candidates dropped by the preference filter or because they could not be loaded
 */
public record FanoutResult(
    UUID eventId,
    List<NotificationRecord> notifications,
    int suppressed,
    int failed,
    int filtered,
    boolean skipped) {

  public FanoutResult {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }

  static FanoutResult skipped(UUID eventId) {
    return new FanoutResult(eventId, List.of(), 0, 0, 0, true);
  }
}
