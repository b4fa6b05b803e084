package com.example.socialnotify.api;

import java.util.UUID;

public class EventNotFoundException extends RuntimeException {

  public EventNotFoundException(UUID eventId) {
    super("event not found: " + eventId);
  }
}
