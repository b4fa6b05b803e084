package com.example.socialnotify.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** {@code expiredPurged} is zero unless the purge was requested. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CleanupResponse(
    int deletedNotifications, int deletedEvents, int keptUnread, int expiredPurged) {}
