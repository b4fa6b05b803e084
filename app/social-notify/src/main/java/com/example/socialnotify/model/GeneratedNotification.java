package com.example.socialnotify.model;

import java.util.UUID;

/** Pair recorded on an event once its fan-out has been marked processed. */
public record GeneratedNotification(UUID notificationId, String userId) {}
