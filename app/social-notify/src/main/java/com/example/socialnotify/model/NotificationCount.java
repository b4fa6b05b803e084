package com.example.socialnotify.model;

public record NotificationCount(NotificationStatus status, EventType type, long count) {}
