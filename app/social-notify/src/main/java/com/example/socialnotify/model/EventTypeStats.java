package com.example.socialnotify.model;

public record EventTypeStats(EventType type, long count, long processed) {}
