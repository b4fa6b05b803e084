package com.example.socialnotify.api;

import com.example.socialnotify.model.EventType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventAcceptedResponse(UUID eventId, EventType type, Instant timestamp) {}
