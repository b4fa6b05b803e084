package com.example.socialnotify.service;

import com.example.socialnotify.model.EventType;
import java.time.Instant;
import java.util.UUID;

/**
 * Acknowledges acceptance, not completion.
 *
 * @param queued false when the in-process buffer was full and the event waits for recovery
 */
public record EventAcceptance(UUID eventId, EventType type, Instant timestamp, boolean queued) {}
