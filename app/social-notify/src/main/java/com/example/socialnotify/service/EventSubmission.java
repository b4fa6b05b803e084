package com.example.socialnotify.service;

import com.example.socialnotify.model.EventData;

/** Raw submission as received from a submitter; validated by {@link EventSubmissionService}. */
public record EventSubmission(
    String type, String sourceUserId, String targetUserId, EventData data) {}
