package com.example.socialnotify.service;

/**
 * @param found unprocessed events loaded in this sweep
 * @param enqueued events handed to the queue
 * @param exhausted unprocessed events that used up their recovery attempts
 */
public record RecoverySweepResult(int found, int enqueued, int exhausted) {}
