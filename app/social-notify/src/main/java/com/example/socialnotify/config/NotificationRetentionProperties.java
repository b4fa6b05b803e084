/*
 * Where: Social Notify application configuration binding
 * What: Holds retention cleanup settings for notifications and processed events
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.socialnotify.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "social-notify.retention")
public record NotificationRetentionProperties(
    boolean enabled, int retentionDays, int eventRetentionDays, Duration cleanupInterval) {}
