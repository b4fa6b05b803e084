/*
 * Where: Social Notify application configuration binding
 * What: Holds recovery sweep schedule and retry bound
 * Why: Keep unprocessed-event re-drive tunable and stop a poisoned event from spinning forever
 */
package com.example.socialnotify.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "social-notify.recovery")
public record RecoveryProperties(
    boolean enabled,
    boolean runOnStartup,
    Duration interval,
    int batchSize,
    int maxAttempts,
    int errorMessageMaxLength) {}
