package com.example.socialnotify.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "social-notify.seed")
public record SeedProperties(boolean enabled) {}
