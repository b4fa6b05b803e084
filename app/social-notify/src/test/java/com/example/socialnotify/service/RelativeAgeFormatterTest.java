package com.example.socialnotify.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class RelativeAgeFormatterTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Test
  void formatsByMagnitude() {
    assertThat(RelativeAgeFormatter.timeAgo(NOW.minusSeconds(30), NOW)).isEqualTo("just now");
    assertThat(RelativeAgeFormatter.timeAgo(NOW.minus(Duration.ofMinutes(5)), NOW))
        .isEqualTo("5m ago");
    assertThat(RelativeAgeFormatter.timeAgo(NOW.minus(Duration.ofHours(3)), NOW))
        .isEqualTo("3h ago");
    assertThat(RelativeAgeFormatter.timeAgo(NOW.minus(Duration.ofDays(2)), NOW))
        .isEqualTo("2d ago");
    assertThat(RelativeAgeFormatter.timeAgo(NOW.minus(Duration.ofDays(45)), NOW))
        .isEqualTo("2026-01-15");
  }

  @Test
  void futureTimestampsCountAsJustNow() {
    assertThat(RelativeAgeFormatter.timeAgo(NOW.plusSeconds(90), NOW)).isEqualTo("just now");
    assertThat(RelativeAgeFormatter.ageInMinutes(NOW.plusSeconds(90), NOW)).isZero();
    assertThat(RelativeAgeFormatter.ageInMinutes(NOW.minus(Duration.ofMinutes(90)), NOW))
        .isEqualTo(90L);
  }
}
