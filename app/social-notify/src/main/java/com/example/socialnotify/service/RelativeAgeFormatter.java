package com.example.socialnotify.service;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/** Renders "just now", "5m ago", "3h ago", "2d ago", or the UTC date for older records. */
public final class RelativeAgeFormatter {

  private static final long MINUTE = 60;
  private static final long HOUR = 60 * MINUTE;
  private static final long DAY = 24 * HOUR;
  private static final long THIRTY_DAYS = 30 * DAY;

  private RelativeAgeFormatter() {}

  public static String timeAgo(Instant createdAt, Instant now) {
    final long seconds = Math.max(0, Duration.between(createdAt, now).getSeconds());
    if (seconds < MINUTE) {
      return "just now";
    }
    if (seconds < HOUR) {
      return (seconds / MINUTE) + "m ago";
    }
    if (seconds < DAY) {
      return (seconds / HOUR) + "h ago";
    }
    if (seconds < THIRTY_DAYS) {
      return (seconds / DAY) + "d ago";
    }
    return createdAt.atZone(ZoneOffset.UTC).toLocalDate().toString();
  }

  public static long ageInMinutes(Instant createdAt, Instant now) {
    return Math.max(0, Duration.between(createdAt, now).toMinutes());
  }
}
