package com.example.socialnotify.api;

import com.example.socialnotify.model.NotificationCount;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationStatsResponse(List<NotificationCount> counts, long total) {

  public NotificationStatsResponse {
    counts = counts == null ? List.of() : List.copyOf(counts);
  }

  public static NotificationStatsResponse of(List<NotificationCount> counts) {
    return new NotificationStatsResponse(
        counts, counts.stream().mapToLong(NotificationCount::count).sum());
  }
}
