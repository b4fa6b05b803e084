package com.example.socialnotify.api;

import com.example.socialnotify.model.EventTypeStats;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** {@code stats} is only populated on the global listing. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EventsResponse(List<EventSummary> events, int count, List<EventTypeStats> stats) {

  public EventsResponse {
    events = events == null ? List.of() : List.copyOf(events);
    stats = stats == null ? List.of() : List.copyOf(stats);
  }
}
