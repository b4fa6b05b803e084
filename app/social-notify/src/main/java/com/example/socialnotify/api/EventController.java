/*
 * どこで: Social Notify API
 * 何を: アクティビティイベントの受付/参照/削除/リカバリ起動のエンドポイントを提供する
 * なぜ: 受付は 202 で即時応答し、ファンアウトはキューに任せるため
 */
package com.example.socialnotify.api;

import com.example.socialnotify.model.EventType;
import com.example.socialnotify.service.ActivityEventQueryService;
import com.example.socialnotify.service.EventAcceptance;
import com.example.socialnotify.service.EventSubmissionService;
import com.example.socialnotify.service.RecoverySweepResult;
import com.example.socialnotify.service.RecoverySweepService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class EventController {

  private final EventSubmissionService submissionService;
  private final ActivityEventQueryService queryService;
  private final RecoverySweepService recoverySweepService;

  @PostMapping("/events")
  public ResponseEntity<EventAcceptedResponse> submit(@RequestBody EventRequest request) {
    final EventAcceptance acceptance = submissionService.submit(request.toSubmission());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(
            new EventAcceptedResponse(
                acceptance.eventId(), acceptance.type(), acceptance.timestamp()));
  }

  @GetMapping("/events")
  public EventsResponse listAll(
      @RequestParam(value = "type", required = false) String type,
      @RequestParam(value = "processed", required = false) Boolean processed,
      @RequestParam(value = "limit", defaultValue = "100")
          @Min(value = 1, message = "limit must be between 1 and 500")
          @Max(value = 500, message = "limit must be between 1 and 500")
          int limit) {
    final List<EventSummary> events =
        queryService.listAll(parseType(type), processed, limit).stream()
            .map(EventSummary::from)
            .toList();
    return new EventsResponse(events, events.size(), queryService.stats());
  }

  @GetMapping("/users/{user_id}/events")
  public EventsResponse listByUser(
      @PathVariable("user_id") String userId,
      @RequestParam(value = "type", required = false) String type,
      @RequestParam(value = "limit", defaultValue = "50")
          @Min(value = 1, message = "limit must be between 1 and 500")
          @Max(value = 500, message = "limit must be between 1 and 500")
          int limit) {
    final List<EventSummary> events =
        queryService.listByUser(userId, parseType(type), limit).stream()
            .map(EventSummary::from)
            .toList();
    return new EventsResponse(events, events.size(), List.of());
  }

  @DeleteMapping("/events/{event_id}")
  public ResponseEntity<Void> delete(@PathVariable("event_id") UUID eventId) {
    queryService.delete(eventId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/events/recovery")
  public RecoveryResponse recover() {
    final RecoverySweepResult result = recoverySweepService.sweep();
    return new RecoveryResponse(result.found(), result.enqueued(), result.exhausted());
  }

  private EventType parseType(String type) {
    if (type == null || type.isBlank()) {
      return null;
    }
    return EventType.fromValue(type.trim())
        .orElseThrow(() -> new InvalidEventException("invalid event type: " + type));
  }
}
