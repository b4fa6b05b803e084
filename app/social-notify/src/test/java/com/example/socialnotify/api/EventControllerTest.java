/*
 * どこで: Social Notify API の Web 層テスト
 * 何を: イベント受付の 202 応答/検証エラーの 400/未存在の 404 を検証する
 * なぜ: 受付 API の応答形式を固定するため
 */
package com.example.socialnotify.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.socialnotify.config.RequestMdcInterceptor;
import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.EventData;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.EventTypeStats;
import com.example.socialnotify.model.GeneratedNotification;
import com.example.socialnotify.service.ActivityEventQueryService;
import com.example.socialnotify.service.EventAcceptance;
import com.example.socialnotify.service.EventSubmission;
import com.example.socialnotify.service.EventSubmissionService;
import com.example.socialnotify.service.RecoverySweepResult;
import com.example.socialnotify.service.RecoverySweepService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(EventController.class)
@Import({ApiExceptionHandler.class, RequestMdcInterceptor.class})
class EventControllerTest {

  private static final UUID EVENT_ID = UUID.fromString("11111111-1111-1111-1111-111111111111");
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private EventSubmissionService submissionService;

  @MockitoBean private ActivityEventQueryService queryService;

  @MockitoBean private RecoverySweepService recoverySweepService;

  @Test
  void submitReturnsAcceptedWithEventId() throws Exception {
    when(submissionService.submit(any(EventSubmission.class)))
        .thenReturn(new EventAcceptance(EVENT_ID, EventType.LIKE, NOW, true));
    final String body =
        """
        {
          "type": "LIKE",
          "source_user_id": "user1",
          "target_user_id": "user2",
          "data": {"post_id": "p1"}
        }
        """;

    mockMvc
        .perform(post("/v1/events").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isAccepted())
        .andExpect(header().exists("X-Request-Id"))
        .andExpect(jsonPath("$.event_id").value(EVENT_ID.toString()))
        .andExpect(jsonPath("$.type").value("LIKE"))
        .andExpect(jsonPath("$.timestamp").value("2026-03-01T12:00:00Z"));
  }

  @Test
  void submitReturnsBadRequestForInvalidType() throws Exception {
    when(submissionService.submit(any(EventSubmission.class)))
        .thenThrow(new InvalidEventException("invalid event type: POKE"));

    mockMvc
        .perform(
            post("/v1/events")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"POKE\",\"source_user_id\":\"user1\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("invalid event type: POKE"));
  }

  @Test
  void submitWithoutBodyIsBadRequest() throws Exception {
    mockMvc
        .perform(post("/v1/events").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is required"));
  }

  @Test
  void listByUserReturnsEventsWithGeneratedNotifications() throws Exception {
    final UUID notificationId = UUID.randomUUID();
    final ActivityEventRecord record =
        new ActivityEventRecord(
            EVENT_ID,
            EventType.LIKE,
            "user1",
            "user2",
            new EventData("p1", null, null, List.of(), Map.of()),
            NOW,
            true,
            List.of(new GeneratedNotification(notificationId, "user2")),
            NOW,
            0,
            null);
    when(queryService.listByUser("user1", EventType.LIKE, 50)).thenReturn(List.of(record));

    mockMvc
        .perform(get("/v1/users/user1/events").param("type", "LIKE"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(1))
        .andExpect(jsonPath("$.events[0].processed").value(true))
        .andExpect(jsonPath("$.events[0].data.post_id").value("p1"))
        .andExpect(
            jsonPath("$.events[0].notifications_generated[0].notification_id")
                .value(notificationId.toString()))
        .andExpect(jsonPath("$.events[0].notifications_generated[0].user_id").value("user2"));
  }

  @Test
  void listAllIncludesStats() throws Exception {
    when(queryService.listAll(null, false, 100)).thenReturn(List.of());
    when(queryService.stats()).thenReturn(List.of(new EventTypeStats(EventType.LIKE, 4, 3)));

    mockMvc
        .perform(get("/v1/events").param("processed", "false"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(0))
        .andExpect(jsonPath("$.stats[0].type").value("LIKE"))
        .andExpect(jsonPath("$.stats[0].processed").value(3));
  }

  @Test
  void deleteUnknownEventIsNotFound() throws Exception {
    doThrow(new EventNotFoundException(EVENT_ID)).when(queryService).delete(EVENT_ID);

    mockMvc
        .perform(delete("/v1/events/" + EVENT_ID))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"));
  }

  @Test
  void recoveryReportsSweepResult() throws Exception {
    when(recoverySweepService.sweep()).thenReturn(new RecoverySweepResult(3, 2, 1));

    mockMvc
        .perform(post("/v1/events/recovery"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.found").value(3))
        .andExpect(jsonPath("$.enqueued").value(2))
        .andExpect(jsonPath("$.exhausted").value(1));
  }
}
