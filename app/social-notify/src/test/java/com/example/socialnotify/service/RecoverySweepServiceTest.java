/*
 * どこで: RecoverySweepService のユニットテスト
 * 何を: 未処理イベントを古い順にキューへ再投入し、上限到達分を数えることを検証する
 * なぜ: クラッシュ後の取りこぼしが最終的にファンアウトされることを担保するため
 */
package com.example.socialnotify.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

import com.example.socialnotify.config.RecoveryProperties;
import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.repository.ActivityEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RecoverySweepServiceTest {

  private static final int MAX_ATTEMPTS = 5;
  private static final int BATCH_SIZE = 10;

  @Mock private ActivityEventRepository eventRepository;

  @Mock private ActivityEventQueue eventQueue;

  private SimpleMeterRegistry registry;
  private RecoverySweepService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    service =
        new RecoverySweepService(
            eventRepository,
            eventQueue,
            new RecoveryProperties(
                true, true, Duration.ofMinutes(1), BATCH_SIZE, MAX_ATTEMPTS, 1000),
            new NotificationMetrics(registry));
  }

  @Test
  void reEnqueuesUnprocessedEventsOldestFirst() {
    final ActivityEventRecord older = unprocessed(Instant.parse("2026-03-01T00:00:00Z"));
    final ActivityEventRecord newer = unprocessed(Instant.parse("2026-03-01T00:01:00Z"));
    when(eventRepository.countExhausted(MAX_ATTEMPTS)).thenReturn(0);
    when(eventRepository.findUnprocessed(MAX_ATTEMPTS, BATCH_SIZE))
        .thenReturn(List.of(older, newer));
    when(eventQueue.enqueue(older.eventId())).thenReturn(true);
    when(eventQueue.enqueue(newer.eventId())).thenReturn(true);

    final RecoverySweepResult result = service.sweep();

    assertThat(result).isEqualTo(new RecoverySweepResult(2, 2, 0));
    final InOrder order = inOrder(eventQueue);
    order.verify(eventQueue).enqueue(older.eventId());
    order.verify(eventQueue).enqueue(newer.eventId());
    assertThat(registry.get("social_notify.recovery.enqueued.total").counter().count())
        .isEqualTo(2.0d);
  }

  @Test
  void fullQueueAndExhaustedEventsAreReported() {
    final ActivityEventRecord pending = unprocessed(Instant.parse("2026-03-01T00:00:00Z"));
    when(eventRepository.countExhausted(MAX_ATTEMPTS)).thenReturn(3);
    when(eventRepository.findUnprocessed(MAX_ATTEMPTS, BATCH_SIZE)).thenReturn(List.of(pending));
    when(eventQueue.enqueue(pending.eventId())).thenReturn(false);

    final RecoverySweepResult result = service.sweep();

    assertThat(result).isEqualTo(new RecoverySweepResult(1, 0, 3));
  }

  @Test
  void nothingToRecover() {
    when(eventRepository.countExhausted(MAX_ATTEMPTS)).thenReturn(0);
    when(eventRepository.findUnprocessed(MAX_ATTEMPTS, BATCH_SIZE)).thenReturn(List.of());

    assertThat(service.sweep()).isEqualTo(new RecoverySweepResult(0, 0, 0));
  }

  private ActivityEventRecord unprocessed(Instant occurredAt) {
    return ActivityEventRecord.unprocessed(
        UUID.randomUUID(), EventType.LIKE, "user1", "user2", null, occurredAt);
  }
}
