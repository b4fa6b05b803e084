/*
 * どこで: ActivityEventQueue のユニットテスト
 * 何を: 投入/容量超過/単一ドレインスレッドでの処理/失敗時の試行記録を検証する
 * なぜ: 受付を止めずに取りこぼしをリカバリへ引き継げることを担保するため
 */
package com.example.socialnotify.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.socialnotify.config.EventQueueProperties;
import com.example.socialnotify.config.RecoveryProperties;
import com.example.socialnotify.repository.ActivityEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class ActivityEventQueueTest {

  private static final int CAPACITY = 2;

  @Mock private ActivityEventProcessor processor;

  @Mock private ActivityEventRepository eventRepository;

  private SimpleMeterRegistry registry;
  private ActivityEventQueue queue;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    queue =
        new ActivityEventQueue(
            processor,
            eventRepository,
            new NotificationMetrics(registry),
            new EventQueueProperties(CAPACITY, Duration.ofMillis(50), Duration.ofSeconds(2)),
            new RecoveryProperties(true, false, Duration.ofMinutes(1), 100, 3, 13));
  }

  @AfterEach
  void tearDown() {
    queue.stop();
  }

  @Test
  void fullQueueRejectsAndLeavesEventForRecovery() {
    assertThat(queue.enqueue(UUID.randomUUID())).isTrue();
    assertThat(queue.enqueue(UUID.randomUUID())).isTrue();

    assertThat(queue.enqueue(UUID.randomUUID())).isFalse();
    assertThat(queue.depth()).isEqualTo(CAPACITY);
    assertThat(registry.get("social_notify.queue.rejected.total").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("social_notify.queue.depth").gauge().value()).isEqualTo(2.0d);
  }

  @Test
  void sameIdWaitingIsNotQueuedTwice() {
    final UUID eventId = UUID.randomUUID();

    assertThat(queue.enqueue(eventId)).isTrue();
    assertThat(queue.enqueue(eventId)).isTrue();

    assertThat(queue.depth()).isEqualTo(1);
  }

  @Test
  void drainThreadProcessesEventsInSubmissionOrder() throws InterruptedException {
    final UUID first = UUID.randomUUID();
    final UUID second = UUID.randomUUID();
    final List<UUID> processed = new CopyOnWriteArrayList<>();
    final CountDownLatch latch = new CountDownLatch(2);
    doAnswer(
            invocation -> {
              processed.add(invocation.getArgument(0));
              latch.countDown();
              return FanoutResult.skipped(invocation.getArgument(0));
            })
        .when(processor)
        .process(any(UUID.class));

    queue.enqueue(first);
    queue.enqueue(second);
    queue.start();

    assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(processed).containsExactly(first, second);
  }

  @Test
  void missingSourceUserRecordsFailedAttempt() {
    final UUID eventId = UUID.randomUUID();
    when(processor.process(eventId)).thenThrow(new SourceUserNotFoundException(eventId, "ghost"));

    queue.processOne(eventId);

    verify(eventRepository).recordFailure(eventId, "source user n");
    assertThat(
            registry.get("social_notify.events.processed.total").tag("result", "failed").counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void storageFailureWhileRecordingAttemptIsNotPropagated() {
    final UUID eventId = UUID.randomUUID();
    when(processor.process(eventId)).thenThrow(new QueryTimeoutException("db down"));
    when(eventRepository.recordFailure(eventId, "db down"))
        .thenThrow(new QueryTimeoutException("still down"));

    queue.processOne(eventId);

    verify(eventRepository).recordFailure(eventId, "db down");
  }

  @Test
  void successfulProcessingDoesNotRecordFailure() {
    final UUID eventId = UUID.randomUUID();
    when(processor.process(eventId)).thenReturn(FanoutResult.skipped(eventId));

    queue.processOne(eventId);

    verify(eventRepository, never()).recordFailure(any(), anyString());
  }
}
