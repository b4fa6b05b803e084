/*
 * どこで: Social Notify サービス層
 * 何を: ファンアウト結果/イベント処理結果/処理時間/キュー滞留/リカバリ再投入のメトリクスを記録する
 * なぜ: 重複抑止や受信者単位の失敗を Prometheus から直接観測できるようにするため
 */
package com.example.socialnotify.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  static final String METRIC_FANOUT_NOTIFICATIONS = "social_notify.fanout.notifications.total";
  static final String METRIC_EVENTS_PROCESSED = "social_notify.events.processed.total";
  static final String METRIC_EVENTS_SUBMITTED = "social_notify.events.submitted.total";
  static final String METRIC_FANOUT_DURATION = "social_notify.fanout.duration";
  static final String METRIC_QUEUE_DEPTH = "social_notify.queue.depth";
  static final String METRIC_QUEUE_REJECTED = "social_notify.queue.rejected.total";
  static final String METRIC_RECOVERY_ENQUEUED = "social_notify.recovery.enqueued.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> fanoutCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> eventCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> submittedCounters = new ConcurrentHashMap<>();
  private final Timer fanoutDuration;
  private final Counter queueRejected;
  private final Counter recoveryEnqueued;

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.fanoutDuration =
        Timer.builder(METRIC_FANOUT_DURATION)
            .description("Time spent fanning out a single activity event")
            .register(meterRegistry);
    this.queueRejected =
        Counter.builder(METRIC_QUEUE_REJECTED)
            .description("Events left for recovery because the in-process queue was full")
            .register(meterRegistry);
    this.recoveryEnqueued =
        Counter.builder(METRIC_RECOVERY_ENQUEUED)
            .description("Unprocessed events re-driven by the recovery sweep")
            .register(meterRegistry);
  }

  /** result: created / suppressed / failed / filtered. */
  public void recordFanout(String result, int amount) {
    if (amount <= 0) {
      return;
    }
    counter(
            fanoutCounters,
            METRIC_FANOUT_NOTIFICATIONS,
            "Per-recipient fan-out outcomes",
            "result",
            result)
        .increment(amount);
  }

  public void recordEventResult(String result) {
    counter(
            eventCounters,
            METRIC_EVENTS_PROCESSED,
            "Activity event processing outcomes",
            "result",
            result)
        .increment();
  }

  public void recordSubmitted(String type) {
    counter(submittedCounters, METRIC_EVENTS_SUBMITTED, "Accepted activity events", "type", type)
        .increment();
  }

  public void recordFanoutDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    fanoutDuration.record(duration);
  }

  public void recordQueueRejected() {
    queueRejected.increment();
  }

  public void recordRecoveryEnqueued(int count) {
    if (count > 0) {
      recoveryEnqueued.increment(count);
    }
  }

  public void bindQueueDepth(Collection<?> queue) {
    Gauge.builder(METRIC_QUEUE_DEPTH, queue, Collection::size)
        .description("Activity events waiting in the in-process queue")
        .strongReference(true)
        .register(meterRegistry);
  }

  private Counter counter(
      ConcurrentMap<String, Counter> cache,
      String name,
      String description,
      String tagKey,
      String tagValue) {
    return cache.computeIfAbsent(
        tagValue,
        ignored ->
            Counter.builder(name)
                .description(description)
                .tags(Tags.of(tagKey, tagValue))
                .register(meterRegistry));
  }
}
