/*
 * どこで: Social Notify サービス層
 * 何を: イベント ID を受け取るインプロセス FIFO と、それを 1 件ずつ処理する単一ドレインスレッド
 * なぜ: 受付を即時応答にしつつ、ライブ受付とリカバリの両方を 1 本の消費者で直列化するため
 */
package com.example.socialnotify.service;

import com.example.common.TraceIds;
import com.example.socialnotify.config.EventQueueProperties;
import com.example.socialnotify.config.RecoveryProperties;
import com.example.socialnotify.repository.ActivityEventRepository;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
public class ActivityEventQueue {

  private static final Logger logger = LoggerFactory.getLogger(ActivityEventQueue.class);
  private static final String MDC_EVENT_ID = "event_id";

  private final ActivityEventProcessor processor;
  private final ActivityEventRepository eventRepository;
  private final NotificationMetrics metrics;
  private final EventQueueProperties properties;
  private final RecoveryProperties recoveryProperties;
  private final BlockingQueue<UUID> channel;
  private final Set<UUID> waiting;
  private final AtomicBoolean running;
  private ExecutorService drainExecutor;

  public ActivityEventQueue(
      ActivityEventProcessor processor,
      ActivityEventRepository eventRepository,
      NotificationMetrics metrics,
      EventQueueProperties properties,
      RecoveryProperties recoveryProperties) {
    this.processor = processor;
    this.eventRepository = eventRepository;
    this.metrics = metrics;
    this.properties = properties;
    this.recoveryProperties = recoveryProperties;
    this.channel = new LinkedBlockingQueue<>(properties.capacity());
    this.waiting = ConcurrentHashMap.newKeySet();
    this.running = new AtomicBoolean(false);
    metrics.bindQueueDepth(channel);
  }

  @PostConstruct
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    drainExecutor =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("activity-event-drain-%d")
                .setDaemon(true)
                .build());
    drainExecutor.execute(this::drainLoop);
    logger.info("activity event queue started capacity={}", properties.capacity());
  }

  @PreDestroy
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    drainExecutor.shutdown();
    try {
      if (!drainExecutor.awaitTermination(
          properties.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        drainExecutor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      drainExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    // 取り残した ID は DB 上で未処理のままなので、次回のリカバリで拾われる
    logger.info("activity event queue stopped remaining={}", channel.size());
  }

  /**
   * Non-blocking. Returns false when the buffer is full; the event then stays unprocessed in
   * storage until the next recovery sweep. An id that is already waiting is not added twice.
   */
  public boolean enqueue(UUID eventId) {
    if (!waiting.add(eventId)) {
      logger.debug("activity event already queued eventId={}", eventId);
      return true;
    }
    if (!channel.offer(eventId)) {
      waiting.remove(eventId);
      metrics.recordQueueRejected();
      logger.warn(
          "activity event queue full; left for recovery eventId={} capacity={}",
          eventId,
          properties.capacity());
      return false;
    }
    return true;
  }

  public int depth() {
    return channel.size();
  }

  private void drainLoop() {
    while (running.get()) {
      final UUID eventId;
      try {
        eventId = channel.poll(properties.pollTimeout().toMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
      if (eventId == null) {
        continue;
      }
      waiting.remove(eventId);
      processOne(eventId);
    }
  }

  @VisibleForTesting
  void processOne(UUID eventId) {
    MDC.put(MDC_EVENT_ID, eventId.toString());
    MDC.put(TraceIds.MDC_KEY, TraceIds.newTraceId());
    try {
      processor.process(eventId);
    } catch (SourceUserNotFoundException ex) {
      // 発生元ユーザ欠落はリカバリで再試行させる
      logger.warn(
          "activity event left unprocessed; source user missing eventId={} sourceUserId={}",
          eventId,
          ex.getSourceUserId());
      handleFailure(eventId, ex);
    } catch (DataAccessException ex) {
      logger.warn("activity event left unprocessed after storage failure eventId={}", eventId, ex);
      handleFailure(eventId, ex);
    } catch (RuntimeException ex) {
      logger.error("activity event processing failed eventId={}", eventId, ex);
      handleFailure(eventId, ex);
    } finally {
      MDC.remove(MDC_EVENT_ID);
      MDC.remove(TraceIds.MDC_KEY);
    }
  }

  private void handleFailure(UUID eventId, RuntimeException cause) {
    metrics.recordEventResult("failed");
    try {
      eventRepository.recordFailure(eventId, truncateError(cause.getMessage()));
    } catch (DataAccessException ex) {
      logger.warn("failed to record activity event failure eventId={}", eventId, ex);
    }
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = recoveryProperties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }
}
