/*
 * どこで: Social Notify サービス層
 * 何を: 未処理のまま残ったイベントを古い順に読み出し、ライブ受付と同じキューへ再投入する
 * なぜ: クラッシュ後の取りこぼしを回収しつつ、ファンアウトを単一ワーカーに直列化したままにするため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.config.RecoveryProperties;
import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.repository.ActivityEventRepository;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RecoverySweepService {

  private static final Logger logger = LoggerFactory.getLogger(RecoverySweepService.class);

  private final ActivityEventRepository eventRepository;
  private final ActivityEventQueue eventQueue;
  private final RecoveryProperties properties;
  private final NotificationMetrics metrics;

  public RecoverySweepResult sweep() {
    final int exhausted = eventRepository.countExhausted(properties.maxAttempts());
    if (exhausted > 0) {
      // 上限到達分は自動では再試行しない。運用で原因を取り除いてから attempts を戻す
      logger.error(
          "recovery sweep found events that exhausted their attempts count={} maxAttempts={}",
          exhausted,
          properties.maxAttempts());
    }
    final List<ActivityEventRecord> pending =
        eventRepository.findUnprocessed(properties.maxAttempts(), properties.batchSize());
    int enqueued = 0;
    for (ActivityEventRecord event : pending) {
      if (eventQueue.enqueue(event.eventId())) {
        enqueued++;
      }
    }
    metrics.recordRecoveryEnqueued(enqueued);
    if (!pending.isEmpty()) {
      logger.info(
          "recovery sweep re-enqueued unprocessed events found={} enqueued={}",
          pending.size(),
          enqueued);
    }
    return new RecoverySweepResult(pending.size(), enqueued, exhausted);
  }
}
