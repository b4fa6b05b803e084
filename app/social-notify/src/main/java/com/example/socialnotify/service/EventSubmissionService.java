/*
 * どこで: Social Notify サービス層
 * 何を: イベントを検証して未処理として永続化し、キューへ積む
 * なぜ: 受付は即時応答し、ファンアウトは非同期に 1 本のワーカーで行うため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.api.InvalidEventException;
import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.EventData;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.repository.ActivityEventRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.IdGenerator;

@Service
@RequiredArgsConstructor
public class EventSubmissionService {

  private static final Logger logger = LoggerFactory.getLogger(EventSubmissionService.class);

  // 保存先の列幅 (user_id 系 VARCHAR(64), post_id / comment_id VARCHAR(128)) に合わせる
  static final int MAX_USER_ID_LENGTH = 64;
  static final int MAX_REFERENCE_ID_LENGTH = 128;

  private final ActivityEventRepository eventRepository;
  private final ActivityEventQueue eventQueue;
  private final NotificationMetrics metrics;
  private final IdGenerator idGenerator;
  private final Clock clock;

  public EventAcceptance submit(EventSubmission submission) {
    final EventType type = validateType(submission.type());
    final String sourceUserId = trimToNull(submission.sourceUserId());
    if (sourceUserId == null) {
      throw new InvalidEventException("source_user_id is required");
    }
    final String targetUserId = trimToNull(submission.targetUserId());
    final EventData data = submission.data() == null ? EventData.empty() : submission.data();
    requireMaxLength("source_user_id", sourceUserId, MAX_USER_ID_LENGTH);
    requireMaxLength("target_user_id", targetUserId, MAX_USER_ID_LENGTH);
    requireMaxLength("data.post_id", data.postId(), MAX_REFERENCE_ID_LENGTH);
    requireMaxLength("data.comment_id", data.commentId(), MAX_REFERENCE_ID_LENGTH);
    for (String mentioned : data.mentionedUsers()) {
      requireMaxLength("data.mentioned_users", mentioned, MAX_USER_ID_LENGTH);
    }
    final UUID eventId = idGenerator.generateId();
    final Instant now = Instant.now(clock);
    final ActivityEventRecord record =
        ActivityEventRecord.unprocessed(eventId, type, sourceUserId, targetUserId, data, now);
    // 永続化を先に済ませ、キュー投入に失敗してもリカバリで拾えるようにする
    eventRepository.insert(record);
    final boolean queued = eventQueue.enqueue(eventId);
    metrics.recordSubmitted(type.name());
    logger.info(
        "activity event accepted eventId={} type={} sourceUserId={} queued={}",
        eventId,
        type,
        sourceUserId,
        queued);
    return new EventAcceptance(eventId, type, now, queued);
  }

  private EventType validateType(String rawType) {
    if (rawType == null || rawType.isBlank()) {
      throw new InvalidEventException("type is required");
    }
    return EventType.fromValue(rawType.trim())
        .orElseThrow(() -> new InvalidEventException("invalid event type: " + rawType));
  }

  // 受付後に書き込みで失敗させず、ここで同期的に拒否する
  private void requireMaxLength(String field, String value, int maxLength) {
    if (value != null && value.length() > maxLength) {
      throw new InvalidEventException(field + " must be at most " + maxLength + " characters");
    }
  }

  private String trimToNull(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
