/*
 * どこで: Social Notify サービス層
 * 何を: 受け付けたイベントの参照/種別統計/削除を提供する
 * なぜ: 運用時に処理状況 (processed / notifications_generated) を確認できるようにするため
 */
package com.example.socialnotify.service;

import com.example.socialnotify.api.EventNotFoundException;
import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.EventTypeStats;
import com.example.socialnotify.repository.ActivityEventRepository;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ActivityEventQueryService {

  private static final Logger logger = LoggerFactory.getLogger(ActivityEventQueryService.class);

  private final ActivityEventRepository eventRepository;

  public List<ActivityEventRecord> listByUser(String userId, EventType type, int limit) {
    return eventRepository.findByUser(userId, type, limit);
  }

  public List<ActivityEventRecord> listAll(EventType type, Boolean processed, int limit) {
    return eventRepository.findAll(type, processed, limit);
  }

  public List<EventTypeStats> stats() {
    return eventRepository.statsByType();
  }

  public void delete(UUID eventId) {
    if (!eventRepository.deleteById(eventId)) {
      throw new EventNotFoundException(eventId);
    }
    logger.info("activity event deleted eventId={}", eventId);
  }
}
