/*
 * どこで: Social Notify データアクセス
 * 何を: activity_events の登録/取得/処理済み更新/失敗記録を担う
 * なぜ: 受付・ファンアウト・リカバリが同じ永続イベントを起点に動くため
 */
package com.example.socialnotify.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.socialnotify.model.ActivityEventRecord;
import com.example.socialnotify.model.EventData;
import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.EventTypeStats;
import com.example.socialnotify.model.GeneratedNotification;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ActivityEventRepository {

  private static final TypeReference<List<GeneratedNotification>> GENERATED_LIST =
      new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT event_id, type, source_user_id, target_user_id,
             payload_json::text AS payload_json_text, occurred_at, processed,
             notifications_generated::text AS notifications_generated_text,
             processed_at, recovery_attempts, last_error
      FROM activity_events
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public UUID insert(ActivityEventRecord record) {
    final String sql =
        """
        INSERT INTO activity_events (
          event_id,
          type,
          source_user_id,
          target_user_id,
          payload_json,
          occurred_at,
          processed,
          notifications_generated,
          processed_at,
          recovery_attempts,
          last_error
        ) VALUES (
          :eventId,
          :type,
          :sourceUserId,
          :targetUserId,
          :payloadJson::jsonb,
          :occurredAt,
          :processed,
          :notificationsGenerated::jsonb,
          :processedAt,
          :recoveryAttempts,
          :lastError
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("eventId", record.eventId())
            .addValue("type", record.type().name())
            .addValue("sourceUserId", record.sourceUserId())
            .addValue("targetUserId", record.targetUserId())
            .addValue("payloadJson", writeJson(record.data()))
            .addValue("occurredAt", toTimestamp(record.occurredAt()))
            .addValue("processed", record.processed())
            .addValue("notificationsGenerated", writeJson(record.notificationsGenerated()))
            .addValue("processedAt", toTimestamp(record.processedAt()))
            .addValue("recoveryAttempts", record.recoveryAttempts())
            .addValue("lastError", record.lastError());
    jdbcTemplate.update(sql, params);
    return record.eventId();
  }

  public Optional<ActivityEventRecord> findById(UUID eventId) {
    final String sql = SELECT_COLUMNS + "WHERE event_id = :eventId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("eventId", eventId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** Oldest-first unprocessed events that still have recovery attempts left. */
  public List<ActivityEventRecord> findUnprocessed(int maxAttempts, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE processed = FALSE
              AND recovery_attempts < :maxAttempts
            ORDER BY occurred_at, event_id
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("maxAttempts", maxAttempts).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countExhausted(int maxAttempts) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM activity_events
        WHERE processed = FALSE
          AND recovery_attempts >= :maxAttempts
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("maxAttempts", maxAttempts), Integer.class);
    return count == null ? 0 : count;
  }

  /**
   * Flips {@code processed} and stores the generated pairs in one statement. Returns 0 when the
   * event was already processed (or no longer exists), so the transition happens at most once.
   */
  public int markProcessed(
      UUID eventId, List<GeneratedNotification> generated, Instant processedAt) {
    final String sql =
        """
        UPDATE activity_events
        SET processed = TRUE,
            notifications_generated = :generated::jsonb,
            processed_at = :processedAt,
            last_error = NULL
        WHERE event_id = :eventId
          AND processed = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("generated", writeJson(generated))
            .addValue("processedAt", toTimestamp(processedAt))
            .addValue("eventId", eventId);
    return jdbcTemplate.update(sql, params);
  }

  public int recordFailure(UUID eventId, String errorMessage) {
    final String sql =
        """
        UPDATE activity_events
        SET recovery_attempts = recovery_attempts + 1,
            last_error = :lastError
        WHERE event_id = :eventId
          AND processed = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("lastError", errorMessage)
            .addValue("eventId", eventId);
    return jdbcTemplate.update(sql, params);
  }

  public List<ActivityEventRecord> findByUser(String userId, EventType type, int limit) {
    final StringBuilder sql =
        new StringBuilder(SELECT_COLUMNS)
            .append("WHERE (source_user_id = :userId OR target_user_id = :userId)\n");
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("limit", limit);
    if (type != null) {
      sql.append("  AND type = :type\n");
      params.addValue("type", type.name());
    }
    sql.append("ORDER BY occurred_at DESC\nLIMIT :limit");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public List<ActivityEventRecord> findAll(EventType type, Boolean processed, int limit) {
    final StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE 1 = 1\n");
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    if (type != null) {
      sql.append("  AND type = :type\n");
      params.addValue("type", type.name());
    }
    if (processed != null) {
      sql.append("  AND processed = :processed\n");
      params.addValue("processed", processed);
    }
    sql.append("ORDER BY occurred_at DESC\nLIMIT :limit");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public List<EventTypeStats> statsByType() {
    final String sql =
        """
        SELECT type,
               COUNT(*) AS total,
               COUNT(*) FILTER (WHERE processed) AS processed_total
        FROM activity_events
        GROUP BY type
        ORDER BY type
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new EventTypeStats(
                EventType.valueOf(rs.getString("type")),
                rs.getLong("total"),
                rs.getLong("processed_total")));
  }

  public boolean deleteById(UUID eventId) {
    return jdbcTemplate.update(
            "DELETE FROM activity_events WHERE event_id = :eventId",
            new MapSqlParameterSource().addValue("eventId", eventId))
        > 0;
  }

  public int deleteProcessedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM activity_events
        WHERE processed = TRUE
          AND occurred_at < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  private ActivityEventRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ActivityEventRecord(
        UUID.fromString(rs.getString("event_id")),
        EventType.valueOf(rs.getString("type")),
        rs.getString("source_user_id"),
        rs.getString("target_user_id"),
        readJson(rs.getString("payload_json_text"), EventData.class),
        rs.getTimestamp("occurred_at").toInstant(),
        rs.getBoolean("processed"),
        readGenerated(rs.getString("notifications_generated_text")),
        toInstant(rs.getTimestamp("processed_at")),
        rs.getInt("recovery_attempts"),
        rs.getString("last_error"));
  }

  private String writeJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      // シリアライズ失敗は実装バグのため再試行しても回復しない
      throw new IllegalStateException("activity event json serialization failure", ex);
    }
  }

  private <T> T readJson(String json, Class<T> type) {
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("activity event json parse failure", ex);
    }
  }

  private List<GeneratedNotification> readGenerated(String json) {
    try {
      return objectMapper.readValue(json, GENERATED_LIST);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("activity event json parse failure", ex);
    }
  }
}
