/*
 * どこで: Social Notify データアクセス
 * 何を: notifications テーブルの登録/取得/状態遷移/削除を担う
 * なぜ: ファンアウト書き込み・重複抑止・参照 API・保持期間処理を支えるため
 */
package com.example.socialnotify.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.NotificationCount;
import com.example.socialnotify.model.NotificationData;
import com.example.socialnotify.model.NotificationRecord;
import com.example.socialnotify.model.NotificationStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final TypeReference<Map<String, String>> METADATA_MAP = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT notification_id, user_id, type, content, status, source_user_id, related_event_id,
             post_id, comment_id, url, metadata_json::text AS metadata_json_text,
             created_at, read_at, dismissed_at, expires_at
      FROM notifications
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          user_id,
          type,
          content,
          status,
          source_user_id,
          related_event_id,
          post_id,
          comment_id,
          url,
          metadata_json,
          created_at,
          read_at,
          dismissed_at,
          expires_at
        ) VALUES (
          :notificationId,
          :userId,
          :type,
          :content,
          :status,
          :sourceUserId,
          :relatedEventId,
          :postId,
          :commentId,
          :url,
          :metadataJson::jsonb,
          :createdAt,
          :readAt,
          :dismissedAt,
          :expiresAt
        )
        """;
    final NotificationData data = record.data();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("userId", record.userId())
            .addValue("type", record.type().name())
            .addValue("content", record.content())
            .addValue("status", record.status().name())
            .addValue("sourceUserId", record.sourceUserId())
            .addValue("relatedEventId", record.relatedEventId())
            .addValue("postId", data == null ? null : data.postId())
            .addValue("commentId", data == null ? null : data.commentId())
            .addValue("url", data == null ? null : data.url())
            .addValue("metadataJson", writeMetadata(data == null ? Map.of() : data.metadata()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("readAt", toTimestamp(record.readAt()))
            .addValue("dismissedAt", toTimestamp(record.dismissedAt()))
            .addValue("expiresAt", toTimestamp(record.expiresAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public Optional<NotificationRecord> findById(UUID notificationId) {
    final String sql = SELECT_COLUMNS + "WHERE notification_id = :notificationId";
    return jdbcTemplate
        .query(
            sql,
            new MapSqlParameterSource().addValue("notificationId", notificationId),
            this::mapRow)
        .stream()
        .findFirst();
  }

  public List<NotificationRecord> findByUser(
      String userId,
      NotificationStatus status,
      Collection<EventType> types,
      int limit,
      int skip) {
    final StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("WHERE user_id = :userId\n");
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("limit", limit)
            .addValue("skip", skip);
    if (status != null) {
      sql.append("  AND status = :status\n");
      params.addValue("status", status.name());
    }
    if (types != null && !types.isEmpty()) {
      sql.append("  AND type IN (:types)\n");
      params.addValue("types", types.stream().map(EventType::name).toList());
    }
    sql.append("ORDER BY created_at DESC, notification_id\nLIMIT :limit OFFSET :skip");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public int countUnread(String userId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE user_id = :userId
          AND status = 'UNREAD'
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("userId", userId), Integer.class);
    return count == null ? 0 : count;
  }

  /**
   * Whether an equivalent notification exists at or after {@code since}. A missing post id only
   * matches other notifications without one.
   */
  public boolean existsRecent(
      String userId, String sourceUserId, EventType type, String postId, Instant since) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM notifications
          WHERE user_id = :userId
            AND source_user_id = :sourceUserId
            AND type = :type
            AND post_id IS NOT DISTINCT FROM CAST(:postId AS VARCHAR)
            AND created_at >= :since
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("sourceUserId", sourceUserId)
            .addValue("type", type.name())
            .addValue("postId", postId)
            .addValue("since", toTimestamp(since));
    final Boolean exists = jdbcTemplate.queryForObject(sql, params, Boolean.class);
    return Boolean.TRUE.equals(exists);
  }

  /** UNREAD → READ only; a repeated call leaves {@code read_at} untouched. */
  public int markRead(UUID notificationId, Instant readAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'READ',
            read_at = :readAt
        WHERE notification_id = :notificationId
          AND status = 'UNREAD'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("readAt", toTimestamp(readAt))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  public int markAllRead(String userId, Instant readAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'READ',
            read_at = :readAt
        WHERE user_id = :userId
          AND status = 'UNREAD'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("readAt", toTimestamp(readAt))
            .addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  /** UNREAD/READ → DISMISSED; DISMISSED is terminal. */
  public int dismiss(UUID notificationId, Instant dismissedAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'DISMISSED',
            dismissed_at = :dismissedAt
        WHERE notification_id = :notificationId
          AND status IN ('UNREAD', 'READ')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("dismissedAt", toTimestamp(dismissedAt))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  public List<NotificationCount> countByStatusAndType() {
    final String sql =
        """
        SELECT status, type, COUNT(*) AS total
        FROM notifications
        GROUP BY status, type
        ORDER BY status, type
        """;
    return jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        (rs, rowNum) ->
            new NotificationCount(
                NotificationStatus.valueOf(rs.getString("status")),
                EventType.valueOf(rs.getString("type")),
                rs.getLong("total")));
  }

  public int deleteReadOrDismissedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE created_at < :threshold
          AND status IN ('READ', 'DISMISSED')
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  public int countStaleUnread(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE created_at < :threshold
          AND status = 'UNREAD'
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql,
            new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)),
            Integer.class);
    return count == null ? 0 : count;
  }

  /** Physical expiry of any-status rows past {@code expires_at}. */
  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE expires_at < :now
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)));
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String relatedEventId = rs.getString("related_event_id");
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("user_id"),
        EventType.valueOf(rs.getString("type")),
        rs.getString("content"),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getString("source_user_id"),
        relatedEventId == null ? null : UUID.fromString(relatedEventId),
        new NotificationData(
            rs.getString("post_id"),
            rs.getString("comment_id"),
            rs.getString("url"),
            readMetadata(rs.getString("metadata_json_text"))),
        rs.getTimestamp("created_at").toInstant(),
        toInstant(rs.getTimestamp("read_at")),
        toInstant(rs.getTimestamp("dismissed_at")),
        toInstant(rs.getTimestamp("expires_at")));
  }

  private String writeMetadata(Map<String, String> metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification metadata serialization failure", ex);
    }
  }

  private Map<String, String> readMetadata(String json) {
    if (json == null) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, METADATA_MAP);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification metadata parse failure", ex);
    }
  }
}
