/*
 * どこで: Social Notify データアクセス
 * 何を: users / user_follows / user_notification_types の参照と初期投入を担う
 * なぜ: 受信者解決と購読フィルタに必要な関係データを読むため
 */
package com.example.socialnotify.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.socialnotify.model.EventType;
import com.example.socialnotify.model.UserRecord;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findById(String userId) {
    return Optional.ofNullable(findAllByIds(List.of(userId)).get(userId));
  }

  /**
   * Loads the given users and their subscribed types in one statement. Ids with no user row are
   * absent from the result.
   */
  public Map<String, UserRecord> findAllByIds(Collection<String> userIds) {
    if (userIds.isEmpty()) {
      return Map.of();
    }
    final String sql =
        """
        SELECT u.user_id, u.username, t.type
        FROM users u
        LEFT JOIN user_notification_types t ON t.user_id = u.user_id
        WHERE u.user_id IN (:userIds)
        """;
    final Map<String, String> usernames = new LinkedHashMap<>();
    final Map<String, Set<EventType>> types = new HashMap<>();
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource().addValue("userIds", userIds),
        (RowCallbackHandler)
            rs -> {
              final String userId = rs.getString("user_id");
              usernames.putIfAbsent(userId, rs.getString("username"));
              final Set<EventType> subscribed =
                  types.computeIfAbsent(userId, id -> EnumSet.noneOf(EventType.class));
              final String rawType = rs.getString("type");
              if (rawType != null) {
                // 列挙に無い値は購読対象外として読み飛ばす
                EventType.fromValue(rawType).ifPresent(subscribed::add);
              }
            });
    final Map<String, UserRecord> users = new LinkedHashMap<>();
    usernames.forEach(
        (userId, username) ->
            users.put(userId, new UserRecord(userId, username, types.get(userId))));
    return users;
  }

  /** Ids of every user whose following set contains {@code userId}, in a stable order. */
  public List<String> findFollowerIds(String userId) {
    final String sql =
        """
        SELECT follower_id
        FROM user_follows
        WHERE followee_id = :userId
        ORDER BY follower_id
        """;
    return jdbcTemplate.queryForList(
        sql, new MapSqlParameterSource().addValue("userId", userId), String.class);
  }

  public void upsertProfile(
      String userId, String username, Set<EventType> notificationTypes, Instant now) {
    final String sql =
        """
        INSERT INTO users (user_id, username, created_at, updated_at)
        VALUES (:userId, :username, :now, :now)
        ON CONFLICT (user_id) DO UPDATE
        SET username = EXCLUDED.username,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("username", username)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
    jdbcTemplate.update(
        "DELETE FROM user_notification_types WHERE user_id = :userId",
        new MapSqlParameterSource().addValue("userId", userId));
    for (EventType type : notificationTypes) {
      jdbcTemplate.update(
          "INSERT INTO user_notification_types (user_id, type) VALUES (:userId, :type)",
          new MapSqlParameterSource().addValue("userId", userId).addValue("type", type.name()));
    }
  }

  public boolean follow(String followerId, String followeeId, Instant now) {
    final String sql =
        """
        INSERT INTO user_follows (follower_id, followee_id, created_at)
        VALUES (:followerId, :followeeId, :now)
        ON CONFLICT (follower_id, followee_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("followerId", followerId)
            .addValue("followeeId", followeeId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int countUsers() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM users", new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }
}
