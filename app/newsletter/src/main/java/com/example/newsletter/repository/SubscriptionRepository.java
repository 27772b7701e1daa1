/*
 * どこで: Newsletter データアクセス
 * 何を: subscriptions と subscription_tokens の登録/参照/状態更新を担う
 * なぜ: 購読登録から確認までを配信対象の判定と同じテーブルで管理するため
 */
package com.example.newsletter.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.newsletter.model.SubscriberRecord;
import com.example.newsletter.model.SubscriptionStatus;
import com.example.newsletter.model.SubscriptionToken;
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
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class SubscriptionRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** email が既に登録済みなら何もせず false を返す。 */
  @Transactional(propagation = Propagation.MANDATORY)
  public boolean insertIfAbsent(SubscriberRecord record) {
    final String sql =
        """
        INSERT INTO subscriptions (
          id,
          email,
          name,
          subscribed_at,
          status
        ) VALUES (
          :id,
          :email,
          :name,
          :subscribedAt,
          :status
        )
        ON CONFLICT (email) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", record.id())
            .addValue("email", record.email())
            .addValue("name", record.name())
            .addValue("subscribedAt", toTimestamp(record.subscribedAt()))
            .addValue("status", record.status().dbValue());
    return jdbcTemplate.update(sql, params) > 0;
  }

  public Optional<SubscriberRecord> findByEmail(String email) {
    final String sql =
        """
        SELECT id, email, name, subscribed_at, status
        FROM subscriptions
        WHERE email = :email
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("email", email);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public Optional<SubscriberRecord> findById(UUID id) {
    final String sql =
        """
        SELECT id, email, name, subscribed_at, status
        FROM subscriptions
        WHERE id = :id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", id);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void insertToken(SubscriptionToken token, UUID subscriberId, Instant createdAt) {
    final String sql =
        """
        INSERT INTO subscription_tokens (
          subscription_token,
          subscriber_id,
          created_at
        ) VALUES (
          :token,
          :subscriberId,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("token", token.value())
            .addValue("subscriberId", subscriberId)
            .addValue("createdAt", toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  public Optional<UUID> findSubscriberIdByToken(SubscriptionToken token) {
    final String sql =
        """
        SELECT subscriber_id
        FROM subscription_tokens
        WHERE subscription_token = :token
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("token", token.value());
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> rs.getObject("subscriber_id", UUID.class))
        .stream()
        .findFirst();
  }

  public int updateStatus(UUID subscriberId, SubscriptionStatus status) {
    final String sql =
        """
        UPDATE subscriptions
        SET status = :status
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", subscriberId).addValue("status", status.dbValue());
    return jdbcTemplate.update(sql, params);
  }

  /** 配信対象の email を登録順に返す。値の妥当性は呼び出し側で判定する。 */
  public List<String> findConfirmedEmails() {
    final String sql =
        """
        SELECT email
        FROM subscriptions
        WHERE status = :status
        ORDER BY subscribed_at, email
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", SubscriptionStatus.CONFIRMED.dbValue());
    return jdbcTemplate.queryForList(sql, params, String.class);
  }

  private SubscriberRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SubscriberRecord(
        rs.getObject("id", UUID.class),
        rs.getString("email"),
        rs.getString("name"),
        toInstant(rs.getTimestamp("subscribed_at")),
        SubscriptionStatus.fromDbValue(rs.getString("status")));
  }
}
