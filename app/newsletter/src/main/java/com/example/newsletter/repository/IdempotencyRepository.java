/*
 * どこで: Newsletter データアクセス
 * 何を: idempotency / idempotency_response_headers の確保・確定・参照・削除を担う
 * なぜ: (user_id, idempotency_key) の一意制約を唯一の排他手段として冪等応答を保存/再生するため
 */
package com.example.newsletter.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.newsletter.model.CapturedResponse;
import com.example.newsletter.model.ClaimOutcome;
import com.example.newsletter.model.HeaderPair;
import com.example.newsletter.model.IdempotencyKey;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class IdempotencyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public ClaimOutcome insertClaimIfAbsent(
      UUID userId, IdempotencyKey idempotencyKey, Instant claimedAt, Duration lockWaitTimeout) {
    // 進行中の同一キー INSERT を待つ時間をこのトランザクション内に限って絞る。
    // 超過すると 55P03(lock_not_available) になり、呼び出し側で「処理中」として扱う。
    final String lockTimeoutSql = "SELECT set_config('lock_timeout', :lockTimeout, true)";
    jdbcTemplate.query(
        lockTimeoutSql,
        new MapSqlParameterSource().addValue("lockTimeout", lockWaitTimeout.toMillis() + "ms"),
        rs -> null);

    final String sql =
        """
        INSERT INTO idempotency (
          user_id,
          idempotency_key,
          created_at
        ) VALUES (
          :userId,
          :idempotencyKey,
          :createdAt
        )
        ON CONFLICT DO NOTHING
        """;
    final MapSqlParameterSource params =
        keyParams(userId, idempotencyKey).addValue("createdAt", toTimestamp(claimedAt));
    return jdbcTemplate.update(sql, params) > 0 ? ClaimOutcome.INSERTED : ClaimOutcome.ALREADY_PRESENT;
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public void saveResponse(UUID userId, IdempotencyKey idempotencyKey, CapturedResponse response) {
    final String sql =
        """
        UPDATE idempotency
        SET
          response_status_code = :statusCode,
          response_body        = :body
        WHERE user_id = :userId
          AND idempotency_key = :idempotencyKey
          AND response_status_code IS NULL
        """;
    final MapSqlParameterSource params =
        keyParams(userId, idempotencyKey)
            .addValue("statusCode", response.statusCode(), Types.SMALLINT)
            .addValue("body", response.body(), Types.BINARY);
    if (jdbcTemplate.update(sql, params) == 0) {
      // 同一トランザクションで確保済みのはずなので、0 件は不変条件違反。
      throw new IllegalStateException("no open idempotency claim to finalize");
    }
    insertHeaders(userId, idempotencyKey, response.headers());
  }

  public Optional<CapturedResponse> findCompletedResponse(UUID userId, IdempotencyKey idempotencyKey) {
    // 本体とヘッダを 1 文で読み、同一スナップショットから組み立てる。
    final String sql =
        """
        SELECT
          i.response_status_code,
          i.response_body,
          h.name  AS header_name,
          h.value AS header_value
        FROM idempotency i
        LEFT JOIN idempotency_response_headers h
          ON h.user_id = i.user_id
         AND h.idempotency_key = i.idempotency_key
        WHERE i.user_id = :userId
          AND i.idempotency_key = :idempotencyKey
          AND i.response_status_code IS NOT NULL
        ORDER BY h.ordinal
        """;
    final ResultSetExtractor<CapturedResponse> extractor = this::extractResponse;
    return Optional.ofNullable(jdbcTemplate.query(sql, keyParams(userId, idempotencyKey), extractor));
  }

  public int deleteCompletedCreatedBefore(Instant threshold) {
    // 未確定の行は確保中のトランザクションに属するため対象外にする。
    final String sql =
        """
        DELETE FROM idempotency
        WHERE response_status_code IS NOT NULL
          AND created_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private void insertHeaders(UUID userId, IdempotencyKey idempotencyKey, List<HeaderPair> headers) {
    if (headers.isEmpty()) {
      return;
    }
    final String sql =
        """
        INSERT INTO idempotency_response_headers (
          user_id,
          idempotency_key,
          ordinal,
          name,
          value
        ) VALUES (
          :userId,
          :idempotencyKey,
          :ordinal,
          :name,
          :value
        )
        """;
    final SqlParameterSource[] batch = new SqlParameterSource[headers.size()];
    for (int ordinal = 0; ordinal < headers.size(); ordinal++) {
      final HeaderPair header = headers.get(ordinal);
      batch[ordinal] =
          keyParams(userId, idempotencyKey)
              .addValue("ordinal", ordinal)
              .addValue("name", header.name())
              .addValue("value", header.value(), Types.BINARY);
    }
    jdbcTemplate.batchUpdate(sql, batch);
  }

  private CapturedResponse extractResponse(ResultSet rs) throws SQLException {
    Integer statusCode = null;
    byte[] body = null;
    final List<HeaderPair> headers = new ArrayList<>();
    while (rs.next()) {
      if (statusCode == null) {
        statusCode = rs.getInt("response_status_code");
        body = rs.getBytes("response_body");
      }
      final String headerName = rs.getString("header_name");
      if (headerName != null) {
        headers.add(new HeaderPair(headerName, rs.getBytes("header_value")));
      }
    }
    if (statusCode == null) {
      return null;
    }
    return new CapturedResponse(statusCode, headers, body == null ? new byte[0] : body);
  }

  private MapSqlParameterSource keyParams(UUID userId, IdempotencyKey idempotencyKey) {
    return new MapSqlParameterSource()
        .addValue("userId", userId)
        .addValue("idempotencyKey", idempotencyKey.value());
  }
}
