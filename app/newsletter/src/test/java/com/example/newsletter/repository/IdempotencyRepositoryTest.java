/*
 * どこで: IdempotencyRepository の統合テスト
 * 何を: 確保の INSERT、レスポンス保存/取得、保持期限切れ削除を検証する
 * なぜ: 冪等レコードの保存形式(ヘッダ順序・バイト列)が DB 方言で壊れないことを保証するため
 */
package com.example.newsletter.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.newsletter.AbstractPostgresContainerTest;
import com.example.newsletter.model.CapturedResponse;
import com.example.newsletter.model.ClaimOutcome;
import com.example.newsletter.model.HeaderPair;
import com.example.newsletter.model.IdempotencyKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class IdempotencyRepositoryTest extends AbstractPostgresContainerTest {

  private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
  private static final UUID OTHER_USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000002");
  private static final IdempotencyKey KEY = IdempotencyKey.parse("abc-123");
  private static final Duration LOCK_WAIT = Duration.ofMillis(500);

  @Autowired private IdempotencyRepository idempotencyRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @Autowired private PlatformTransactionManager transactionManager;

  private TransactionTemplate transactionTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM idempotency", new MapSqlParameterSource());
    transactionTemplate = new TransactionTemplate(transactionManager);
  }

  @Test
  void insertClaimRequiresTransaction() {
    assertThatThrownBy(
            () -> idempotencyRepository.insertClaimIfAbsent(USER_ID, KEY, Instant.now(), LOCK_WAIT))
        .isInstanceOf(IllegalTransactionStateException.class);
  }

  @Test
  void insertClaimReportsAlreadyPresentForSamePrincipalAndKey() {
    final ClaimOutcome first = claimAndComplete(USER_ID, KEY, Instant.now(), response(200));

    final ClaimOutcome second =
        transactionTemplate.execute(
            status -> idempotencyRepository.insertClaimIfAbsent(USER_ID, KEY, Instant.now(), LOCK_WAIT));
    final ClaimOutcome otherPrincipal =
        transactionTemplate.execute(
            status -> {
              final ClaimOutcome outcome =
                  idempotencyRepository.insertClaimIfAbsent(OTHER_USER_ID, KEY, Instant.now(), LOCK_WAIT);
              status.setRollbackOnly();
              return outcome;
            });

    assertThat(first).isEqualTo(ClaimOutcome.INSERTED);
    assertThat(second).isEqualTo(ClaimOutcome.ALREADY_PRESENT);
    // キーは principal ごとに独立している
    assertThat(otherPrincipal).isEqualTo(ClaimOutcome.INSERTED);
  }

  @Test
  void savedResponseKeepsHeaderOrderAndBodyBytes() {
    final byte[] body = {0x00, (byte) 0xff, 'o', 'k'};
    final CapturedResponse response =
        new CapturedResponse(
            201,
            List.of(
                HeaderPair.of("Set-Cookie", "a=1"),
                HeaderPair.of("X-Test", "v1"),
                HeaderPair.of("Set-Cookie", "b=2")),
            body);

    claimAndComplete(USER_ID, KEY, Instant.now(), response);

    final Optional<CapturedResponse> stored = idempotencyRepository.findCompletedResponse(USER_ID, KEY);

    assertThat(stored).contains(response);
    assertThat(stored.get().headers())
        .extracting(HeaderPair::valueAsString)
        .containsExactly("a=1", "v1", "b=2");
  }

  @Test
  void savedResponseWithoutHeadersOrBody() {
    final CapturedResponse response = new CapturedResponse(204, List.of(), new byte[0]);

    claimAndComplete(USER_ID, KEY, Instant.now(), response);

    assertThat(idempotencyRepository.findCompletedResponse(USER_ID, KEY)).contains(response);
  }

  @Test
  void claimedButUnfinalizedRecordIsNotReturned() {
    transactionTemplate.executeWithoutResult(
        status -> {
          idempotencyRepository.insertClaimIfAbsent(USER_ID, KEY, Instant.now(), LOCK_WAIT);
          assertThat(idempotencyRepository.findCompletedResponse(USER_ID, KEY)).isEmpty();
        });

    assertThat(idempotencyRepository.findCompletedResponse(USER_ID, KEY)).isEmpty();
  }

  @Test
  void rolledBackClaimLeavesNoRecord() {
    transactionTemplate.executeWithoutResult(
        status -> {
          idempotencyRepository.insertClaimIfAbsent(USER_ID, KEY, Instant.now(), LOCK_WAIT);
          status.setRollbackOnly();
        });

    final ClaimOutcome retry =
        transactionTemplate.execute(
            status -> idempotencyRepository.insertClaimIfAbsent(USER_ID, KEY, Instant.now(), LOCK_WAIT));

    assertThat(retry).isEqualTo(ClaimOutcome.INSERTED);
  }

  @Test
  void saveResponseFailsWhenResponseAlreadyStored() {
    claimAndComplete(USER_ID, KEY, Instant.now(), response(200));

    assertThatThrownBy(
            () ->
                transactionTemplate.executeWithoutResult(
                    status -> idempotencyRepository.saveResponse(USER_ID, KEY, response(500))))
        .isInstanceOf(IllegalStateException.class);

    assertThat(idempotencyRepository.findCompletedResponse(USER_ID, KEY))
        .map(CapturedResponse::statusCode)
        .contains(200);
  }

  @Test
  void deleteCompletedCreatedBeforeRemovesOnlyOldRecordsWithHeaders() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
    final IdempotencyKey oldKey = IdempotencyKey.parse("old-key");
    final IdempotencyKey freshKey = IdempotencyKey.parse("fresh-key");
    claimAndComplete(USER_ID, oldKey, now.minus(Duration.ofDays(3)), response(200));
    claimAndComplete(USER_ID, freshKey, now, response(200));

    final int deleted = idempotencyRepository.deleteCompletedCreatedBefore(now.minus(Duration.ofDays(2)));

    assertThat(deleted).isEqualTo(1);
    assertThat(idempotencyRepository.findCompletedResponse(USER_ID, oldKey)).isEmpty();
    assertThat(idempotencyRepository.findCompletedResponse(USER_ID, freshKey)).isPresent();
    final Integer orphanHeaders =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM idempotency_response_headers WHERE idempotency_key = :key",
            new MapSqlParameterSource().addValue("key", oldKey.value()),
            Integer.class);
    assertThat(orphanHeaders).isZero();
  }

  private ClaimOutcome claimAndComplete(
      UUID userId, IdempotencyKey key, Instant claimedAt, CapturedResponse response) {
    return transactionTemplate.execute(
        status -> {
          final ClaimOutcome outcome =
              idempotencyRepository.insertClaimIfAbsent(userId, key, claimedAt, LOCK_WAIT);
          idempotencyRepository.saveResponse(userId, key, response);
          return outcome;
        });
  }

  private static CapturedResponse response(int statusCode) {
    return new CapturedResponse(
        statusCode,
        List.of(HeaderPair.of("Content-Type", "application/json")),
        "{\"ok\":true}".getBytes(StandardCharsets.UTF_8));
  }
}
