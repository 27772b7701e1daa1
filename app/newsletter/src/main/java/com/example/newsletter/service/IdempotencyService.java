/*
 * どこで: Newsletter サービス層
 * 何を: 冪等キーの確保 → 処理 or 保存済み応答の再生 → 応答の確定、の状態遷移を担う
 * なぜ: 再送や同時送信があっても副作用を一度だけ実行し、全員に同じ応答を返すため
 */
package com.example.newsletter.service;

import com.example.newsletter.api.IdempotencyClaimInProgressException;
import com.example.newsletter.config.NewsletterIdempotencyProperties;
import com.example.newsletter.model.CapturedResponse;
import com.example.newsletter.model.ClaimOutcome;
import com.example.newsletter.model.IdempotencyKey;
import com.example.newsletter.repository.IdempotencyRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

@Service
public class IdempotencyService {

  private static final Logger logger = LoggerFactory.getLogger(IdempotencyService.class);

  private static final String CLAIM_TRANSACTION_NAME = "idempotency-claim";

  private final IdempotencyRepository idempotencyRepository;
  private final ResponseCapture responseCapture;
  private final PlatformTransactionManager transactionManager;
  private final IdempotencyMetrics metrics;
  private final NewsletterIdempotencyProperties properties;
  private final Clock clock;
  private final TransactionDefinition claimDefinition;

  public IdempotencyService(
      IdempotencyRepository idempotencyRepository,
      ResponseCapture responseCapture,
      PlatformTransactionManager transactionManager,
      IdempotencyMetrics metrics,
      NewsletterIdempotencyProperties properties,
      Clock clock) {
    this.idempotencyRepository = idempotencyRepository;
    this.responseCapture = responseCapture;
    this.transactionManager = transactionManager;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
    this.claimDefinition = buildClaimDefinition(properties);
  }

  /**
   * 冪等キーの確保を試みる。
   *
   * <p>確保できた場合は新しいトランザクションを開いたまま {@link NextAction.StartProcessing} を返す。
   * 既に確定済みの応答があれば {@link NextAction.ReturnCachedResponse} を返す。
   * 確保済みだが確定していない(同じキーの処理が進行中)場合は待たずに
   * {@link IdempotencyClaimInProgressException} を投げる。
   */
  public NextAction tryProcess(UUID principalId, IdempotencyKey idempotencyKey) {
    final TransactionStatus transaction = transactionManager.getTransaction(claimDefinition);
    final ClaimOutcome outcome;
    try {
      outcome =
          idempotencyRepository.insertClaimIfAbsent(
              principalId, idempotencyKey, Instant.now(clock), properties.claimWaitTimeout());
    } catch (PessimisticLockingFailureException ex) {
      // 先行トランザクションの INSERT が claim-wait-timeout 内に終わらなかった。
      transactionManager.rollback(transaction);
      throw inProgress(principalId, idempotencyKey, ex);
    } catch (RuntimeException ex) {
      transactionManager.rollback(transaction);
      throw ex;
    }

    if (outcome == ClaimOutcome.INSERTED) {
      metrics.recordClaim(IdempotencyMetrics.OUTCOME_STARTED);
      logger.debug("idempotency claim acquired userId={} idempotencyKey={}", principalId, idempotencyKey);
      return new NextAction.StartProcessing(
          new IdempotentClaim(
              principalId,
              idempotencyKey,
              transactionManager,
              transaction,
              () -> metrics.recordClaim(IdempotencyMetrics.OUTCOME_ROLLED_BACK)));
    }

    // 書き込みは発生していないので、トランザクションは保持せずに捨ててから読む。
    transactionManager.rollback(transaction);
    final Optional<CapturedResponse> saved =
        idempotencyRepository.findCompletedResponse(principalId, idempotencyKey);
    if (saved.isEmpty()) {
      throw inProgress(principalId, idempotencyKey, null);
    }
    metrics.recordClaim(IdempotencyMetrics.OUTCOME_REPLAYED);
    logger.info(
        "idempotent replay userId={} idempotencyKey={} status={}",
        principalId,
        idempotencyKey,
        saved.get().statusCode());
    return new NextAction.ReturnCachedResponse(responseCapture.reconstruct(saved.get()));
  }

  /**
   * 処理結果の応答を確保中の行へ保存し、返却用に組み立て直した応答を返す。
   *
   * <p>保存は確保と同じトランザクションで行う。呼び出し側はこの後 {@link IdempotentClaim#commit()} する。
   */
  public ResponseEntity<byte[]> finalizeResponse(IdempotentClaim claim, ResponseEntity<?> response) {
    if (!claim.isOpen()) {
      throw new IllegalStateException("idempotency claim is no longer open");
    }
    final CapturedResponse captured = responseCapture.capture(response);
    idempotencyRepository.saveResponse(claim.principalId(), claim.idempotencyKey(), captured);
    claim.markFinalized();
    metrics.recordResponseSize(captured.bodyLength());
    return responseCapture.reconstruct(captured);
  }

  private IdempotencyClaimInProgressException inProgress(
      UUID principalId, IdempotencyKey idempotencyKey, Exception cause) {
    metrics.recordClaim(IdempotencyMetrics.OUTCOME_IN_PROGRESS);
    logger.warn(
        "idempotency key is claimed but no saved response exists userId={} idempotencyKey={}",
        principalId,
        idempotencyKey);
    final String message = "A request with this idempotency key is still being processed";
    return cause == null
        ? new IdempotencyClaimInProgressException(message)
        : new IdempotencyClaimInProgressException(message, cause);
  }

  private static TransactionDefinition buildClaimDefinition(NewsletterIdempotencyProperties properties) {
    final DefaultTransactionDefinition definition =
        new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    definition.setName(CLAIM_TRANSACTION_NAME);
    // 勝者が確保したまま戻らない場合に接続を握り続けないよう、トランザクション全体に期限を設ける。
    definition.setTimeout((int) Math.max(1, properties.claimHoldTimeout().toSeconds()));
    return definition;
  }
}
