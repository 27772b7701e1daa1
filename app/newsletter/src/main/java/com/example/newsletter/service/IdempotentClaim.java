/*
 * どこで: Newsletter サービス層
 * 何を: 冪等キーを確保したトランザクションを、単一所有者のハンドルとして包む
 * なぜ: 副作用・レスポンス保存・確保を同じトランザクションで一度だけ commit/rollback させるため
 */
package com.example.newsletter.service;

import com.example.newsletter.model.IdempotencyKey;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

/**
 * 確保に勝った呼び出し側だけが受け取るハンドル。
 *
 * <p>トランザクションは確保したスレッドに束縛されるため、他スレッドからの操作は拒否する。
 * {@link IdempotencyService#finalizeResponse} で応答を保存した後に {@link #commit()} し、
 * 途中で失敗した場合は {@link #close()}(try-with-resources)で確保ごとロールバックする。
 * commit/rollback は合わせて一度だけ許される。
 */
public final class IdempotentClaim implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(IdempotentClaim.class);

  enum State {
    OPEN,
    FINALIZED,
    COMMITTED,
    ROLLED_BACK
  }

  private final UUID principalId;
  private final IdempotencyKey idempotencyKey;
  private final PlatformTransactionManager transactionManager;
  private final TransactionStatus transaction;
  private final Runnable onAbandoned;
  private final Thread owner;
  private State state = State.OPEN;

  IdempotentClaim(
      UUID principalId,
      IdempotencyKey idempotencyKey,
      PlatformTransactionManager transactionManager,
      TransactionStatus transaction,
      Runnable onAbandoned) {
    this.principalId = principalId;
    this.idempotencyKey = idempotencyKey;
    this.transactionManager = transactionManager;
    this.transaction = transaction;
    this.onAbandoned = onAbandoned;
    this.owner = Thread.currentThread();
  }

  public UUID principalId() {
    return principalId;
  }

  public IdempotencyKey idempotencyKey() {
    return idempotencyKey;
  }

  public boolean isOpen() {
    return state == State.OPEN || state == State.FINALIZED;
  }

  State state() {
    return state;
  }

  void markFinalized() {
    assertOwner();
    if (state != State.OPEN) {
      throw new IllegalStateException("idempotency claim cannot be finalized in state " + state);
    }
    state = State.FINALIZED;
  }

  public void commit() {
    assertOwner();
    if (state != State.FINALIZED) {
      // 応答を保存せずに commit すると「確保済み・未確定」の行が残り、以後の再送が全て失敗する。
      throw new IllegalStateException("idempotency claim cannot be committed in state " + state);
    }
    try {
      transactionManager.commit(transaction);
      state = State.COMMITTED;
    } catch (RuntimeException ex) {
      // commit 失敗時はトランザクションマネージャ側でロールバック済み。
      state = State.ROLLED_BACK;
      onAbandoned.run();
      throw ex;
    }
  }

  public void rollback() {
    assertOwner();
    if (!isOpen()) {
      throw new IllegalStateException("idempotency claim cannot be rolled back in state " + state);
    }
    state = State.ROLLED_BACK;
    onAbandoned.run();
    transactionManager.rollback(transaction);
  }

  @Override
  public void close() {
    if (!isOpen()) {
      return;
    }
    logger.warn(
        "idempotency claim released without commit; rolling back userId={} idempotencyKey={}",
        principalId,
        idempotencyKey);
    rollback();
  }

  private void assertOwner() {
    if (Thread.currentThread() != owner) {
      throw new IllegalStateException(
          "idempotency claim is bound to thread " + owner.getName()
              + " and cannot be used from " + Thread.currentThread().getName());
    }
  }
}
