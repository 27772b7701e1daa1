/*
 * どこで: Newsletter API
 * 何を: 同一キーが確保済みなのに確定済みレスポンスが無い状態(処理中の競合)を表す
 * なぜ: 待ち続けずに 500 として即座に返すため
 */
package com.example.newsletter.api;

public class IdempotencyClaimInProgressException extends RuntimeException {

  public IdempotencyClaimInProgressException(String message) {
    super(message);
  }

  public IdempotencyClaimInProgressException(String message, Throwable cause) {
    super(message, cause);
  }
}
