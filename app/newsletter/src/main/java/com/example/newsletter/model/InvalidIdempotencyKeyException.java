/*
 * どこで: Newsletter ドメインモデル
 * 何を: Idempotency-Key の検証失敗を表す例外
 * なぜ: クライアント起因の 400 として他の入力エラーと同じ経路で返すため
 */
package com.example.newsletter.model;

public class InvalidIdempotencyKeyException extends IllegalArgumentException {

  public InvalidIdempotencyKeyException(String message) {
    super(message);
  }
}
