/*
 * どこで: Newsletter API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.newsletter.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  NOT_FOUND,
  INVALID_SUBSCRIPTION_TOKEN,
  IDEMPOTENCY_CLAIM_IN_PROGRESS,
  RESPONSE_CAPTURE_FAILED,
  STORAGE_FAILURE
}
