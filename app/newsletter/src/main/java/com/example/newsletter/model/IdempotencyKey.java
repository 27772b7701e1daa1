/*
 * どこで: Newsletter ドメインモデル
 * 何を: 検証済みの Idempotency-Key を表す値型
 * なぜ: 生成時の一度だけ検証し、以降の層で再検証しなくて済むようにするため
 */
package com.example.newsletter.model;

import java.util.Objects;

public final class IdempotencyKey {

  // 同種の識別子バリデータと同じ上限に揃える。
  public static final int MAX_LENGTH = 50;

  private final String value;

  private IdempotencyKey(String value) {
    this.value = value;
  }

  /**
   * 生の文字列を Idempotency-Key として検証する。
   *
   * <p>空/空白のみ、{@value #MAX_LENGTH} 文字超過、ASCII 英数字とハイフン以外を含む入力は拒否する。
   *
   * @throws InvalidIdempotencyKeyException 入力が規則を満たさない場合
   */
  public static IdempotencyKey parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidIdempotencyKeyException("The idempotency key cannot be empty");
    }
    if (raw.length() > MAX_LENGTH) {
      throw new InvalidIdempotencyKeyException(
          "The idempotency key must be shorter than " + (MAX_LENGTH + 1) + " characters");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (!isAllowed(raw.charAt(i))) {
        throw new InvalidIdempotencyKeyException(
            "The idempotency key may only contain ASCII letters, digits and '-'");
      }
    }
    return new IdempotencyKey(raw);
  }

  private static boolean isAllowed(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '-';
  }

  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof IdempotencyKey that && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
