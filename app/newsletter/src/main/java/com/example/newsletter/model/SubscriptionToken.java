/*
 * どこで: Newsletter ドメインモデル
 * 何を: 購読確認リンクに載せるトークンの採番と形式検証を行う
 * なぜ: 推測できない値を発行し、形式外の入力では DB を引かないため
 */
package com.example.newsletter.model;

import java.security.SecureRandom;
import java.util.Objects;

public final class SubscriptionToken {

  public static final int LENGTH = 25;

  private static final String ALPHABET =
      "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

  private final String value;

  private SubscriptionToken(String value) {
    this.value = value;
  }

  public static SubscriptionToken generate(SecureRandom random) {
    final StringBuilder builder = new StringBuilder(LENGTH);
    for (int i = 0; i < LENGTH; i++) {
      builder.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return new SubscriptionToken(builder.toString());
  }

  /** @throws IllegalArgumentException 英数字 {@value #LENGTH} 文字でない場合 */
  public static SubscriptionToken parse(String raw) {
    if (raw == null || raw.length() != LENGTH) {
      throw new IllegalArgumentException("subscription_token is invalid");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (ALPHABET.indexOf(raw.charAt(i)) < 0) {
        throw new IllegalArgumentException("subscription_token is invalid");
      }
    }
    return new SubscriptionToken(raw);
  }

  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof SubscriptionToken that && value.equals(that.value);
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
