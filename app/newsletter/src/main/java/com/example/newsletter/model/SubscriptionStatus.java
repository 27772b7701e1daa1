/*
 * どこで: Newsletter ドメインモデル
 * 何を: 購読の状態と DB 上の表現を定義する
 * なぜ: 確認済みの購読者だけを配信対象にするため
 */
package com.example.newsletter.model;

public enum SubscriptionStatus {
  PENDING_CONFIRMATION("pending_confirmation"),
  CONFIRMED("confirmed");

  private final String dbValue;

  SubscriptionStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public static SubscriptionStatus fromDbValue(String dbValue) {
    for (SubscriptionStatus status : values()) {
      if (status.dbValue.equals(dbValue)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown subscription status: " + dbValue);
  }
}
