/*
 * どこで: Newsletter ドメインモデル
 * 何を: 冪等キーの確保(INSERT ... ON CONFLICT DO NOTHING)の結果を表す
 * なぜ: 行数ではなく意味のある値で分岐させるため
 */
package com.example.newsletter.model;

public enum ClaimOutcome {
  INSERTED,
  ALREADY_PRESENT
}
