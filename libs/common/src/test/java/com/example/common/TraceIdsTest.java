/*
 * どこで: TraceIds の単体テスト
 * 何を: 上流 ID の引き継ぎと新規採番を検証する
 * なぜ: ログ相関キーが空文字で汚れないことを保証するため
 */
package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void resolveKeepsIncomingValue() {
    assertThat(TraceIds.resolve(" req-1 ")).isEqualTo("req-1");
  }

  @Test
  void resolveGeneratesUuidWhenBlank() {
    final String generated = TraceIds.resolve("  ");

    assertThat(UUID.fromString(generated)).isNotNull();
  }
}
