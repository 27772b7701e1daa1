/*
 * どこで: Newsletter アプリの設定バインド
 * 何を: 冪等キー確保の待機/保持タイムアウトとレスポンス保存上限を保持する
 * なぜ: 進行中クレームへの待ち時間とメモリ上限を運用で調整し、起動時に妥当性を検証するため
 */
package com.example.newsletter.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "newsletter.idempotency")
@Validated
public record NewsletterIdempotencyProperties(
    @NotNull Duration claimWaitTimeout,
    @NotNull Duration claimHoldTimeout,
    @NotNull DataSize maxResponseBodySize) {

  @AssertTrue(message = "newsletter.idempotency.claim-wait-timeout must be positive")
  public boolean isClaimWaitTimeoutPositive() {
    // 0 は PostgreSQL の lock_timeout では「無期限に待つ」になるため拒否する。
    return claimWaitTimeout == null || claimWaitTimeout.toMillis() > 0;
  }

  @AssertTrue(
      message =
          "newsletter.idempotency.claim-wait-timeout must be shorter than"
              + " newsletter.idempotency.claim-hold-timeout")
  public boolean isClaimWaitTimeoutShorterThanHoldTimeout() {
    // 待機がトランザクション期限より長いと、処理中の競合がストレージ障害として表に出る。
    if (claimWaitTimeout == null || claimHoldTimeout == null) {
      return true;
    }
    // トランザクション期限は秒単位に切り捨てて適用されるので、その値と比べる。
    return claimWaitTimeout.compareTo(Duration.ofSeconds(claimHoldTimeout.toSeconds())) < 0;
  }

  @AssertTrue(message = "newsletter.idempotency.claim-hold-timeout must be at least 1s")
  public boolean isClaimHoldTimeoutPositive() {
    // トランザクションタイムアウトは秒単位なので 1 秒未満は表現できない。
    return claimHoldTimeout == null || claimHoldTimeout.toSeconds() >= 1;
  }

  @AssertTrue(message = "newsletter.idempotency.max-response-body-size must be positive")
  public boolean isMaxResponseBodySizePositive() {
    return maxResponseBodySize == null || maxResponseBodySize.toBytes() > 0;
  }
}
