/*
 * どこで: Idempotency メトリクステスト
 * 何を: claim 結果のカウンタとレスポンスサイズの分布が記録されることを検証する
 * なぜ: 再送率や処理中競合の計測回帰を防ぐため
 */
package com.example.newsletter.service;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

class IdempotencyMetricsTest {

  @Test
  void recordsClaimOutcomesAndResponseSizes() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final IdempotencyMetrics metrics = new IdempotencyMetrics(registry);

    metrics.recordClaim(IdempotencyMetrics.OUTCOME_STARTED);
    metrics.recordClaim(IdempotencyMetrics.OUTCOME_REPLAYED);
    metrics.recordClaim(IdempotencyMetrics.OUTCOME_REPLAYED);
    metrics.recordResponseSize(128);
    metrics.recordResponseSize(-1);

    final Counter started =
        registry.get("newsletter.idempotency.claim.total").tag("outcome", "started").counter();
    final Counter replayed =
        registry.get("newsletter.idempotency.claim.total").tag("outcome", "replayed").counter();
    final DistributionSummary bytes =
        registry.get("newsletter.idempotency.response.bytes").summary();

    assertThat(started.count()).isEqualTo(1.0d);
    assertThat(replayed.count()).isEqualTo(2.0d);
    assertThat(bytes.count()).isEqualTo(2L);
    assertThat(bytes.totalAmount()).isEqualTo(128.0d);
  }
}
