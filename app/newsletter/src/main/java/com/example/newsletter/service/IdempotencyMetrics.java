/*
 * どこで: Newsletter サービス層
 * 何を: 冪等キー確保の結果と保存レスポンスサイズのメトリクス記録を集約する
 * なぜ: 再送の割合と処理中競合の発生を運用で継続監視できるようにするため
 */
package com.example.newsletter.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class IdempotencyMetrics {

  static final String OUTCOME_STARTED = "started";
  static final String OUTCOME_REPLAYED = "replayed";
  static final String OUTCOME_IN_PROGRESS = "in_progress";
  static final String OUTCOME_ROLLED_BACK = "rolled_back";

  private static final String METRIC_CLAIM_TOTAL = "newsletter.idempotency.claim.total";
  private static final String METRIC_RESPONSE_BYTES = "newsletter.idempotency.response.bytes";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> claimCounters = new ConcurrentHashMap<>();
  private final DistributionSummary responseBytes;

  public IdempotencyMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.responseBytes =
        DistributionSummary.builder(METRIC_RESPONSE_BYTES)
            .description("Size of response bodies stored for idempotent replay")
            .baseUnit("bytes")
            .register(meterRegistry);
  }

  public void recordClaim(String outcome) {
    claimCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_CLAIM_TOTAL)
                    .description("Idempotency claim attempts by outcome")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordResponseSize(int bodyBytes) {
    responseBytes.record(Math.max(bodyBytes, 0));
  }
}
