/*
 * どこで: Newsletter retention ワーカー
 * 何を: retention cleanup をスケジュールで起動する
 * なぜ: 手動介入なしで期限切れ削除を回すため
 */
package com.example.newsletter.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "newsletter.retention.enabled", havingValue = "true")
public class IdempotencyRetentionWorker {

  private final IdempotencyRetentionService retentionService;

  @Scheduled(fixedDelayString = "${newsletter.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}
