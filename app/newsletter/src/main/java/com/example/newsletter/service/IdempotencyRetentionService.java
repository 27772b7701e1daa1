/*
 * どこで: Newsletter retention サービス
 * 何を: 確定済みで保持期限を過ぎた idempotency レコードを削除する
 * なぜ: 再生用レスポンスの蓄積でテーブルが肥大化しないようにするため
 */
package com.example.newsletter.service;

import com.example.newsletter.config.NewsletterRetentionProperties;
import com.example.newsletter.repository.IdempotencyRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class IdempotencyRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(IdempotencyRetentionService.class);

  private final IdempotencyRepository idempotencyRepository;
  private final NewsletterRetentionProperties retentionProperties;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold = Instant.now(clock).minus(retentionProperties.completedTtl());
    final int deleted = idempotencyRepository.deleteCompletedCreatedBefore(threshold);
    logger.info(
        "idempotency retention cleanup deleted records={} threshold={}", deleted, threshold);
    return deleted;
  }
}
