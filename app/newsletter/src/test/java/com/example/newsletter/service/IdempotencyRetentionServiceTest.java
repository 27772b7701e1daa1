/*
 * どこで: IdempotencyRetentionService のユニットテスト
 * 何を: completed-ttl から削除閾値を計算してリポジトリへ渡すことを検証する
 * なぜ: 保持期間の計算ずれで再生用レスポンスを早く消さないため
 */
package com.example.newsletter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.newsletter.config.NewsletterRetentionProperties;
import com.example.newsletter.repository.IdempotencyRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IdempotencyRetentionServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private IdempotencyRepository idempotencyRepository;

  @Test
  void deletesCompletedRecordsOlderThanTtl() {
    final NewsletterRetentionProperties properties =
        new NewsletterRetentionProperties(true, Duration.ofHours(1), Duration.ofHours(48));
    final IdempotencyRetentionService service =
        new IdempotencyRetentionService(
            idempotencyRepository, properties, Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    when(idempotencyRepository.deleteCompletedCreatedBefore(Instant.parse("2026-02-27T12:00:00Z")))
        .thenReturn(3);

    final int deleted = service.cleanup();

    assertThat(deleted).isEqualTo(3);
    verify(idempotencyRepository).deleteCompletedCreatedBefore(Instant.parse("2026-02-27T12:00:00Z"));
  }
}
