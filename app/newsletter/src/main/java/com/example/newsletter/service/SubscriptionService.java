/*
 * どこで: Newsletter サービス層
 * 何を: 購読登録(pending 保存 + 確認トークン発行)と確認トークンによる購読確定を担う
 * なぜ: 確認済みの購読者だけを配信対象にするため
 */
package com.example.newsletter.service;

import com.example.newsletter.api.SubscriptionTokenNotFoundException;
import com.example.newsletter.model.SubscriberName;
import com.example.newsletter.model.SubscriberRecord;
import com.example.newsletter.model.SubscriptionStatus;
import com.example.newsletter.model.SubscriptionToken;
import com.example.newsletter.repository.SubscriptionRepository;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class SubscriptionService {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionService.class);

  private final SubscriptionRepository subscriptionRepository;
  private final Clock clock;
  private final SecureRandom random = new SecureRandom();

  /**
   * 購読者を pending_confirmation で登録し、確認トークンを発行する。
   *
   * <p>確認メールの送信は外部の mailer が subscription_tokens を読んで行う。同じ email で再登録された場合、
   * pending なら新しいトークンを追加し、confirmed なら何もしない。
   */
  @Transactional
  public SubscriptionResult subscribe(String email, String rawName) {
    final SubscriberName name = SubscriberName.parse(rawName);
    final String normalizedEmail = email.trim();
    final Instant now = Instant.now(clock);
    final SubscriberRecord candidate =
        new SubscriberRecord(
            UUID.randomUUID(),
            normalizedEmail,
            name.value(),
            now,
            SubscriptionStatus.PENDING_CONFIRMATION);
    final SubscriberRecord subscriber =
        subscriptionRepository.insertIfAbsent(candidate)
            ? candidate
            : subscriptionRepository
                .findByEmail(normalizedEmail)
                .orElseThrow(
                    () -> new IllegalStateException("subscriber vanished after conflict"));

    if (subscriber.status() == SubscriptionStatus.CONFIRMED) {
      logger.info("subscription already confirmed subscriberId={}", subscriber.id());
      return new SubscriptionResult(subscriber.id(), subscriber.status());
    }
    subscriptionRepository.insertToken(SubscriptionToken.generate(random), subscriber.id(), now);
    logger.info("subscription pending confirmation subscriberId={}", subscriber.id());
    return new SubscriptionResult(subscriber.id(), subscriber.status());
  }

  @Transactional
  public SubscriptionResult confirm(SubscriptionToken token) {
    final UUID subscriberId =
        subscriptionRepository
            .findSubscriberIdByToken(token)
            .orElseThrow(
                () -> new SubscriptionTokenNotFoundException("subscription_token is not recognized"));
    subscriptionRepository.updateStatus(subscriberId, SubscriptionStatus.CONFIRMED);
    logger.info("subscription confirmed subscriberId={}", subscriberId);
    return new SubscriptionResult(subscriberId, SubscriptionStatus.CONFIRMED);
  }

  public record SubscriptionResult(UUID subscriberId, SubscriptionStatus status) {}
}
