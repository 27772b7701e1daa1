/*
 * どこで: Newsletter サービス層
 * 何を: ニュースレター発行(issue 登録 + 配信タスク投入)と発行済み issue の参照を担う
 * なぜ: 発行の副作用を冪等キーの確保と同じトランザクションで一度だけ確定させるため
 */
package com.example.newsletter.service;

import com.example.newsletter.api.IssueNotFoundException;
import com.example.newsletter.api.NewsletterIssueResponse;
import com.example.newsletter.api.NewsletterPublishRequest;
import com.example.newsletter.api.NewsletterPublishResponse;
import com.example.newsletter.model.IdempotencyKey;
import com.example.newsletter.model.NewsletterIssueRecord;
import com.example.newsletter.repository.NewsletterIssueRepository;
import com.example.newsletter.repository.SubscriptionRepository;
import jakarta.validation.Validator;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NewsletterService {

  private static final Logger logger = LoggerFactory.getLogger(NewsletterService.class);

  static final String ISSUE_PATH_PREFIX = "/v1/admin/newsletters/";

  private final IdempotencyService idempotencyService;
  private final NewsletterIssueRepository issueRepository;
  private final SubscriptionRepository subscriptionRepository;
  private final Validator validator;
  private final Clock clock;

  public ResponseEntity<byte[]> publish(
      UUID principalId, IdempotencyKey idempotencyKey, NewsletterPublishRequest request) {
    final NextAction next = idempotencyService.tryProcess(principalId, idempotencyKey);
    if (next instanceof NextAction.ReturnCachedResponse cached) {
      return cached.response();
    }
    final NextAction.StartProcessing start = (NextAction.StartProcessing) next;
    try (IdempotentClaim claim = start.claim()) {
      final UUID issueId = UUID.randomUUID();
      issueRepository.insertIssue(
          new NewsletterIssueRecord(
              issueId,
              request.title(),
              request.textContent(),
              request.htmlContent(),
              principalId,
              Instant.now(clock)));
      final int enqueued = issueRepository.enqueueDeliveryTasks(issueId, deliverableEmails());

      final ResponseEntity<NewsletterPublishResponse> response =
          ResponseEntity.status(HttpStatus.ACCEPTED)
              .location(URI.create(ISSUE_PATH_PREFIX + issueId))
              .contentType(MediaType.APPLICATION_JSON)
              .body(new NewsletterPublishResponse(issueId, request.title(), enqueued));

      final ResponseEntity<byte[]> stored = idempotencyService.finalizeResponse(claim, response);
      claim.commit();
      logger.info(
          "newsletter issue published issueId={} userId={} deliveriesEnqueued={}",
          issueId,
          principalId,
          enqueued);
      return stored;
    }
  }

  /** 登録後に形式が不正になった email は配信対象から外し、警告だけ残す。 */
  private List<String> deliverableEmails() {
    return subscriptionRepository.findConfirmedEmails().stream()
        .filter(
            email -> {
              final boolean valid =
                  validator.validate(new DeliveryAddress(email)).isEmpty();
              if (!valid) {
                logger.warn("skipping confirmed subscriber with invalid stored email");
              }
              return valid;
            })
        .toList();
  }

  private record DeliveryAddress(@NotBlank @Email String email) {}

  public NewsletterIssueResponse getIssue(UUID issueId) {
    final NewsletterIssueRecord record =
        issueRepository
            .findById(issueId)
            .orElseThrow(() -> new IssueNotFoundException("newsletter issue not found: " + issueId));
    return new NewsletterIssueResponse(
        record.issueId(),
        record.title(),
        record.publishedBy(),
        record.publishedAt(),
        issueRepository.countDeliveryTasks(issueId));
  }
}
