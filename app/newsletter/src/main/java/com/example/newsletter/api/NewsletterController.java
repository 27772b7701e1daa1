/*
 * どこで: Newsletter API
 * 何を: ニュースレター発行と発行済み issue 参照のエンドポイントを提供する
 * なぜ: 再送されても一度だけ発行される管理用インターフェースを公開するため
 */
package com.example.newsletter.api;

import com.example.newsletter.model.IdempotencyKey;
import com.example.newsletter.service.NewsletterService;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
@Validated
public class NewsletterController {

  private static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";
  private static final String HEADER_USER_ID = "X-User-Id";

  private final NewsletterService newsletterService;

  @PostMapping("/admin/newsletters")
  public ResponseEntity<byte[]> publish(
      @RequestHeader(value = HEADER_USER_ID) String userId,
      @RequestHeader(value = HEADER_IDEMPOTENCY_KEY) String idempotencyKey,
      @Valid @RequestBody NewsletterPublishRequest request) {
    // キー検証を先に行い、不正なキーでは DB に触れない。
    final IdempotencyKey key = IdempotencyKey.parse(idempotencyKey);
    return newsletterService.publish(parsePrincipal(userId), key, request);
  }

  @GetMapping("/admin/newsletters/{issue_id}")
  public NewsletterIssueResponse getIssue(@PathVariable("issue_id") UUID issueId) {
    return newsletterService.getIssue(issueId);
  }

  private UUID parsePrincipal(String userId) {
    try {
      return UUID.fromString(userId.trim());
    } catch (IllegalArgumentException ex) {
      throw new InvalidPrincipalException(HEADER_USER_ID + " must be a UUID");
    }
  }
}
