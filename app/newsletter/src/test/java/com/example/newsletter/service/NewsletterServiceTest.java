/*
 * どこで: NewsletterService の統合テスト
 * 何を: 発行の副作用が一度だけ行われ、再送には同じ応答が返ることを検証する
 * なぜ: 管理者の再送や二重送信で購読者へ重複配信しないことを保証するため
 */
package com.example.newsletter.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.newsletter.AbstractPostgresContainerTest;
import com.example.newsletter.api.IssueNotFoundException;
import com.example.newsletter.api.NewsletterIssueResponse;
import com.example.newsletter.api.NewsletterPublishRequest;
import com.example.newsletter.api.ResponseCaptureException;
import com.example.newsletter.model.IdempotencyKey;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class NewsletterServiceTest extends AbstractPostgresContainerTest {

  private static final UUID USER_ID = UUID.fromString("00000000-0000-0000-0000-000000000001");
  private static final NewsletterPublishRequest REQUEST =
      new NewsletterPublishRequest("Issue #1", "plain body", "<p>html body</p>");

  @Autowired private NewsletterService newsletterService;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @Autowired private ObjectMapper objectMapper;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM idempotency", params);
    jdbcTemplate.update("DELETE FROM issue_delivery_queue", params);
    jdbcTemplate.update("DELETE FROM newsletter_issues", params);
    jdbcTemplate.update("DELETE FROM subscription_tokens", params);
    jdbcTemplate.update("DELETE FROM subscriptions", params);
    insertSubscriber("alice@example.com", "confirmed");
    insertSubscriber("bob@example.com", "confirmed");
    insertSubscriber("carol@example.com", "pending_confirmation");
  }

  @Test
  void publishEnqueuesDeliveriesForConfirmedSubscribers() throws Exception {
    final ResponseEntity<byte[]> response =
        newsletterService.publish(USER_ID, IdempotencyKey.parse("publish-1"), REQUEST);

    assertThat(response.getStatusCode().value()).isEqualTo(202);
    assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
    final JsonNode body = objectMapper.readTree(response.getBody());
    final String issueId = body.get("issue_id").asText();
    assertThat(body.get("title").asText()).isEqualTo("Issue #1");
    assertThat(body.get("deliveries_enqueued").asInt()).isEqualTo(2);
    assertThat(response.getHeaders().getFirst(HttpHeaders.LOCATION))
        .isEqualTo("/v1/admin/newsletters/" + issueId);
    assertThat(count("SELECT count(*) FROM issue_delivery_queue")).isEqualTo(2);
  }

  @Test
  void publishSkipsConfirmedSubscriberWithInvalidStoredEmail() throws Exception {
    insertSubscriber("definitely-not-an-email", "broken", "confirmed");

    final ResponseEntity<byte[]> response =
        newsletterService.publish(USER_ID, IdempotencyKey.parse("publish-skip"), REQUEST);

    assertThat(objectMapper.readTree(response.getBody()).get("deliveries_enqueued").asInt())
        .isEqualTo(2);
    assertThat(
            jdbcTemplate.queryForList(
                "SELECT subscriber_email FROM issue_delivery_queue ORDER BY subscriber_email",
                new MapSqlParameterSource(),
                String.class))
        .containsExactly("alice@example.com", "bob@example.com");
  }

  @Test
  void retriedPublishReturnsSameResponseWithoutRepeatingSideEffects() {
    final IdempotencyKey key = IdempotencyKey.parse("publish-retry");

    final ResponseEntity<byte[]> first = newsletterService.publish(USER_ID, key, REQUEST);
    final ResponseEntity<byte[]> second = newsletterService.publish(USER_ID, key, REQUEST);

    assertThat(second.getStatusCode()).isEqualTo(first.getStatusCode());
    assertThat(second.getHeaders()).isEqualTo(first.getHeaders());
    assertThat(second.getBody()).isEqualTo(first.getBody());
    assertThat(count("SELECT count(*) FROM newsletter_issues")).isEqualTo(1);
    assertThat(count("SELECT count(*) FROM issue_delivery_queue")).isEqualTo(2);
  }

  @Test
  void differentKeysPublishSeparateIssues() {
    newsletterService.publish(USER_ID, IdempotencyKey.parse("publish-a"), REQUEST);
    newsletterService.publish(USER_ID, IdempotencyKey.parse("publish-b"), REQUEST);

    assertThat(count("SELECT count(*) FROM newsletter_issues")).isEqualTo(2);
    assertThat(count("SELECT count(*) FROM issue_delivery_queue")).isEqualTo(4);
  }

  @Test
  void failedResponseCaptureRollsBackIssueAndReleasesKey() {
    final IdempotencyKey key = IdempotencyKey.parse("publish-too-large");
    // テストプロファイルの保存上限(64KB)を超える本文にする
    final NewsletterPublishRequest oversized =
        new NewsletterPublishRequest("x".repeat(70_000), "plain body", "<p>html body</p>");

    assertThatThrownBy(() -> newsletterService.publish(USER_ID, key, oversized))
        .isInstanceOf(ResponseCaptureException.class);

    assertThat(count("SELECT count(*) FROM newsletter_issues")).isZero();
    assertThat(count("SELECT count(*) FROM issue_delivery_queue")).isZero();
    assertThat(count("SELECT count(*) FROM idempotency")).isZero();

    final ResponseEntity<byte[]> retried = newsletterService.publish(USER_ID, key, REQUEST);
    assertThat(retried.getStatusCode().value()).isEqualTo(202);
    assertThat(count("SELECT count(*) FROM newsletter_issues")).isEqualTo(1);
  }

  @Test
  void getIssueReturnsPublishedIssue() throws Exception {
    final ResponseEntity<byte[]> published =
        newsletterService.publish(USER_ID, IdempotencyKey.parse("publish-get"), REQUEST);
    final UUID issueId =
        UUID.fromString(objectMapper.readTree(published.getBody()).get("issue_id").asText());

    final NewsletterIssueResponse issue = newsletterService.getIssue(issueId);

    assertThat(issue.issueId()).isEqualTo(issueId);
    assertThat(issue.title()).isEqualTo("Issue #1");
    assertThat(issue.publishedBy()).isEqualTo(USER_ID);
    assertThat(issue.publishedAt()).isNotNull();
    assertThat(issue.deliveriesEnqueued()).isEqualTo(2);
  }

  @Test
  void getIssueThrowsWhenMissing() {
    assertThatThrownBy(() -> newsletterService.getIssue(UUID.randomUUID()))
        .isInstanceOf(IssueNotFoundException.class);
  }

  private void insertSubscriber(String email, String status) {
    insertSubscriber(email, email.substring(0, email.indexOf('@')), status);
  }

  private void insertSubscriber(String email, String name, String status) {
    jdbcTemplate.update(
        """
        INSERT INTO subscriptions (id, email, name, subscribed_at, status)
        VALUES (:id, :email, :name, :subscribedAt, :status)
        """,
        new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID())
            .addValue("email", email)
            .addValue("name", name)
            .addValue("subscribedAt", Timestamp.from(Instant.now()))
            .addValue("status", status));
  }

  private int count(String sql) {
    final Integer count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Integer.class);
    return count == null ? 0 : count;
  }
}
