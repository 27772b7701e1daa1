/*
 * どこで: Newsletter ドメインモデル
 * 何を: newsletter_issues テーブルの 1 行を表す
 * なぜ: 発行処理と参照 API で同じ形を使うため
 */
package com.example.newsletter.model;

import java.time.Instant;
import java.util.UUID;

public record NewsletterIssueRecord(
    UUID issueId,
    String title,
    String textContent,
    String htmlContent,
    UUID publishedBy,
    Instant publishedAt) {}
