/*
 * どこで: Newsletter API
 * 何を: 発行済み issue の参照結果を表す
 * なぜ: 発行者と配信タスク数をクライアントへ返すため
 */
package com.example.newsletter.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewsletterIssueResponse(
    UUID issueId,
    String title,
    UUID publishedBy,
    Instant publishedAt,
    int deliveriesEnqueued) {}
