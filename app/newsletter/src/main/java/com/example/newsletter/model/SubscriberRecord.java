/*
 * どこで: Newsletter ドメインモデル
 * 何を: subscriptions テーブルの 1 行を表す
 */
package com.example.newsletter.model;

import java.time.Instant;
import java.util.UUID;

public record SubscriberRecord(
    UUID id, String email, String name, Instant subscribedAt, SubscriptionStatus status) {}
