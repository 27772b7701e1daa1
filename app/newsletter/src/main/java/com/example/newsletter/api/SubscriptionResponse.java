/*
 * どこで: Newsletter API
 * 何を: 購読登録/確認の応答本文を表す
 */
package com.example.newsletter.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubscriptionResponse(UUID subscriberId, String status) {}
