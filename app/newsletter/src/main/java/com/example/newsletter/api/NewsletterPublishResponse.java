/*
 * どこで: Newsletter API
 * 何を: ニュースレター発行の応答本文を表す
 * なぜ: 再送時にもバイト単位で同じ JSON を返せるよう、保存対象の形を固定するため
 */
package com.example.newsletter.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewsletterPublishResponse(UUID issueId, String title, int deliveriesEnqueued) {}
