/*
 * どこで: Newsletter API
 * 何を: ニュースレター発行リクエストの本文を表す
 * なぜ: 入力検証を Bean Validation に寄せるため
 */
package com.example.newsletter.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewsletterPublishRequest(
    @NotBlank(message = "title is required") String title,
    @NotBlank(message = "text_content is required") String textContent,
    @NotBlank(message = "html_content is required") String htmlContent) {}
