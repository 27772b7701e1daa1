/*
 * どこで: Newsletter API
 * 何を: 購読登録リクエストの本文を表す
 * なぜ: email の形式検証を Bean Validation に寄せるため
 */
package com.example.newsletter.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record SubscribeRequest(
    @NotBlank(message = "email is required") @Email(message = "email is invalid") String email,
    @NotBlank(message = "name is required") String name) {}
