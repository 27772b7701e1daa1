/*
 * どこで: Newsletter API
 * 何を: 購読登録と購読確認のエンドポイントを提供する
 * なぜ: 配信対象となる confirmed な購読者をこのサービス内で作れるようにするため
 */
package com.example.newsletter.api;

import com.example.newsletter.model.SubscriptionToken;
import com.example.newsletter.service.SubscriptionService;
import com.example.newsletter.service.SubscriptionService.SubscriptionResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/subscriptions")
@RequiredArgsConstructor
public class SubscriptionController {

  private final SubscriptionService subscriptionService;

  @PostMapping
  public SubscriptionResponse subscribe(@Valid @RequestBody SubscribeRequest request) {
    return toResponse(subscriptionService.subscribe(request.email(), request.name()));
  }

  @GetMapping("/confirm")
  public SubscriptionResponse confirm(
      @RequestParam("subscription_token") String subscriptionToken) {
    // 形式外のトークンは DB を引かずに 400 にする。
    final SubscriptionToken token = SubscriptionToken.parse(subscriptionToken);
    return toResponse(subscriptionService.confirm(token));
  }

  private SubscriptionResponse toResponse(SubscriptionResult result) {
    return new SubscriptionResponse(result.subscriberId(), result.status().dbValue());
  }
}
