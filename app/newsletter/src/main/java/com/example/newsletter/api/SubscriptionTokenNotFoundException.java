/*
 * どこで: Newsletter API
 * 何を: 確認トークンがどの購読者にも紐づかないことを表す
 * なぜ: 確認 API で 401 を返すため
 */
package com.example.newsletter.api;

public class SubscriptionTokenNotFoundException extends RuntimeException {

  public SubscriptionTokenNotFoundException(String message) {
    super(message);
  }
}
