/*
 * どこで: Newsletter ドメインモデル
 * 何を: 購読者名が受け付けられない形式であることを表す
 * なぜ: 入力不備として 400 へ変換するため
 */
package com.example.newsletter.model;

public class InvalidSubscriberNameException extends IllegalArgumentException {

  public InvalidSubscriberNameException(String message) {
    super(message);
  }
}
