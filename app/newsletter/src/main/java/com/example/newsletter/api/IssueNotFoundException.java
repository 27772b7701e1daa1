/*
 * どこで: Newsletter API
 * 何を: 指定された newsletter issue が存在しないことを表す
 * なぜ: 参照 API で 404 を返すため
 */
package com.example.newsletter.api;

public class IssueNotFoundException extends RuntimeException {

  public IssueNotFoundException(String message) {
    super(message);
  }
}
