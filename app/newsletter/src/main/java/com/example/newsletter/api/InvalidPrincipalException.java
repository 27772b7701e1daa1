/*
 * どこで: Newsletter API
 * 何を: X-User-Id が欠落/不正な場合の例外を定義する
 * なぜ: 冪等キーの所有者を特定できない要求を 400 で拒否するため
 */
package com.example.newsletter.api;

public class InvalidPrincipalException extends IllegalArgumentException {

  public InvalidPrincipalException(String message) {
    super(message);
  }
}
