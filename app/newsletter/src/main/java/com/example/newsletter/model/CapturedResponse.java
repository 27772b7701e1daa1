/*
 * どこで: Newsletter ドメインモデル
 * 何を: 保存/再生できる形に確定した HTTP レスポンス(status, 順序付きヘッダ, body)を表す
 * なぜ: 冪等テーブルとの入出力をフレームワーク型から切り離すため
 */
package com.example.newsletter.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

public record CapturedResponse(int statusCode, List<HeaderPair> headers, byte[] body) {

  public CapturedResponse {
    if (statusCode < 100 || statusCode > 999) {
      throw new IllegalArgumentException("invalid HTTP status code: " + statusCode);
    }
    headers = List.copyOf(Objects.requireNonNull(headers, "headers"));
    body = Objects.requireNonNull(body, "body").clone();
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  public int bodyLength() {
    return body.length;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof CapturedResponse that
        && statusCode == that.statusCode
        && headers.equals(that.headers)
        && Arrays.equals(body, that.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(statusCode, headers) * 31 + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "CapturedResponse[statusCode=" + statusCode + ", headers=" + headers
        + ", bodyLength=" + body.length + "]";
  }
}
