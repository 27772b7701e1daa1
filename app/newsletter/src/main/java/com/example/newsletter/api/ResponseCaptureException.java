/*
 * どこで: Newsletter API
 * 何を: レスポンスを保存可能な形へ変換できなかったことを表す
 * なぜ: 上限超過や本文の読み出し失敗を確保ごとロールバックさせるため
 */
package com.example.newsletter.api;

public class ResponseCaptureException extends RuntimeException {

  public ResponseCaptureException(String message) {
    super(message);
  }

  public ResponseCaptureException(String message, Throwable cause) {
    super(message, cause);
  }
}
