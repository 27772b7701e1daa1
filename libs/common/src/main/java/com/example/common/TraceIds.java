/*
 * どこで: 共通ユーティリティ
 * 何を: リクエスト追跡用 ID の採番と引き継ぎを行う
 * なぜ: 上流から渡された ID を優先し、無ければ新規採番するため
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String incoming) {
    if (incoming == null || incoming.isBlank()) {
      return newTraceId();
    }
    return incoming.trim();
  }
}
