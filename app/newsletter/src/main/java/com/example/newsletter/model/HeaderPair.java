/*
 * どこで: Newsletter ドメインモデル
 * 何を: 保存対象のレスポンスヘッダ 1 件(名前と生バイト値)を表す
 * なぜ: 同名ヘッダの重複と非 UTF-8 の値をそのまま再生するため
 */
package com.example.newsletter.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

public record HeaderPair(String name, byte[] value) {

  public HeaderPair {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(value, "value");
    value = value.clone();
  }

  // Servlet コンテナはヘッダ値を ISO-8859-1 のオクテットとして扱うため、同じ対応で変換する。
  public static HeaderPair of(String name, String value) {
    return new HeaderPair(name, value.getBytes(StandardCharsets.ISO_8859_1));
  }

  @Override
  public byte[] value() {
    return value.clone();
  }

  public String valueAsString() {
    return new String(value, StandardCharsets.ISO_8859_1);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof HeaderPair that
        && name.equals(that.name)
        && Arrays.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return "HeaderPair[name=" + name + ", value=" + valueAsString() + "]";
  }
}
