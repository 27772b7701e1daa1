/*
 * どこで: Newsletter ドメインモデル
 * 何を: 購読者名を検証済みの値として表す
 * なぜ: 空白のみ・長すぎる名前や、HTML/パス断片になりうる文字を保存前に拒否するため
 */
package com.example.newsletter.model;

import java.text.BreakIterator;
import java.util.Objects;

public final class SubscriberName {

  /** 利用者から見た文字(書記素クラスタ)単位の上限。 */
  public static final int MAX_GRAPHEMES = 256;

  private static final String FORBIDDEN_CHARACTERS = "/()\"<>\\{}";

  private final String value;

  private SubscriberName(String value) {
    this.value = value;
  }

  /**
   * 生の文字列を購読者名として検証する。
   *
   * @throws InvalidSubscriberNameException 空/空白のみ、{@value #MAX_GRAPHEMES} 文字超過、禁止文字を含む場合
   */
  public static SubscriberName parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidSubscriberNameException("name must not be blank");
    }
    if (countGraphemes(raw) > MAX_GRAPHEMES) {
      throw new InvalidSubscriberNameException(
          "name must be at most " + MAX_GRAPHEMES + " characters");
    }
    for (int i = 0; i < raw.length(); i++) {
      if (FORBIDDEN_CHARACTERS.indexOf(raw.charAt(i)) >= 0) {
        throw new InvalidSubscriberNameException("name contains a forbidden character");
      }
    }
    return new SubscriberName(raw);
  }

  private static int countGraphemes(String raw) {
    final BreakIterator iterator = BreakIterator.getCharacterInstance();
    iterator.setText(raw);
    int count = 0;
    while (iterator.next() != BreakIterator.DONE) {
      count++;
    }
    return count;
  }

  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof SubscriberName that && value.equals(that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
