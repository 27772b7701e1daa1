/*
 * どこで: Newsletter サービス層
 * 何を: 冪等キー確保後に呼び出し側が取るべき次の動作を表す
 * なぜ: 「処理する」か「保存済み応答を返す」かを型で分岐させるため
 */
package com.example.newsletter.service;

import java.util.Objects;
import org.springframework.http.ResponseEntity;

public interface NextAction {

  /** 確保に成功した。呼び出し側が {@link IdempotentClaim} を専有し、確定かロールバックする。 */
  record StartProcessing(IdempotentClaim claim) implements NextAction {
    public StartProcessing {
      Objects.requireNonNull(claim, "claim");
    }
  }

  /** 確定済みの応答が既にある。そのまま返す。 */
  record ReturnCachedResponse(ResponseEntity<byte[]> response) implements NextAction {
    public ReturnCachedResponse {
      Objects.requireNonNull(response, "response");
    }
  }
}
