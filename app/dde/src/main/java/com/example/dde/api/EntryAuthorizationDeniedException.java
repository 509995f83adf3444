/*
 * どこで: DDE API
 * 何を: 入力権限ゲートによる拒否(403)を表す例外を定義する
 * なぜ: 拒否理由 (NOT_REQUIRED/ALREADY_COMPLETE/SAME_ENTRANT) をクライアントへ返すため
 */
package com.example.dde.api;

import com.example.dde.model.DenialReason;

public class EntryAuthorizationDeniedException extends RuntimeException {

  private final DenialReason reason;

  public EntryAuthorizationDeniedException(DenialReason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public DenialReason getReason() {
    return reason;
  }
}
