/*
 * どこで: DDE ドメインモデル
 * 何を: 入力権限ゲートの判定結果を表す
 * なぜ: 許可時の入力種別と拒否時の理由を 1 つの値で返すため
 */
package com.example.dde.model;

public record AuthorizationDecision(
    boolean allowed, EntryType entryType, DenialReason denialReason, String reason) {

  public static AuthorizationDecision allow(EntryType entryType) {
    return new AuthorizationDecision(true, entryType, null, null);
  }

  public static AuthorizationDecision deny(DenialReason denialReason, String reason) {
    return new AuthorizationDecision(false, null, denialReason, reason);
  }
}
