/*
 * どこで: DDE サービス層
 * 何を: 利用者がどちらの入力を行えるかを判定する
 * なぜ: 1 回目と 2 回目の入力者の分離を状態変更の前に保証するため
 */
package com.example.dde.service;

import com.example.dde.model.AuthorizationDecision;
import com.example.dde.model.CompletionStatus;
import com.example.dde.model.DenialReason;
import com.example.dde.model.EntryType;
import com.example.dde.model.FormInstanceRecord;
import java.util.Objects;
import org.springframework.stereotype.Component;

@Component
public class EntryAuthorizationGate {

  static final String REASON_NOT_REQUIRED = "DDE not required for this form";
  static final String REASON_ALREADY_COMPLETE = "DDE entries already complete";
  static final String REASON_SAME_ENTRANT =
      "Different user required for second entry. First entry was done by ";

  /**
   * 役割: 読込済みの状態から入力可否を判定する。
   * 動作: 1 回目未完了なら FIRST、DDE 不要/2 回目入力済み/同一入力者なら拒否、それ以外は SECOND を返す。
   * 前提: 状態の変更は行わない。
   */
  public AuthorizationDecision authorize(FormInstanceRecord instance, String userId) {
    if (instance.status().isBefore(CompletionStatus.FIRST_ENTRY_COMPLETE)) {
      return AuthorizationDecision.allow(EntryType.FIRST);
    }
    if (!instance.doubleEntryRequired()) {
      return AuthorizationDecision.deny(DenialReason.NOT_REQUIRED, REASON_NOT_REQUIRED);
    }
    if (instance.hasSecondEntrant()) {
      return AuthorizationDecision.deny(DenialReason.ALREADY_COMPLETE, REASON_ALREADY_COMPLETE);
    }
    if (Objects.equals(userId, instance.firstEntrantId())) {
      return AuthorizationDecision.deny(
          DenialReason.SAME_ENTRANT, REASON_SAME_ENTRANT + instance.firstEntrantId());
    }
    return AuthorizationDecision.allow(EntryType.SECOND);
  }
}
