/*
 * どこで: DDE ドメインモデル
 * 何を: 入力権限ゲートの拒否理由を定義する
 * なぜ: 呼び出し側が拒否の種類で分岐できるようにするため
 */
package com.example.dde.model;

public enum DenialReason {
  NOT_REQUIRED,
  ALREADY_COMPLETE,
  SAME_ENTRANT
}
