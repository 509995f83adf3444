/*
 * どこで: DDE ドメインモデル
 * 何を: フォームインスタンスの 5 段階の完了状態を定義する
 * なぜ: 外部ストアの共有 completion_status_id を DDE 専用の型へ閉じ込めるため
 */
package com.example.dde.model;

public enum CompletionStatus {
  NOT_STARTED(1),
  FIRST_ENTRY_IN_PROGRESS(2),
  FIRST_ENTRY_COMPLETE(3),
  SECOND_ENTRY_IN_PROGRESS(4),
  RECONCILED(5);

  private final int code;

  CompletionStatus(int code) {
    this.code = code;
  }

  /** 外部ストアの completion_status_id 値。 */
  public int code() {
    return code;
  }

  public boolean isBefore(CompletionStatus other) {
    return code < other.code;
  }

  /**
   * 役割: completion_status_id を列挙型へ変換する。
   * 動作: 1..5 以外は IllegalStateException を送出する。
   * 前提: DB の CHECK 制約で範囲外の値は保存されない。
   */
  public static CompletionStatus fromCode(int code) {
    for (CompletionStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalStateException("unsupported completion_status_id: " + code);
  }
}
