/*
 * どこで: DDE ドメインモデル
 * 何を: 1 回目と 2 回目の入力の比較結果を表す
 * なぜ: 状態遷移の判定と API 応答で同じ集計値を使うため
 */
package com.example.dde.model;

import java.util.List;

public record ComparisonResult(
    long formInstanceId,
    String subjectLabel,
    String formName,
    List<FieldComparison> items,
    int total,
    int matched,
    int mismatched,
    int newDiscrepancies) {

  public ComparisonResult {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public boolean allMatched() {
    return mismatched == 0;
  }
}
