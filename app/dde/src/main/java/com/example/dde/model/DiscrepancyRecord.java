/*
 * どこで: DDE ドメインモデル
 * 何を: dde_discrepancies の読込結果を表す
 * なぜ: 検出時の 1 回目/2 回目の値と解決結果をまとめて扱うため
 */
package com.example.dde.model;

import java.time.Instant;

public record DiscrepancyRecord(
    long discrepancyId,
    long formInstanceId,
    long fieldEntryId,
    String fieldName,
    String firstValue,
    String secondValue,
    DiscrepancyStatus status,
    ResolutionStrategy strategy,
    String resolvedValue,
    String resolverId,
    Instant resolvedAt,
    String resolutionNotes,
    Instant createdAt) {

  public boolean isOpen() {
    return status == DiscrepancyStatus.OPEN;
  }
}
