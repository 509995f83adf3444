/*
 * どこで: DDE API
 * 何を: フォームインスタンスの DDE 状態を表す
 * なぜ: 完了状態と導出した各フェーズを 1 つの応答で返すため
 */
package com.example.dde.api.response;

import com.example.dde.model.ComparisonPhase;
import com.example.dde.model.CompletionStatus;
import com.example.dde.model.EntryPhase;
import com.example.dde.model.FormInstanceRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DdeStatusResponse(
    long formInstanceId,
    CompletionStatus status,
    EntryPhase firstEntryStatus,
    EntryPhase secondEntryStatus,
    ComparisonPhase comparisonStatus,
    String firstEntrantId,
    Instant firstEntryAt,
    String secondEntrantId,
    Instant secondEntryAt,
    Instant completedAt,
    int totalItems,
    int openDiscrepancies,
    boolean ddeComplete,
    boolean doubleEntryRequired) {

  public static DdeStatusResponse of(
      FormInstanceRecord instance, int totalItems, int openDiscrepancies) {
    final CompletionStatus status = instance.status();
    return new DdeStatusResponse(
        instance.formInstanceId(),
        status,
        firstEntryPhase(status),
        secondEntryPhase(status),
        comparisonPhase(status, openDiscrepancies),
        instance.firstEntrantId(),
        instance.firstEntryAt(),
        instance.secondEntrantId(),
        instance.secondEntryAt(),
        instance.completedAt(),
        totalItems,
        openDiscrepancies,
        status == CompletionStatus.RECONCILED,
        instance.doubleEntryRequired());
  }

  private static EntryPhase firstEntryPhase(CompletionStatus status) {
    if (status == CompletionStatus.NOT_STARTED) {
      return EntryPhase.PENDING;
    }
    if (status == CompletionStatus.FIRST_ENTRY_IN_PROGRESS) {
      return EntryPhase.IN_PROGRESS;
    }
    return EntryPhase.COMPLETE;
  }

  private static EntryPhase secondEntryPhase(CompletionStatus status) {
    // 2 回目入力は一括送信のため、送信済みなら COMPLETE とみなす
    return status.isBefore(CompletionStatus.SECOND_ENTRY_IN_PROGRESS)
        ? EntryPhase.PENDING
        : EntryPhase.COMPLETE;
  }

  private static ComparisonPhase comparisonPhase(CompletionStatus status, int openDiscrepancies) {
    return switch (status) {
      case SECOND_ENTRY_IN_PROGRESS ->
          openDiscrepancies > 0 ? ComparisonPhase.DISCREPANCIES : ComparisonPhase.MATCHED;
      case RECONCILED -> ComparisonPhase.RESOLVED;
      default -> ComparisonPhase.PENDING;
    };
  }
}
