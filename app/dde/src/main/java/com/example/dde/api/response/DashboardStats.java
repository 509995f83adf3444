package com.example.dde.api.response;

import com.example.dde.model.CompletionStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** total は 1 回目完了以降 (FIRST_ENTRY_COMPLETE/SECOND_ENTRY_IN_PROGRESS/RECONCILED) の件数。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DashboardStats(
    long total,
    long pendingSecondEntry,
    long awaitingResolution,
    long reconciled,
    Map<CompletionStatus, Long> byStatus) {

  public DashboardStats {
    final Map<CompletionStatus, Long> copy = new EnumMap<>(CompletionStatus.class);
    if (byStatus != null) {
      copy.putAll(byStatus);
    }
    byStatus = Collections.unmodifiableMap(copy);
  }
}
