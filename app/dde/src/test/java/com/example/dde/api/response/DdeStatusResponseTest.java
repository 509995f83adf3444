package com.example.dde.api.response;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dde.model.ComparisonPhase;
import com.example.dde.model.CompletionStatus;
import com.example.dde.model.EntryPhase;
import com.example.dde.model.FormInstanceRecord;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DdeStatusResponseTest {

  private static final Instant AT = Instant.parse("2026-03-01T09:00:00Z");

  @Test
  void notStartedHasEverythingPending() {
    final DdeStatusResponse response = DdeStatusResponse.of(instance(CompletionStatus.NOT_STARTED), 3, 0);

    assertThat(response.firstEntryStatus()).isEqualTo(EntryPhase.PENDING);
    assertThat(response.secondEntryStatus()).isEqualTo(EntryPhase.PENDING);
    assertThat(response.comparisonStatus()).isEqualTo(ComparisonPhase.PENDING);
    assertThat(response.ddeComplete()).isFalse();
  }

  @Test
  void firstEntryInProgressIsReported() {
    final DdeStatusResponse response =
        DdeStatusResponse.of(instance(CompletionStatus.FIRST_ENTRY_IN_PROGRESS), 3, 0);

    assertThat(response.firstEntryStatus()).isEqualTo(EntryPhase.IN_PROGRESS);
    assertThat(response.secondEntryStatus()).isEqualTo(EntryPhase.PENDING);
  }

  @Test
  void secondEntryReportsDiscrepanciesOrMatch() {
    final FormInstanceRecord instance = instance(CompletionStatus.SECOND_ENTRY_IN_PROGRESS);

    assertThat(DdeStatusResponse.of(instance, 3, 1).comparisonStatus())
        .isEqualTo(ComparisonPhase.DISCREPANCIES);
    assertThat(DdeStatusResponse.of(instance, 3, 0).comparisonStatus())
        .isEqualTo(ComparisonPhase.MATCHED);
    assertThat(DdeStatusResponse.of(instance, 3, 0).secondEntryStatus())
        .isEqualTo(EntryPhase.COMPLETE);
  }

  @Test
  void reconciledIsComplete() {
    final DdeStatusResponse response = DdeStatusResponse.of(instance(CompletionStatus.RECONCILED), 3, 0);

    assertThat(response.comparisonStatus()).isEqualTo(ComparisonPhase.RESOLVED);
    assertThat(response.ddeComplete()).isTrue();
    assertThat(response.totalItems()).isEqualTo(3);
  }

  private static FormInstanceRecord instance(CompletionStatus status) {
    return new FormInstanceRecord(
        7L, 1L, "Vital Signs", 2L, "SUBJ-007", "Baseline", status, true,
        "u1", AT, null, null, Map.of(), null, 1L);
  }
}
