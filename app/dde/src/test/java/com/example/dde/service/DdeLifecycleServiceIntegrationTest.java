/*
 * どこで: DDE ライフサイクルの統合テスト
 * 何を: 1 回目完了→2 回目入力→比較→解決→確定の流れを実 DB で検証する
 * なぜ: 状態遷移・不一致・監査が同一トランザクションで整合することを保証するため
 */
package com.example.dde.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.dde.AbstractPostgresContainerTest;
import com.example.dde.DdeTestData;
import com.example.dde.api.EntryAuthorizationDeniedException;
import com.example.dde.api.InvalidDdeTransitionException;
import com.example.dde.api.OpenDiscrepanciesRemainException;
import com.example.dde.api.request.SecondEntryValue;
import com.example.dde.api.response.ComparisonResponse;
import com.example.dde.api.response.DdeStatusResponse;
import com.example.dde.api.response.DiscrepanciesResponse;
import com.example.dde.api.response.DiscrepancyResponse;
import com.example.dde.api.response.SecondEntryResponse;
import com.example.dde.model.ComparisonPhase;
import com.example.dde.model.CompletionStatus;
import com.example.dde.model.DenialReason;
import com.example.dde.model.DiscrepancyStatus;
import com.example.dde.model.EntryPhase;
import com.example.dde.model.EntryType;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DdeLifecycleServiceIntegrationTest extends AbstractPostgresContainerTest {

  private static final String FIRST_USER = "u1";
  private static final String SECOND_USER = "u2";
  private static final String THIRD_USER = "u3";
  private static final Duration LATCH_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration COMPLETION_TIMEOUT = Duration.ofSeconds(10);

  @Autowired private DdeLifecycleService lifecycleService;
  @Autowired private DiscrepancyService discrepancyService;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  private DdeTestData testData;
  private long formId;

  @BeforeEach
  void setUp() {
    testData = new DdeTestData(jdbcTemplate);
    testData.cleanup();
    formId = testData.createForm("Vital Signs", true);
  }

  @Test
  void whitespaceOnlyDifferenceReconcilesImmediately() {
    final long instanceId = testData.createInstance(formId, 10L, "SUBJ-001");
    final long fieldId = testData.addField(instanceId, "systolic", "120");
    lifecycleService.markFirstEntryComplete(instanceId, FIRST_USER);

    final SecondEntryResponse response =
        lifecycleService.submitSecondEntry(
            instanceId, SECOND_USER, List.of(new SecondEntryValue(fieldId, " 120 ")));

    assertThat(response.comparison().matched()).isEqualTo(1);
    assertThat(response.comparison().items().get(0).matches()).isTrue();
    assertThat(response.status().status()).isEqualTo(CompletionStatus.RECONCILED);
    assertThat(response.status().ddeComplete()).isTrue();
    assertThat(response.status().completedAt()).isNotNull();
    assertThat(testData.count("dde_discrepancies")).isZero();
    assertThat(testData.auditEntityNames(instanceId))
        .containsExactlyInAnyOrder(
            "DDE First Entry Complete", "DDE Second Entry Submitted", "DDE Auto Reconciled");
  }

  @Test
  void mismatchOpensDiscrepancyAndBlocksFinalize() {
    final long instanceId = mismatchedInstance();

    final DdeStatusResponse status = lifecycleService.getStatus(instanceId);
    assertThat(status.status()).isEqualTo(CompletionStatus.SECOND_ENTRY_IN_PROGRESS);
    assertThat(status.openDiscrepancies()).isEqualTo(1);
    assertThat(status.comparisonStatus()).isEqualTo(ComparisonPhase.DISCREPANCIES);

    assertThatThrownBy(() -> lifecycleService.finalizeDde(instanceId, SECOND_USER))
        .isInstanceOf(OpenDiscrepanciesRemainException.class)
        .hasMessage("Cannot finalize: 1 unresolved discrepancies remain");
    assertThat(lifecycleService.getStatus(instanceId).status())
        .isEqualTo(CompletionStatus.SECOND_ENTRY_IN_PROGRESS);
  }

  @Test
  void secondCorrectResolutionAllowsFinalize() {
    final long instanceId = mismatchedInstance();
    final DiscrepancyResponse open = onlyDiscrepancy(instanceId);

    final DiscrepancyResponse resolved =
        discrepancyService.resolve(
            open.discrepancyId(), "second_correct", null, SECOND_USER, null);

    assertThat(resolved.status()).isEqualTo(DiscrepancyStatus.RESOLVED);
    assertThat(resolved.resolvedValue()).isEqualTo("No");
    assertThat(resolved.resolverId()).isEqualTo(SECOND_USER);
    assertThat(testData.fieldValue(open.fieldEntryId())).isEqualTo("No");

    final DdeStatusResponse finalized = lifecycleService.finalizeDde(instanceId, SECOND_USER);

    assertThat(finalized.status()).isEqualTo(CompletionStatus.RECONCILED);
    assertThat(finalized.comparisonStatus()).isEqualTo(ComparisonPhase.RESOLVED);
    assertThat(testData.auditEntityNames(instanceId)).contains("DDE Resolution", "DDE Finalized");
  }

  @Test
  void sameEntrantIsDeniedWithoutMutation() {
    final long instanceId = testData.createInstance(formId, 10L, "SUBJ-004");
    final long fieldId = testData.addField(instanceId, "smoker", "Yes");
    lifecycleService.markFirstEntryComplete(instanceId, FIRST_USER);

    assertThatThrownBy(
            () ->
                lifecycleService.submitSecondEntry(
                    instanceId, FIRST_USER, List.of(new SecondEntryValue(fieldId, "Yes"))))
        .isInstanceOf(EntryAuthorizationDeniedException.class)
        .hasMessage("Different user required for second entry. First entry was done by u1")
        .isInstanceOfSatisfying(
            EntryAuthorizationDeniedException.class,
            ex -> assertThat(ex.getReason()).isEqualTo(DenialReason.SAME_ENTRANT));

    final DdeStatusResponse status = lifecycleService.getStatus(instanceId);
    assertThat(status.status()).isEqualTo(CompletionStatus.FIRST_ENTRY_COMPLETE);
    assertThat(status.secondEntrantId()).isNull();
    assertThat(testData.auditEntityNames(instanceId)).containsExactly("DDE First Entry Complete");
  }

  @Test
  void newValueWithoutValueIsRejectedWithoutAudit() {
    final long instanceId = mismatchedInstance();
    final DiscrepancyResponse open = onlyDiscrepancy(instanceId);
    final int auditsBefore = testData.count("audit_log_events");

    assertThatThrownBy(
            () ->
                discrepancyService.resolve(
                    open.discrepancyId(), "new_value", null, SECOND_USER, null))
        .isInstanceOf(IllegalArgumentException.class);

    assertThat(onlyDiscrepancy(instanceId).status()).isEqualTo(DiscrepancyStatus.OPEN);
    assertThat(testData.fieldValue(open.fieldEntryId())).isEqualTo("Yes");
    assertThat(testData.count("audit_log_events")).isEqualTo(auditsBefore);
  }

  @Test
  void resolvingTwiceIsInvalidState() {
    final long instanceId = mismatchedInstance();
    final long discrepancyId = onlyDiscrepancy(instanceId).discrepancyId();
    discrepancyService.resolve(discrepancyId, "new_value", "Unknown", SECOND_USER, "source check");

    assertThatThrownBy(
            () -> discrepancyService.resolve(discrepancyId, "first_correct", null, THIRD_USER, null))
        .isInstanceOf(InvalidDdeTransitionException.class);
    assertThat(testData.fieldValue(onlyDiscrepancy(instanceId).fieldEntryId()))
        .isEqualTo("Unknown");
  }

  @Test
  void repeatedComparisonDoesNotDuplicateOpenDiscrepancies() {
    final long instanceId = mismatchedInstance();

    final ComparisonResponse first = lifecycleService.compare(instanceId, SECOND_USER);
    final ComparisonResponse second = lifecycleService.compare(instanceId, SECOND_USER);

    assertThat(first.mismatched()).isEqualTo(1);
    assertThat(second.items().get(0).discrepancyId())
        .isEqualTo(first.items().get(0).discrepancyId());
    assertThat(testData.count("dde_discrepancies")).isEqualTo(1);
  }

  @Test
  void firstCorrectResolutionIsNotReopenedByComparison() {
    final long instanceId = mismatchedInstance();
    final long discrepancyId = onlyDiscrepancy(instanceId).discrepancyId();
    discrepancyService.resolve(discrepancyId, "first_correct", null, SECOND_USER, null);

    final ComparisonResponse comparison = lifecycleService.compare(instanceId, SECOND_USER);

    assertThat(comparison.mismatched()).isEqualTo(1);
    assertThat(comparison.items().get(0).discrepancyStatus()).isEqualTo(DiscrepancyStatus.RESOLVED);
    assertThat(testData.count("dde_discrepancies")).isEqualTo(1);
    assertThat(lifecycleService.finalizeDde(instanceId, SECOND_USER).status())
        .isEqualTo(CompletionStatus.RECONCILED);
  }

  @Test
  void comparisonAfterReconcileIsReadOnly() {
    final long instanceId = testData.createInstance(formId, 10L, "SUBJ-009");
    final long fieldId = testData.addField(instanceId, "weight", "70");
    lifecycleService.markFirstEntryComplete(instanceId, FIRST_USER);
    lifecycleService.submitSecondEntry(
        instanceId, SECOND_USER, List.of(new SecondEntryValue(fieldId, "70")));

    final ComparisonResponse comparison = lifecycleService.compare(instanceId, SECOND_USER);

    assertThat(comparison.matched()).isEqualTo(1);
    assertThat(lifecycleService.getStatus(instanceId).status())
        .isEqualTo(CompletionStatus.RECONCILED);
  }

  @Test
  void lifecycleRejectsOutOfOrderOperations() {
    final long instanceId = testData.createInstance(formId, 10L, "SUBJ-010");
    final long fieldId = testData.addField(instanceId, "height", "170");

    assertThatThrownBy(() -> lifecycleService.compare(instanceId, SECOND_USER))
        .isInstanceOf(InvalidDdeTransitionException.class);
    assertThatThrownBy(
            () ->
                lifecycleService.submitSecondEntry(
                    instanceId, SECOND_USER, List.of(new SecondEntryValue(fieldId, "170"))))
        .isInstanceOf(InvalidDdeTransitionException.class);
    assertThatThrownBy(() -> lifecycleService.finalizeDde(instanceId, SECOND_USER))
        .isInstanceOf(InvalidDdeTransitionException.class);

    final DdeStatusResponse started = lifecycleService.startFirstEntry(instanceId, FIRST_USER);
    assertThat(started.firstEntryStatus()).isEqualTo(EntryPhase.IN_PROGRESS);
    assertThatThrownBy(() -> lifecycleService.startFirstEntry(instanceId, FIRST_USER))
        .isInstanceOf(InvalidDdeTransitionException.class);

    final DdeStatusResponse completed =
        lifecycleService.markFirstEntryComplete(instanceId, FIRST_USER);
    assertThat(completed.firstEntryStatus()).isEqualTo(EntryPhase.COMPLETE);
    assertThat(completed.firstEntrantId()).isEqualTo(FIRST_USER);
    assertThatThrownBy(() -> lifecycleService.markFirstEntryComplete(instanceId, FIRST_USER))
        .isInstanceOf(InvalidDdeTransitionException.class);
  }

  @Test
  void secondEntryIsDeniedWhenFormDoesNotRequireIt() {
    final long singleEntryForm = testData.createForm("Concomitant Medication", false);
    final long instanceId = testData.createInstance(singleEntryForm, 10L, "SUBJ-011");
    final long fieldId = testData.addField(instanceId, "drug", "aspirin");
    lifecycleService.markFirstEntryComplete(instanceId, FIRST_USER);

    assertThat(lifecycleService.canEnter(instanceId, SECOND_USER).denialReason())
        .isEqualTo(DenialReason.NOT_REQUIRED);
    assertThatThrownBy(
            () ->
                lifecycleService.submitSecondEntry(
                    instanceId, SECOND_USER, List.of(new SecondEntryValue(fieldId, "aspirin"))))
        .isInstanceOf(EntryAuthorizationDeniedException.class)
        .hasMessage("DDE not required for this form");
  }

  @Test
  void canEnterReflectsEntryType() {
    final long instanceId = testData.createInstance(formId, 10L, "SUBJ-012");
    testData.addField(instanceId, "pulse", "72");

    assertThat(lifecycleService.canEnter(instanceId, FIRST_USER).entryType())
        .isEqualTo(EntryType.FIRST);
    lifecycleService.markFirstEntryComplete(instanceId, FIRST_USER);
    assertThat(lifecycleService.canEnter(instanceId, SECOND_USER).entryType())
        .isEqualTo(EntryType.SECOND);
    assertThat(lifecycleService.canEnter(instanceId, FIRST_USER).allowed()).isFalse();
  }

  @Test
  void concurrentSecondEntriesLetExactlyOneWin() throws Exception {
    final long instanceId = testData.createInstance(formId, 10L, "SUBJ-020");
    final long fieldId = testData.addField(instanceId, "temperature", "36.5");
    lifecycleService.markFirstEntryComplete(instanceId, FIRST_USER);

    final CountDownLatch ready = new CountDownLatch(2);
    final CountDownLatch start = new CountDownLatch(1);
    final CountDownLatch done = new CountDownLatch(2);
    final List<SecondEntryResponse> responses = new CopyOnWriteArrayList<>();
    final List<Throwable> errors = new CopyOnWriteArrayList<>();
    final ExecutorService executor = Executors.newFixedThreadPool(2);

    try {
      for (String userId : List.of(SECOND_USER, THIRD_USER)) {
        executor.submit(
            () -> {
              try {
                ready.countDown();
                if (!start.await(LATCH_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                  errors.add(new IllegalStateException("start latch timeout"));
                  return;
                }
                responses.add(
                    lifecycleService.submitSecondEntry(
                        instanceId, userId, List.of(new SecondEntryValue(fieldId, "36.5"))));
              } catch (Throwable ex) {
                errors.add(ex);
              } finally {
                done.countDown();
              }
            });
      }
      assertThat(ready.await(LATCH_TIMEOUT.toSeconds(), TimeUnit.SECONDS)).isTrue();
      start.countDown();
      assertThat(done.await(COMPLETION_TIMEOUT.toSeconds(), TimeUnit.SECONDS)).isTrue();
    } finally {
      executor.shutdownNow();
    }

    assertThat(responses).hasSize(1);
    assertThat(errors)
        .singleElement()
        .isInstanceOfSatisfying(
            EntryAuthorizationDeniedException.class,
            ex -> assertThat(ex.getReason()).isEqualTo(DenialReason.ALREADY_COMPLETE));
    assertThat(lifecycleService.getStatus(instanceId).secondEntrantId())
        .isEqualTo(responses.get(0).status().secondEntrantId());
    assertThat(testData.auditEntityNames(instanceId))
        .filteredOn(name -> name.equals("DDE Second Entry Submitted"))
        .hasSize(1);
  }

  private long mismatchedInstance() {
    final long instanceId = testData.createInstance(formId, 10L, "SUBJ-002");
    final long fieldId = testData.addField(instanceId, "smoker", "Yes");
    lifecycleService.markFirstEntryComplete(instanceId, FIRST_USER);
    final SecondEntryResponse response =
        lifecycleService.submitSecondEntry(
            instanceId, SECOND_USER, List.of(new SecondEntryValue(fieldId, "No")));
    assertThat(response.comparison().mismatched()).isEqualTo(1);
    return instanceId;
  }

  private DiscrepancyResponse onlyDiscrepancy(long instanceId) {
    final DiscrepanciesResponse discrepancies = discrepancyService.listByFormInstance(instanceId);
    assertThat(discrepancies.discrepancies()).hasSize(1);
    return discrepancies.discrepancies().get(0);
  }
}
