/*
 * どこで: DDE サービス層
 * 何を: フォームインスタンスの完了状態 (5 段階) の遷移を担う
 * なぜ: 行ロック・権限判定・比較・監査を同一トランザクションで行い、不正な遷移を防ぐため
 */
package com.example.dde.service;

import com.example.dde.api.DdeNotFoundException;
import com.example.dde.api.EntryAuthorizationDeniedException;
import com.example.dde.api.InvalidDdeTransitionException;
import com.example.dde.api.OpenDiscrepanciesRemainException;
import com.example.dde.api.request.SecondEntryValue;
import com.example.dde.api.response.AuthorizationResponse;
import com.example.dde.api.response.ComparisonResponse;
import com.example.dde.api.response.DdeStatusResponse;
import com.example.dde.api.response.SecondEntryResponse;
import com.example.dde.model.AuthorizationDecision;
import com.example.dde.model.ComparisonResult;
import com.example.dde.model.CompletionStatus;
import com.example.dde.model.EntryType;
import com.example.dde.model.FormInstanceRecord;
import com.example.dde.repository.FieldEntryRepository;
import com.example.dde.repository.FormInstanceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DdeLifecycleService {

  private static final Logger logger = LoggerFactory.getLogger(DdeLifecycleService.class);

  static final String ACTION_START_FIRST = "START_FIRST_ENTRY";
  static final String ACTION_COMPLETE_FIRST = "COMPLETE_FIRST_ENTRY";
  static final String ACTION_SUBMIT_SECOND = "SUBMIT_SECOND_ENTRY";
  static final String ACTION_COMPARE = "COMPARE";
  static final String ACTION_FINALIZE = "FINALIZE";

  static final String ENTITY_FIRST_STARTED = "DDE First Entry Started";
  static final String ENTITY_FIRST_COMPLETE = "DDE First Entry Complete";
  static final String ENTITY_SECOND_SUBMITTED = "DDE Second Entry Submitted";
  static final String ENTITY_AUTO_RECONCILED = "DDE Auto Reconciled";
  static final String ENTITY_FINALIZED = "DDE Finalized";

  private final FormInstanceRepository formInstanceRepository;
  private final FieldEntryRepository fieldEntryRepository;
  private final DiscrepancyService discrepancyService;
  private final ComparisonEngine comparisonEngine;
  private final EntryAuthorizationGate authorizationGate;
  private final DdeAuditWriter auditWriter;
  private final DdeMetrics metrics;
  private final Clock clock;

  @Transactional
  public DdeStatusResponse startFirstEntry(long formInstanceId, String userId) {
    return command(
        ACTION_START_FIRST,
        () -> {
          requireUser(userId);
          final FormInstanceRecord locked = lock(formInstanceId);
          requireStatus(locked, "start first entry", CompletionStatus.NOT_STARTED);
          final Instant now = Instant.now(clock);
          final FormInstanceRecord updated =
              formInstanceRepository
                  .startFirstEntry(formInstanceId, now)
                  .orElseThrow(() -> conflict(formInstanceId, "start first entry"));
          auditWriter.recordTransition(
              formInstanceId,
              userId,
              ENTITY_FIRST_STARTED,
              locked.status(),
              updated.status(),
              "First data entry started",
              now);
          logTransition(formInstanceId, locked.status(), updated.status(), userId);
          return toStatus(updated);
        });
  }

  @Transactional
  public DdeStatusResponse markFirstEntryComplete(long formInstanceId, String userId) {
    return command(
        ACTION_COMPLETE_FIRST,
        () -> {
          requireUser(userId);
          final FormInstanceRecord locked = lock(formInstanceId);
          requireStatus(
              locked,
              "complete first entry",
              CompletionStatus.NOT_STARTED,
              CompletionStatus.FIRST_ENTRY_IN_PROGRESS);
          final Instant now = Instant.now(clock);
          final FormInstanceRecord updated =
              formInstanceRepository
                  .markFirstEntryComplete(formInstanceId, userId, now)
                  .orElseThrow(() -> conflict(formInstanceId, "complete first entry"));
          auditWriter.recordTransition(
              formInstanceId,
              userId,
              ENTITY_FIRST_COMPLETE,
              locked.status(),
              updated.status(),
              "First data entry completed for DDE",
              now);
          logTransition(formInstanceId, locked.status(), updated.status(), userId);
          return toStatus(updated);
        });
  }

  /**
   * 役割: 2 回目入力を保存し、その場で比較する。
   * 動作: 権限ゲートの拒否は何も変更せず EntryAuthorizationDeniedException。全フィールド一致かつ OPEN の不一致がなければ RECONCILED
   * まで進める。
   * 前提: entries は 1 件以上で field_entry_id が重複しないこと。
   */
  @Transactional
  public SecondEntryResponse submitSecondEntry(
      long formInstanceId, String userId, List<SecondEntryValue> entries) {
    return command(
        ACTION_SUBMIT_SECOND,
        () -> {
          requireUser(userId);
          final Map<Long, String> snapshot = toSnapshot(entries);
          final FormInstanceRecord locked = lock(formInstanceId);
          final AuthorizationDecision decision = authorizationGate.authorize(locked, userId);
          if (!decision.allowed()) {
            logger.warn(
                "dde second entry denied formInstanceId={} userId={} reason={}",
                formInstanceId,
                userId,
                decision.denialReason());
            throw new EntryAuthorizationDeniedException(
                decision.denialReason(), decision.reason());
          }
          if (decision.entryType() == EntryType.FIRST) {
            throw new InvalidDdeTransitionException(
                "first entry is not complete: status=" + locked.status());
          }
          final Instant now = Instant.now(clock);
          final FormInstanceRecord stored =
              formInstanceRepository
                  .storeSecondEntry(formInstanceId, userId, snapshot, now)
                  .orElseThrow(() -> conflict(formInstanceId, "submit second entry"));
          auditWriter.recordTransition(
              formInstanceId,
              userId,
              ENTITY_SECOND_SUBMITTED,
              locked.status(),
              stored.status(),
              "Second data entry submitted for comparison",
              now);
          logTransition(formInstanceId, locked.status(), stored.status(), userId);
          final ComparisonResult comparison = comparisonEngine.compare(stored, now, true);
          final FormInstanceRecord current = reconcileIfSettled(stored, comparison, userId, now);
          return new SecondEntryResponse(toStatus(current), ComparisonResponse.from(comparison));
        });
  }

  /**
   * 役割: 保存済みの 2 回目入力と現在のフィールド値を再比較する。
   * 動作: SECOND_ENTRY_IN_PROGRESS では不一致を登録し、全一致なら RECONCILED へ進める。RECONCILED では参照のみ。
   */
  @Transactional
  public ComparisonResponse compare(long formInstanceId, String userId) {
    return command(
        ACTION_COMPARE,
        () -> {
          requireUser(userId);
          final FormInstanceRecord locked = lock(formInstanceId);
          requireStatus(
              locked,
              "compare entries",
              CompletionStatus.SECOND_ENTRY_IN_PROGRESS,
              CompletionStatus.RECONCILED);
          final Instant now = Instant.now(clock);
          final boolean detect = locked.status() == CompletionStatus.SECOND_ENTRY_IN_PROGRESS;
          final ComparisonResult comparison = comparisonEngine.compare(locked, now, detect);
          if (detect) {
            reconcileIfSettled(locked, comparison, userId, now);
          }
          return ComparisonResponse.from(comparison);
        });
  }

  @Transactional
  public DdeStatusResponse finalizeDde(long formInstanceId, String userId) {
    return command(
        ACTION_FINALIZE,
        () -> {
          requireUser(userId);
          final FormInstanceRecord locked = lock(formInstanceId);
          requireStatus(locked, "finalize", CompletionStatus.SECOND_ENTRY_IN_PROGRESS);
          final int openCount = discrepancyService.countOpen(formInstanceId);
          if (openCount > 0) {
            throw new OpenDiscrepanciesRemainException(openCount);
          }
          final Instant now = Instant.now(clock);
          final FormInstanceRecord updated =
              formInstanceRepository
                  .markReconciled(formInstanceId, now)
                  .orElseThrow(() -> conflict(formInstanceId, "finalize"));
          auditWriter.recordTransition(
              formInstanceId,
              userId,
              ENTITY_FINALIZED,
              locked.status(),
              updated.status(),
              "Double data entry finalized",
              now);
          logTransition(formInstanceId, locked.status(), updated.status(), userId);
          return toStatus(updated);
        });
  }

  @Transactional(readOnly = true)
  public DdeStatusResponse getStatus(long formInstanceId) {
    return toStatus(find(formInstanceId));
  }

  @Transactional(readOnly = true)
  public AuthorizationResponse canEnter(long formInstanceId, String userId) {
    requireUser(userId);
    return AuthorizationResponse.from(authorizationGate.authorize(find(formInstanceId), userId));
  }

  private FormInstanceRecord reconcileIfSettled(
      FormInstanceRecord instance, ComparisonResult comparison, String userId, Instant now) {
    if (!comparison.allMatched()
        || discrepancyService.countOpen(instance.formInstanceId()) > 0) {
      return instance;
    }
    final FormInstanceRecord reconciled =
        formInstanceRepository
            .markReconciled(instance.formInstanceId(), now)
            .orElseThrow(() -> conflict(instance.formInstanceId(), "reconcile"));
    auditWriter.recordTransition(
        instance.formInstanceId(),
        userId,
        ENTITY_AUTO_RECONCILED,
        instance.status(),
        reconciled.status(),
        "All fields matched on comparison",
        now);
    logTransition(instance.formInstanceId(), instance.status(), reconciled.status(), userId);
    return reconciled;
  }

  private <T> T command(String action, Supplier<T> body) {
    try {
      final T result = body.get();
      metrics.recordSuccess(action);
      return result;
    } catch (RuntimeException ex) {
      metrics.recordFailure(action, ex);
      throw ex;
    }
  }

  private FormInstanceRecord lock(long formInstanceId) {
    return formInstanceRepository
        .findByIdForUpdate(formInstanceId)
        .orElseThrow(() -> DdeNotFoundException.formInstance(formInstanceId));
  }

  private FormInstanceRecord find(long formInstanceId) {
    return formInstanceRepository
        .findById(formInstanceId)
        .orElseThrow(() -> DdeNotFoundException.formInstance(formInstanceId));
  }

  private DdeStatusResponse toStatus(FormInstanceRecord instance) {
    final int totalItems =
        fieldEntryRepository.findByFormInstanceId(instance.formInstanceId()).size();
    return DdeStatusResponse.of(
        instance, totalItems, discrepancyService.countOpen(instance.formInstanceId()));
  }

  private static Map<Long, String> toSnapshot(List<SecondEntryValue> entries) {
    if (entries == null || entries.isEmpty()) {
      throw new IllegalArgumentException("entries array is required");
    }
    final Map<Long, String> snapshot = new LinkedHashMap<>();
    for (SecondEntryValue entry : entries) {
      if (entry == null || entry.fieldEntryId() == null) {
        throw new IllegalArgumentException("field_entry_id is required");
      }
      if (snapshot.containsKey(entry.fieldEntryId())) {
        throw new IllegalArgumentException("duplicate field_entry_id: " + entry.fieldEntryId());
      }
      snapshot.put(entry.fieldEntryId(), Objects.requireNonNullElse(entry.value(), ""));
    }
    return snapshot;
  }

  private static void requireUser(String userId) {
    if (userId == null || userId.isBlank()) {
      throw new IllegalArgumentException("user id is required");
    }
  }

  private static void requireStatus(
      FormInstanceRecord instance, String operation, CompletionStatus... allowed) {
    for (CompletionStatus status : allowed) {
      if (instance.status() == status) {
        return;
      }
    }
    throw new InvalidDdeTransitionException(
        "cannot " + operation + " from status " + instance.status());
  }

  private static InvalidDdeTransitionException conflict(long formInstanceId, String operation) {
    return new InvalidDdeTransitionException(
        "state changed concurrently, cannot " + operation + ": formInstanceId=" + formInstanceId);
  }

  private static void logTransition(
      long formInstanceId, CompletionStatus from, CompletionStatus to, String userId) {
    logger.info(
        "dde transition formInstanceId={} from={} to={} userId={}", formInstanceId, from, to, userId);
  }
}
