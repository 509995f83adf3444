/*
 * どこで: DDE サービス層
 * 何を: 不一致の登録・解決・集計を担う
 * なぜ: 解決とフィールド値の書き換えと監査を同一トランザクションで行うため
 */
package com.example.dde.service;

import com.example.dde.api.DdeNotFoundException;
import com.example.dde.api.InvalidDdeTransitionException;
import com.example.dde.api.response.DiscrepanciesResponse;
import com.example.dde.api.response.DiscrepancyResponse;
import com.example.dde.model.DiscrepancyRecord;
import com.example.dde.model.DiscrepancyStatus;
import com.example.dde.model.FieldEntryRecord;
import com.example.dde.model.ResolutionStrategy;
import com.example.dde.repository.DiscrepancyRepository;
import com.example.dde.repository.FieldEntryRepository;
import com.example.dde.repository.FormInstanceRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DiscrepancyService {

  private static final Logger logger = LoggerFactory.getLogger(DiscrepancyService.class);
  private static final String ACTION_RESOLVE = "RESOLVE";

  private final DiscrepancyRepository discrepancyRepository;
  private final FieldEntryRepository fieldEntryRepository;
  private final FormInstanceRepository formInstanceRepository;
  private final DdeAuditWriter auditWriter;
  private final DdeMetrics metrics;
  private final Clock clock;

  public Optional<DiscrepancyRecord> findLatestForField(long fieldEntryId) {
    return discrepancyRepository.findLatestByFieldEntryId(fieldEntryId);
  }

  /** 検出時点の 1 回目/2 回目の値を保持した OPEN の不一致を登録する。 */
  @Transactional(propagation = Propagation.MANDATORY)
  public long open(
      long formInstanceId, FieldEntryRecord field, String secondValue, Instant detectedAt) {
    final long discrepancyId =
        discrepancyRepository.insert(
            formInstanceId, field.fieldEntryId(), field.value(), secondValue, detectedAt);
    metrics.recordDiscrepancyDetected();
    logger.info(
        "dde discrepancy opened discrepancyId={} formInstanceId={} field={}",
        discrepancyId,
        formInstanceId,
        field.fieldName());
    return discrepancyId;
  }

  /**
   * 役割: 不一致を解決し、解決値をフィールドへ書き戻す。
   * 動作: first_correct/second_correct は検出時の値、new_value/adjudicated は指定値を採用する。
   * フォームインスタンス、不一致の順に行ロックを取得する。
   * 前提: new_value/adjudicated で値が未指定なら何も変更せず IllegalArgumentException。
   */
  @Transactional
  public DiscrepancyResponse resolve(
      long discrepancyId, String resolution, String newValue, String resolverId, String notes) {
    try {
      final DiscrepancyResponse response =
          doResolve(discrepancyId, resolution, newValue, resolverId, notes);
      metrics.recordSuccess(ACTION_RESOLVE);
      return response;
    } catch (RuntimeException ex) {
      metrics.recordFailure(ACTION_RESOLVE, ex);
      throw ex;
    }
  }

  private DiscrepancyResponse doResolve(
      long discrepancyId, String resolution, String newValue, String resolverId, String notes) {
    if (resolverId == null || resolverId.isBlank()) {
      throw new IllegalArgumentException("user id is required");
    }
    final ResolutionStrategy strategy = ResolutionStrategy.fromValue(resolution);
    if (strategy.requiresNewValue() && (newValue == null || newValue.isEmpty())) {
      throw new IllegalArgumentException(
          "new_value is required for resolution " + strategy.value());
    }
    final DiscrepancyRecord peeked =
        discrepancyRepository
            .findById(discrepancyId)
            .orElseThrow(() -> DdeNotFoundException.discrepancy(discrepancyId));
    formInstanceRepository
        .findByIdForUpdate(peeked.formInstanceId())
        .orElseThrow(() -> DdeNotFoundException.formInstance(peeked.formInstanceId()));
    final DiscrepancyRecord discrepancy =
        discrepancyRepository
            .findByIdForUpdate(discrepancyId)
            .orElseThrow(() -> DdeNotFoundException.discrepancy(discrepancyId));
    if (!discrepancy.isOpen()) {
      throw alreadyResolved(discrepancyId);
    }
    final FieldEntryRecord field =
        fieldEntryRepository
            .findById(discrepancy.fieldEntryId())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "field entry missing for discrepancy: " + discrepancyId));
    final String resolvedValue =
        switch (strategy) {
          case FIRST_CORRECT -> discrepancy.firstValue();
          case SECOND_CORRECT -> discrepancy.secondValue();
          case NEW_VALUE, ADJUDICATED -> newValue;
        };
    final Instant now = Instant.now(clock);
    final DiscrepancyRecord resolved =
        discrepancyRepository
            .markResolved(discrepancyId, strategy, resolvedValue, resolverId, notes, now)
            .orElseThrow(() -> alreadyResolved(discrepancyId));
    if (fieldEntryRepository.updateValue(field.fieldEntryId(), resolvedValue, resolverId, now)
        == 0) {
      throw new IllegalStateException("field entry update failed: " + field.fieldEntryId());
    }
    final String reason =
        notes == null || notes.isBlank() ? "DDE resolved as " + strategy.value() : notes;
    auditWriter.recordResolution(resolved, field.value(), resolverId, reason, now);
    metrics.recordResolution(strategy.value());
    logger.info(
        "dde discrepancy resolved discrepancyId={} formInstanceId={} strategy={}",
        discrepancyId,
        resolved.formInstanceId(),
        strategy.value());
    return DiscrepancyResponse.from(resolved);
  }

  public int countOpen(long formInstanceId) {
    return discrepancyRepository.countOpenByFormInstanceId(formInstanceId);
  }

  @Transactional(readOnly = true)
  public DiscrepanciesResponse listByFormInstance(long formInstanceId) {
    formInstanceRepository
        .findById(formInstanceId)
        .orElseThrow(() -> DdeNotFoundException.formInstance(formInstanceId));
    final List<DiscrepancyResponse> items =
        discrepancyRepository.findByFormInstanceId(formInstanceId).stream()
            .map(DiscrepancyResponse::from)
            .toList();
    final int openCount =
        (int) items.stream().filter(item -> item.status() == DiscrepancyStatus.OPEN).count();
    return new DiscrepanciesResponse(formInstanceId, openCount, items);
  }

  private static InvalidDdeTransitionException alreadyResolved(long discrepancyId) {
    return new InvalidDdeTransitionException("discrepancy already resolved: " + discrepancyId);
  }
}
