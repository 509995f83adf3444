/*
 * どこで: DDE サービス層
 * 何を: 1 回目入力 (フィールド値) と 2 回目入力 (スナップショット) をフィールド単位で比較する
 * なぜ: 不一致の検出と自動照合の判定を 1 つの比較結果から行うため
 */
package com.example.dde.service;

import com.example.dde.model.ComparisonResult;
import com.example.dde.model.DiscrepancyRecord;
import com.example.dde.model.DiscrepancyStatus;
import com.example.dde.model.FieldComparison;
import com.example.dde.model.FieldEntryRecord;
import com.example.dde.model.FormInstanceRecord;
import com.example.dde.repository.FieldEntryRepository;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ComparisonEngine {

  private static final Logger logger = LoggerFactory.getLogger(ComparisonEngine.class);

  private final FieldEntryRepository fieldEntryRepository;
  private final DiscrepancyService discrepancyService;

  /**
   * 役割: フォームインスタンスの全フィールドを比較する。
   * 動作: スナップショットにないフィールドは空文字として比較する。detect=true のとき、OPEN の不一致がなく解決済みでもない不一致に対して
   * OPEN の不一致を登録する。既存の OPEN は再利用する。
   * 前提: detect=true の場合は呼び出し側がフォームインスタンスの行ロックを保持していること。
   */
  public ComparisonResult compare(FormInstanceRecord instance, Instant detectedAt, boolean detect) {
    final List<FieldEntryRecord> fields =
        fieldEntryRepository.findByFormInstanceId(instance.formInstanceId());
    final Map<Long, String> secondValues = instance.secondEntryValues();
    final List<FieldComparison> items = new ArrayList<>(fields.size());
    int matched = 0;
    int opened = 0;
    for (FieldEntryRecord field : fields) {
      final String secondValue =
          Objects.requireNonNullElse(secondValues.get(field.fieldEntryId()), "");
      final Optional<DiscrepancyRecord> latest =
          discrepancyService.findLatestForField(field.fieldEntryId());
      if (ValueNormalizer.sameValue(field.value(), secondValue)) {
        matched++;
        items.add(toComparison(field, secondValue, true, latest.orElse(null)));
        continue;
      }
      if (latest.isPresent() && (latest.get().isOpen() || isSettled(latest.get(), field))) {
        items.add(toComparison(field, secondValue, false, latest.get()));
        continue;
      }
      if (!detect) {
        items.add(toComparison(field, secondValue, false, null));
        continue;
      }
      final long discrepancyId =
          discrepancyService.open(instance.formInstanceId(), field, secondValue, detectedAt);
      opened++;
      items.add(
          new FieldComparison(
              field.fieldEntryId(),
              field.fieldName(),
              field.value(),
              secondValue,
              false,
              discrepancyId,
              DiscrepancyStatus.OPEN));
    }
    final int total = fields.size();
    logger.info(
        "dde comparison formInstanceId={} total={} matched={} mismatched={} opened={}",
        instance.formInstanceId(),
        total,
        matched,
        total - matched,
        opened);
    return new ComparisonResult(
        instance.formInstanceId(),
        instance.subjectLabel(),
        instance.formName(),
        items,
        total,
        matched,
        total - matched,
        opened);
  }

  // 解決済みの値が現在の正本と一致していれば、同じ不一致を再登録しない
  private static boolean isSettled(DiscrepancyRecord latest, FieldEntryRecord field) {
    return !latest.isOpen() && ValueNormalizer.sameValue(latest.resolvedValue(), field.value());
  }

  private static FieldComparison toComparison(
      FieldEntryRecord field, String secondValue, boolean matches, DiscrepancyRecord discrepancy) {
    return new FieldComparison(
        field.fieldEntryId(),
        field.fieldName(),
        field.value(),
        secondValue,
        matches,
        discrepancy == null ? null : discrepancy.discrepancyId(),
        discrepancy == null ? null : discrepancy.status());
  }
}
