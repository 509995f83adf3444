/*
 * どこで: DDE サービス層
 * 何を: 状態遷移と不一致解決の監査レコードを組み立てて保存する
 * なぜ: 監査の書式 (テーブル名/エンティティ名/新旧値) を 1 箇所に揃えるため
 */
package com.example.dde.service;

import com.example.dde.model.AuditRecord;
import com.example.dde.model.CompletionStatus;
import com.example.dde.model.DiscrepancyRecord;
import com.example.dde.repository.AuditLogRepository;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DdeAuditWriter {

  static final String TABLE_FORM_INSTANCES = "form_instances";
  static final String TABLE_FIELD_ENTRIES = "field_entries";
  static final String ENTITY_RESOLUTION = "DDE Resolution";

  private final AuditLogRepository auditLogRepository;

  public void recordTransition(
      long formInstanceId,
      String actorUserId,
      String entityName,
      CompletionStatus from,
      CompletionStatus to,
      String reason,
      Instant occurredAt) {
    auditLogRepository.insert(
        new AuditRecord(
            UUID.randomUUID(),
            occurredAt,
            actorUserId,
            TABLE_FORM_INSTANCES,
            formInstanceId,
            entityName,
            from.name(),
            to.name(),
            reason,
            formInstanceId));
  }

  /** 旧値は解決前のフィールド値 (1 回目入力の正本)。 */
  public void recordResolution(
      DiscrepancyRecord resolved,
      String previousValue,
      String actorUserId,
      String reason,
      Instant occurredAt) {
    auditLogRepository.insert(
        new AuditRecord(
            UUID.randomUUID(),
            occurredAt,
            actorUserId,
            TABLE_FIELD_ENTRIES,
            resolved.fieldEntryId(),
            ENTITY_RESOLUTION,
            previousValue,
            resolved.resolvedValue(),
            reason,
            resolved.formInstanceId()));
  }
}
