/*
 * どこで: DDE ドメインモデル
 * 何を: audit_log_events の登録用データを表す
 * なぜ: 状態遷移と解決の監査ログ構築を呼び出し側から隠蔽するため
 */
package com.example.dde.model;

import java.time.Instant;
import java.util.UUID;

public record AuditRecord(
    UUID auditId,
    Instant occurredAt,
    String actorUserId,
    String entityTable,
    long entityId,
    String entityName,
    String oldValue,
    String newValue,
    String reason,
    long formInstanceId) {}
