/*
 * どこで: DDE ドメインモデル
 * 何を: field_entries (1 回目入力の正本値) の読込結果を表す
 * なぜ: 比較と解決で同じフィールド表現を使うため
 */
package com.example.dde.model;

import java.time.Instant;

public record FieldEntryRecord(
    long fieldEntryId,
    long formInstanceId,
    String fieldName,
    String value,
    String updatedBy,
    Instant updatedAt) {}
