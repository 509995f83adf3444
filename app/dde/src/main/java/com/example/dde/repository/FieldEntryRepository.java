/*
 * どこで: DDE Repository 層
 * 何を: フィールド値 (1 回目入力の正本) の参照と更新を抽象化する
 * なぜ: Form Instance Store のテーブル構造を service から切り離すため
 */
package com.example.dde.repository;

import com.example.dde.model.FieldEntryRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface FieldEntryRepository {

  /** 役割: フォームインスタンスの全フィールドを返す。 動作: field_entry_id 昇順。 */
  List<FieldEntryRecord> findByFormInstanceId(long formInstanceId);

  Optional<FieldEntryRecord> findById(long fieldEntryId);

  /** 役割: フィールド値を書き換える。 動作: 更新件数を返す (0 = 対象なし)。 */
  int updateValue(long fieldEntryId, String value, String actingUserId, Instant updatedAt);
}
