/*
 * どこで: DDE Repository 層
 * 何を: フォームインスタンスの読込・状態遷移・集計を抽象化する
 * なぜ: JOIN や SQL の詳細を service から切り離すため
 */
package com.example.dde.repository;

import com.example.dde.model.CompletionStatus;
import com.example.dde.model.FormInstanceRecord;
import com.example.dde.model.PendingFormInstance;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface FormInstanceRepository {

  /** 役割: ID でフォームインスタンスを取得する。 動作: 存在しなければ empty を返す。 */
  Optional<FormInstanceRecord> findById(long formInstanceId);

  /**
   * 役割: フォームインスタンスを行ロック付きで取得する。 動作: SELECT ... FOR UPDATE でトランザクション終了まで同一行への遷移を直列化する。
   * 前提: 呼び出し側でトランザクションが開始済みであること。
   */
  Optional<FormInstanceRecord> findByIdForUpdate(long formInstanceId);

  /** 役割: フォーム定義の double_entry フラグを返す。 動作: インスタンスが存在しなければ false。 */
  boolean isDoubleEntryRequired(long formInstanceId);

  /** 役割: NOT_STARTED から FIRST_ENTRY_IN_PROGRESS へ遷移する。 動作: 遷移元が異なれば更新せず empty を返す。 */
  Optional<FormInstanceRecord> startFirstEntry(long formInstanceId, Instant updatedAt);

  /**
   * 役割: 1 回目入力を完了にする。 動作: NOT_STARTED/FIRST_ENTRY_IN_PROGRESS の場合のみ FIRST_ENTRY_COMPLETE へ遷移し、入力者と時刻を記録する。
   * それ以外は empty を返す。
   */
  Optional<FormInstanceRecord> markFirstEntryComplete(
      long formInstanceId, String firstEntrantId, Instant completedAt);

  /**
   * 役割: 2 回目入力のスナップショットを保存する。 動作: FIRST_ENTRY_COMPLETE かつ 2 回目入力者が未設定の場合のみ
   * SECOND_ENTRY_IN_PROGRESS へ遷移する。それ以外は empty を返す。
   */
  Optional<FormInstanceRecord> storeSecondEntry(
      long formInstanceId,
      String secondEntrantId,
      Map<Long, String> secondEntryValues,
      Instant submittedAt);

  /** 役割: SECOND_ENTRY_IN_PROGRESS から RECONCILED へ遷移する。 動作: 遷移元が異なれば empty を返す。 */
  Optional<FormInstanceRecord> markReconciled(long formInstanceId, Instant completedAt);

  /**
   * 役割: 2 回目入力待ちの一覧を返す。 動作: double_entry 必須かつ FIRST_ENTRY_COMPLETE を 1 回目完了が古い順に返す。 前提: siteId
   * は null 可 (全施設)。
   */
  List<PendingFormInstance> findPendingSecondEntry(Long siteId, int limit);

  /** 役割: 不一致解決待ちの一覧を返す。 動作: SECOND_ENTRY_IN_PROGRESS かつ OPEN の不一致を持つものを 2 回目入力が古い順に返す。 */
  List<PendingFormInstance> findPendingResolution(Long siteId, int limit);

  /** 役割: double_entry 必須フォームの状態別件数を返す。 動作: 件数 0 の状態はキーに含まれない。 */
  Map<CompletionStatus, Long> countByStatus(Long siteId);
}
