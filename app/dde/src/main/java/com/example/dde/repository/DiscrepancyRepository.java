/*
 * どこで: DDE Repository 層
 * 何を: 不一致レコードの登録・解決・集計を抽象化する
 * なぜ: 解決の一方向性を SQL の条件付き更新で担保しつつ service から隠すため
 */
package com.example.dde.repository;

import com.example.dde.model.DiscrepancyRecord;
import com.example.dde.model.ResolutionStrategy;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DiscrepancyRepository {

  /** 役割: OPEN の不一致を登録する。 動作: 採番された discrepancy_id を返す。 */
  long insert(
      long formInstanceId,
      long fieldEntryId,
      String firstValue,
      String secondValue,
      Instant createdAt);

  Optional<DiscrepancyRecord> findById(long discrepancyId);

  /** 役割: 不一致を行ロック付きで取得する。 前提: 呼び出し側でトランザクションが開始済みであること。 */
  Optional<DiscrepancyRecord> findByIdForUpdate(long discrepancyId);

  /** 役割: フィールドの最新の不一致を返す。 動作: OPEN が存在すればそれが最新になる。 */
  Optional<DiscrepancyRecord> findLatestByFieldEntryId(long fieldEntryId);

  /** 役割: 不一致を解決済みにする。 動作: status=OPEN の場合のみ更新し、既に RESOLVED なら empty を返す。 */
  Optional<DiscrepancyRecord> markResolved(
      long discrepancyId,
      ResolutionStrategy strategy,
      String resolvedValue,
      String resolverId,
      String resolutionNotes,
      Instant resolvedAt);

  int countOpenByFormInstanceId(long formInstanceId);

  /** 役割: フォームインスタンスの全不一致を返す。 動作: 作成が古い順。 */
  List<DiscrepancyRecord> findByFormInstanceId(long formInstanceId);
}
