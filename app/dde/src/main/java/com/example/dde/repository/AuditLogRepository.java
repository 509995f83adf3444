/*
 * どこで: DDE Repository 層
 * 何を: 監査ログ (追記専用) への書き込みを抽象化する
 * なぜ: 監査の保存先を差し替え可能にするため
 */
package com.example.dde.repository;

import com.example.dde.model.AuditRecord;

public interface AuditLogRepository {

  /** 役割: 監査レコードを追記する。 動作: 失敗は例外として伝播し、呼び出し元のトランザクションをロールバックさせる。 */
  void insert(AuditRecord record);
}
