/*
 * どこで: DDE API
 * 何を: 対象のフォームインスタンス/不一致が存在しないこと(404)を表す
 * なぜ: 状態衝突と区別して応答するため
 */
package com.example.dde.api;

public class DdeNotFoundException extends RuntimeException {

  public DdeNotFoundException(String message) {
    super(message);
  }

  public static DdeNotFoundException formInstance(long formInstanceId) {
    return new DdeNotFoundException("form instance not found: " + formInstanceId);
  }

  public static DdeNotFoundException discrepancy(long discrepancyId) {
    return new DdeNotFoundException("discrepancy not found: " + discrepancyId);
  }
}
