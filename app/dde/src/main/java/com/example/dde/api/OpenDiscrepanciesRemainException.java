/*
 * どこで: DDE API
 * 何を: 未解決の不一致が残る状態での確定(409)を表す例外を定義する
 * なぜ: 残件数をメッセージと値の両方で返すため
 */
package com.example.dde.api;

public class OpenDiscrepanciesRemainException extends RuntimeException {

  private final int openCount;

  public OpenDiscrepanciesRemainException(int openCount) {
    super("Cannot finalize: " + openCount + " unresolved discrepancies remain");
    this.openCount = openCount;
  }

  public int getOpenCount() {
    return openCount;
  }
}
