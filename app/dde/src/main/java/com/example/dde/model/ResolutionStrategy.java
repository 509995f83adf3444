/*
 * どこで: DDE ドメインモデル
 * 何を: 不一致の解決方法を定義する
 * なぜ: API の resolution 文字列を内部列挙型へ固定するため
 */
package com.example.dde.model;

public enum ResolutionStrategy {
  FIRST_CORRECT("first_correct"),
  SECOND_CORRECT("second_correct"),
  NEW_VALUE("new_value"),
  ADJUDICATED("adjudicated");

  private final String value;

  ResolutionStrategy(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** 呼び出し側が new_value を渡す必要がある解決方法か。 */
  public boolean requiresNewValue() {
    return this == NEW_VALUE || this == ADJUDICATED;
  }

  /**
   * 役割: API で受け取った resolution 文字列を内部列挙型へ変換する。
   * 動作: 大文字小文字を無視して一致判定を行い、未対応値は IllegalArgumentException を送出する。
   */
  public static ResolutionStrategy fromValue(String resolution) {
    if (resolution == null || resolution.isBlank()) {
      throw new IllegalArgumentException(
          "resolution is required (first_correct, second_correct, new_value, or adjudicated)");
    }
    for (ResolutionStrategy strategy : values()) {
      if (strategy.value.equalsIgnoreCase(resolution.trim())) {
        return strategy;
      }
    }
    throw new IllegalArgumentException("unsupported resolution: " + resolution);
  }
}
