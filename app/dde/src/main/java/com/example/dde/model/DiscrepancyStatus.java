/*
 * どこで: DDE ドメインモデル
 * 何を: 不一致レコードの解決状態を定義する
 * なぜ: OPEN から RESOLVED への一方向遷移を型で表すため
 */
package com.example.dde.model;

// DB の CHECK 制約と値を一致させる。
public enum DiscrepancyStatus {
  OPEN,
  RESOLVED
}
