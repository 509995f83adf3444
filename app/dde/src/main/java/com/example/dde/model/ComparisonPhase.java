package com.example.dde.model;

/** 比較の進捗。CompletionStatus と未解決件数から導出する。 */
public enum ComparisonPhase {
  PENDING,
  MATCHED,
  DISCREPANCIES,
  RESOLVED
}
