package com.example.dde.model;

/** 1 回目/2 回目それぞれの入力の進捗。CompletionStatus から導出する。 */
public enum EntryPhase {
  PENDING,
  IN_PROGRESS,
  COMPLETE
}
