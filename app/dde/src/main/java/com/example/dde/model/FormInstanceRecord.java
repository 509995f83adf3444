/*
 * どこで: DDE ドメインモデル
 * 何を: form_instances のスナップショットを表す
 * なぜ: 状態遷移・権限判定・集計で同じ読込結果を共有するため
 */
package com.example.dde.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record FormInstanceRecord(
    long formInstanceId,
    long formId,
    String formName,
    long siteId,
    String subjectLabel,
    String eventName,
    CompletionStatus status,
    boolean doubleEntryRequired,
    String firstEntrantId,
    Instant firstEntryAt,
    String secondEntrantId,
    Instant secondEntryAt,
    Map<Long, String> secondEntryValues,
    Instant completedAt,
    long version) {

  public FormInstanceRecord {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったマップを防御的コピーして不変化する
    secondEntryValues =
        secondEntryValues == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(secondEntryValues));
  }

  public boolean hasSecondEntrant() {
    return secondEntrantId != null && !secondEntrantId.isBlank();
  }
}
