/*
 * どこで: DDE API
 * 何を: ダッシュボード一覧の要素を表す
 * なぜ: 待機時間を含めた作業キューの表示に必要な値だけを返すため
 */
package com.example.dde.api.response;

import com.example.dde.model.CompletionStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record FormInstanceSummary(
    long formInstanceId,
    String subjectLabel,
    long siteId,
    String formName,
    String eventName,
    CompletionStatus status,
    String firstEntrantId,
    Instant firstEntryAt,
    String secondEntrantId,
    Instant secondEntryAt,
    int openDiscrepancies,
    long waitingSeconds,
    long daysWaiting) {}
