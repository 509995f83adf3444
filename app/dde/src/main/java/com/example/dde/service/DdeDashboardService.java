/*
 * どこで: DDE サービス層
 * 何を: 2 回目入力待ち・解決待ちの作業キューと状態別件数を集計する
 * なぜ: 施設単位で DDE の滞留状況を把握できるようにするため
 */
package com.example.dde.service;

import com.example.dde.api.response.DashboardResponse;
import com.example.dde.api.response.DashboardStats;
import com.example.dde.api.response.FormInstanceSummary;
import com.example.dde.config.DdeDashboardProperties;
import com.example.dde.model.CompletionStatus;
import com.example.dde.model.FormInstanceRecord;
import com.example.dde.model.PendingFormInstance;
import com.example.dde.repository.FormInstanceRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DdeDashboardService {

  private final FormInstanceRepository formInstanceRepository;
  private final DdeDashboardProperties properties;
  private final Clock clock;

  @Transactional(readOnly = true)
  public DashboardResponse overview(Long siteId) {
    return new DashboardResponse(pendingSecondEntry(siteId), pendingResolution(siteId), stats(siteId));
  }

  /** 1 回目入力の完了が古い順。待機時間は 1 回目完了からの経過。 */
  public List<FormInstanceSummary> pendingSecondEntry(Long siteId) {
    return summarize(
        formInstanceRepository.findPendingSecondEntry(siteId, properties.pageSize()),
        FormInstanceRecord::firstEntryAt);
  }

  /** 2 回目入力が古い順。待機時間は 2 回目入力からの経過。 */
  public List<FormInstanceSummary> pendingResolution(Long siteId) {
    return summarize(
        formInstanceRepository.findPendingResolution(siteId, properties.pageSize()),
        FormInstanceRecord::secondEntryAt);
  }

  public DashboardStats stats(Long siteId) {
    final Map<CompletionStatus, Long> byStatus = formInstanceRepository.countByStatus(siteId);
    final long pending = byStatus.getOrDefault(CompletionStatus.FIRST_ENTRY_COMPLETE, 0L);
    final long awaiting = byStatus.getOrDefault(CompletionStatus.SECOND_ENTRY_IN_PROGRESS, 0L);
    final long reconciled = byStatus.getOrDefault(CompletionStatus.RECONCILED, 0L);
    return new DashboardStats(pending + awaiting + reconciled, pending, awaiting, reconciled, byStatus);
  }

  private List<FormInstanceSummary> summarize(
      List<PendingFormInstance> pending, Function<FormInstanceRecord, Instant> waitingSince) {
    final Instant now = Instant.now(clock);
    return pending.stream()
        .map(item -> toSummary(item, waitingTime(waitingSince.apply(item.instance()), now)))
        .toList();
  }

  private static Duration waitingTime(Instant since, Instant now) {
    if (since == null || now.isBefore(since)) {
      return Duration.ZERO;
    }
    return Duration.between(since, now);
  }

  private static FormInstanceSummary toSummary(PendingFormInstance item, Duration waiting) {
    final FormInstanceRecord instance = item.instance();
    return new FormInstanceSummary(
        instance.formInstanceId(),
        instance.subjectLabel(),
        instance.siteId(),
        instance.formName(),
        instance.eventName(),
        instance.status(),
        instance.firstEntrantId(),
        instance.firstEntryAt(),
        instance.secondEntrantId(),
        instance.secondEntryAt(),
        item.openDiscrepancies(),
        waiting.toSeconds(),
        waiting.toDays());
  }
}
