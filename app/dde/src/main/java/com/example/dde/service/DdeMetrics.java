/*
 * どこで: DDE サービス層
 * 何を: DDE 操作のアプリ固有メトリクス記録を集約する
 * なぜ: 操作の成功率と不一致の発生/解決の傾向を運用で監視できるようにするため
 */
package com.example.dde.service;

import com.example.dde.api.DdeNotFoundException;
import com.example.dde.api.EntryAuthorizationDeniedException;
import com.example.dde.api.InvalidDdeTransitionException;
import com.example.dde.api.OpenDiscrepanciesRemainException;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DdeMetrics {

  static final String METRIC_COMMAND_TOTAL = "dde.command.total";
  static final String METRIC_DISCREPANCY_DETECTED = "dde.discrepancy.detected";
  static final String METRIC_RESOLUTION_TOTAL = "dde.resolution.total";

  static final String RESULT_SUCCESS = "success";
  static final String RESULT_NOT_FOUND = "not_found";
  static final String RESULT_INVALID_STATE = "invalid_state";
  static final String RESULT_DENIED = "denied";
  static final String RESULT_PRECONDITION_FAILED = "precondition_failed";
  static final String RESULT_BAD_REQUEST = "bad_request";
  static final String RESULT_ERROR = "error";
  static final String RESULT_ROLLED_BACK = "rolled_back";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> commandCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> resolutionCounters = new ConcurrentHashMap<>();
  private final Counter discrepancyDetected;

  public DdeMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.discrepancyDetected =
        Counter.builder(METRIC_DISCREPANCY_DETECTED)
            .description("Discrepancies opened by DDE comparison")
            .register(meterRegistry);
  }

  public void recordCommand(String action, String result) {
    final String key = action + ":" + result;
    commandCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_COMMAND_TOTAL)
                    .description("DDE command executions")
                    .tags(Tags.of("action", action, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  /**
   * 役割: 成功したコマンドを記録する。
   * 動作: トランザクション同期中はコミット後に success、ロールバック時は rolled_back として記録する。同期外では即時に success。
   */
  public void recordSuccess(String action) {
    onCompletion(
        committed -> recordCommand(action, committed ? RESULT_SUCCESS : RESULT_ROLLED_BACK));
  }

  public void recordFailure(String action, RuntimeException ex) {
    recordCommand(action, resultOf(ex));
  }

  // ロールバックされた比較の不一致は数えない
  public void recordDiscrepancyDetected() {
    onCompletion(
        committed -> {
          if (committed) {
            discrepancyDetected.increment();
          }
        });
  }

  public void recordResolution(String strategy) {
    onCompletion(
        committed -> {
          if (committed) {
            resolutionCounter(strategy).increment();
          }
        });
  }

  private Counter resolutionCounter(String strategy) {
    return resolutionCounters
        .computeIfAbsent(
            strategy,
            ignored ->
                Counter.builder(METRIC_RESOLUTION_TOTAL)
                    .description("DDE discrepancy resolutions")
                    .tags(Tags.of("strategy", strategy))
                    .register(meterRegistry));
  }

  private static void onCompletion(Consumer<Boolean> action) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      action.accept(true);
      return;
    }
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCompletion(int status) {
            action.accept(status == STATUS_COMMITTED);
          }
        });
  }

  static String resultOf(RuntimeException ex) {
    if (ex instanceof DdeNotFoundException) {
      return RESULT_NOT_FOUND;
    }
    if (ex instanceof EntryAuthorizationDeniedException) {
      return RESULT_DENIED;
    }
    if (ex instanceof OpenDiscrepanciesRemainException) {
      return RESULT_PRECONDITION_FAILED;
    }
    if (ex instanceof InvalidDdeTransitionException) {
      return RESULT_INVALID_STATE;
    }
    if (ex instanceof IllegalArgumentException) {
      return RESULT_BAD_REQUEST;
    }
    return RESULT_ERROR;
  }
}
