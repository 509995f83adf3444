/*
 * どこで: DDE メトリクステスト
 * 何を: command/discrepancy/resolution 系メトリクスが記録されることを検証する
 * なぜ: 運用指標の計測回帰を防ぐため
 */
package com.example.dde.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dde.api.EntryAuthorizationDeniedException;
import com.example.dde.api.InvalidDdeTransitionException;
import com.example.dde.api.OpenDiscrepanciesRemainException;
import com.example.dde.model.DenialReason;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

class DdeMetricsTest {

  @Test
  void recordsCommandDiscrepancyAndResolutionMetrics() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final DdeMetrics metrics = new DdeMetrics(registry);

    metrics.recordCommand("FINALIZE", "success");
    metrics.recordCommand("FINALIZE", "success");
    metrics.recordDiscrepancyDetected();
    metrics.recordResolution("second_correct");

    assertThat(
            registry
                .get("dde.command.total")
                .tag("action", "FINALIZE")
                .tag("result", "success")
                .counter()
                .count())
        .isEqualTo(2.0d);
    assertThat(registry.get("dde.discrepancy.detected").counter().count()).isEqualTo(1.0d);
    assertThat(
            registry.get("dde.resolution.total").tag("strategy", "second_correct").counter().count())
        .isEqualTo(1.0d);
  }

  @Test
  void transactionalSuccessIsCountedOnlyAfterCommit() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final DdeMetrics metrics = new DdeMetrics(registry);

    TransactionSynchronizationManager.initSynchronization();
    try {
      metrics.recordSuccess("COMPARE");
      metrics.recordDiscrepancyDetected();
      assertThat(registry.find("dde.command.total").counter()).isNull();
      assertThat(registry.get("dde.discrepancy.detected").counter().count()).isZero();

      complete(TransactionSynchronization.STATUS_COMMITTED);
    } finally {
      TransactionSynchronizationManager.clearSynchronization();
    }

    assertThat(
            registry.get("dde.command.total").tag("result", "success").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("dde.discrepancy.detected").counter().count()).isEqualTo(1.0d);
  }

  @Test
  void rolledBackTransactionIsNotCountedAsSuccess() {
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final DdeMetrics metrics = new DdeMetrics(registry);

    TransactionSynchronizationManager.initSynchronization();
    try {
      metrics.recordSuccess("RESOLVE");
      metrics.recordDiscrepancyDetected();
      metrics.recordResolution("new_value");

      complete(TransactionSynchronization.STATUS_ROLLED_BACK);
    } finally {
      TransactionSynchronizationManager.clearSynchronization();
    }

    assertThat(registry.find("dde.command.total").tag("result", "success").counter()).isNull();
    assertThat(
            registry.get("dde.command.total").tag("result", "rolled_back").counter().count())
        .isEqualTo(1.0d);
    assertThat(registry.get("dde.discrepancy.detected").counter().count()).isZero();
    assertThat(registry.find("dde.resolution.total").counter()).isNull();
  }

  @Test
  void classifiesFailures() {
    assertThat(DdeMetrics.resultOf(new OpenDiscrepanciesRemainException(1)))
        .isEqualTo("precondition_failed");
    assertThat(DdeMetrics.resultOf(new InvalidDdeTransitionException("x")))
        .isEqualTo("invalid_state");
    assertThat(
            DdeMetrics.resultOf(
                new EntryAuthorizationDeniedException(DenialReason.SAME_ENTRANT, "x")))
        .isEqualTo("denied");
    assertThat(DdeMetrics.resultOf(new IllegalArgumentException("x"))).isEqualTo("bad_request");
    assertThat(DdeMetrics.resultOf(new IllegalStateException("x"))).isEqualTo("error");
  }

  private static void complete(int status) {
    for (TransactionSynchronization synchronization :
        TransactionSynchronizationManager.getSynchronizations()) {
      synchronization.afterCompletion(status);
    }
  }
}
