package com.mk.fx.qa.synthetic.execution.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.mk.fx.qa.synthetic.execution.model.ExecutionStatus;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ExecutionStatisticsTest {

  @Test
  void snapshot_listsEveryStatusInDeclarationOrder() {
    var statistics = new ExecutionStatistics();
    statistics.recordCheck(ExecutionStatus.TIMEOUT);
    statistics.recordCheck(ExecutionStatus.TIMEOUT);
    statistics.recordTraceCaptureFailure();
    statistics.recordWritten(3);
    statistics.recordWritten(0);

    var snapshot = statistics.snapshot();

    assertThat(snapshot.checksByStatus())
        .containsExactly(
            entry("success", 0L),
            entry("timeout", 2L),
            entry("error", 0L));
    assertThat(snapshot.traceCaptureFailures()).isEqualTo(1);
    assertThat(snapshot.recordsWritten()).isEqualTo(2);
    assertThat(snapshot.metricRowsWritten()).isEqualTo(3);
    assertThat(snapshot.persistenceFailures()).isZero();
  }

  @Test
  void counters_areSafeUnderConcurrentUpdates() throws Exception {
    var statistics = new ExecutionStatistics();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    for (int i = 0; i < 1000; i++) {
      pool.submit(() -> statistics.recordCheck(ExecutionStatus.SUCCESS));
    }
    pool.shutdown();

    assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    assertThat(statistics.checks(ExecutionStatus.SUCCESS)).isEqualTo(1000);
  }
}
