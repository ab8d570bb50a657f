package com.mk.fx.qa.synthetic.execution.metrics;

import com.mk.fx.qa.synthetic.execution.dto.ExecutionMetricsResponse;
import com.mk.fx.qa.synthetic.execution.model.ExecutionStatus;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * In-memory counters for checks, trace capture and persistence. Safe for concurrent use by the
 * scheduler loop and on-demand runs.
 */
@Component
public class ExecutionStatistics {

  private final Map<ExecutionStatus, AtomicLong> checksByStatus;
  private final AtomicLong traceCaptureFailures = new AtomicLong();
  private final AtomicLong persistenceFailures = new AtomicLong();
  private final AtomicLong recordsWritten = new AtomicLong();
  private final AtomicLong metricRowsWritten = new AtomicLong();

  public ExecutionStatistics() {
    Map<ExecutionStatus, AtomicLong> map = new EnumMap<>(ExecutionStatus.class);
    for (ExecutionStatus status : ExecutionStatus.values()) {
      map.put(status, new AtomicLong());
    }
    this.checksByStatus = map;
  }

  public void recordCheck(ExecutionStatus status) {
    checksByStatus.get(status).incrementAndGet();
  }

  public void recordTraceCaptureFailure() {
    traceCaptureFailures.incrementAndGet();
  }

  public void recordPersistenceFailure() {
    persistenceFailures.incrementAndGet();
  }

  public void recordWritten(int metricRows) {
    recordsWritten.incrementAndGet();
    metricRowsWritten.addAndGet(metricRows);
  }

  public long traceCaptureFailures() {
    return traceCaptureFailures.get();
  }

  public long persistenceFailures() {
    return persistenceFailures.get();
  }

  public long checks(ExecutionStatus status) {
    return checksByStatus.get(status).get();
  }

  public ExecutionMetricsResponse snapshot() {
    Map<String, Long> byStatus = new LinkedHashMap<>();
    checksByStatus.forEach((status, count) -> byStatus.put(status.value(), count.get()));
    return new ExecutionMetricsResponse(
        Collections.unmodifiableMap(byStatus),
        traceCaptureFailures.get(),
        persistenceFailures.get(),
        recordsWritten.get(),
        metricRowsWritten.get());
  }
}
