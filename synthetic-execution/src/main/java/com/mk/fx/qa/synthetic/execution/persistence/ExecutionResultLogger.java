package com.mk.fx.qa.synthetic.execution.persistence;

import com.mk.fx.qa.synthetic.execution.metrics.ExecutionStatistics;
import com.mk.fx.qa.synthetic.execution.model.ExecutionResult;
import com.mk.fx.qa.synthetic.execution.model.MetricName;
import com.mk.fx.qa.synthetic.execution.model.MetricRow;
import com.mk.fx.qa.synthetic.execution.model.NewExecutionRecord;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Persists one {@link ExecutionResult} as an execution record, its metric rows and its trace.
 *
 * <p>Metric rows are written only for successful results that carry a TTFB value, and then all
 * three rows are written with null for any missing timing. A successful result without TTFB gets
 * no metric rows even when the other timings were measured. Existing dashboards query the tables
 * with this behaviour in place.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionResultLogger {

  private final ExecutionStore store;
  private final ExecutionStatistics statistics;
  private final Clock clock;

  /**
   * Writes the result.
   *
   * @return id of the inserted execution record
   * @throws PersistenceException if any write fails; earlier writes of the same call are kept
   */
  public long log(long monitorId, ExecutionResult result) {
    try {
      long recordId = store.insertExecutionRecord(NewExecutionRecord.of(monitorId, result));

      int metricRows = 0;
      if (result.isSuccess() && result.ttfbMs() != null) {
        var rows = metricRows(recordId, result);
        store.insertMetricRows(recordId, rows);
        metricRows = rows.size();
      } else if (result.isSuccess() && !result.metrics().isEmpty()) {
        log.info(
            "Monitor {} record {} has no TTFB, metric rows not written (dcl={} load={})",
            monitorId,
            recordId,
            result.domContentLoadedMs(),
            result.pageLoadMs());
      }

      if (result.hasTrace()) {
        store.attachTrace(recordId, result.trace());
      }

      statistics.recordWritten(metricRows);
      log.debug(
          "Logged execution {} for monitor {} (status={} metricRows={} trace={})",
          recordId,
          monitorId,
          result.status().value(),
          metricRows,
          result.hasTrace());
      return recordId;
    } catch (PersistenceException e) {
      statistics.recordPersistenceFailure();
      throw e;
    }
  }

  private List<MetricRow> metricRows(long recordId, ExecutionResult result) {
    var recordedAt = clock.instant();
    return List.of(
        new MetricRow(recordId, MetricName.TTFB_MS, result.ttfbMs(), recordedAt),
        new MetricRow(
            recordId, MetricName.DOM_CONTENT_LOADED_MS, result.domContentLoadedMs(), recordedAt),
        new MetricRow(recordId, MetricName.PAGE_LOAD_MS, result.pageLoadMs(), recordedAt));
  }
}
