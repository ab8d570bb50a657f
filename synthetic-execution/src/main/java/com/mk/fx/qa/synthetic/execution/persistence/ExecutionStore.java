package com.mk.fx.qa.synthetic.execution.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.synthetic.execution.model.ExecutionRecord;
import com.mk.fx.qa.synthetic.execution.model.MetricRow;
import com.mk.fx.qa.synthetic.execution.model.NewExecutionRecord;
import java.util.List;

/**
 * Storage for execution records and their metric rows. Each call is atomic on its own; no call
 * spans more than one record.
 *
 * <p>All methods throw {@link PersistenceException} on failure.
 */
public interface ExecutionStore {

  /** Inserts one execution record and returns its generated id. */
  long insertExecutionRecord(NewExecutionRecord record);

  /** Inserts all rows for one record as a single batch, all or nothing. */
  void insertMetricRows(long recordId, List<MetricRow> rows);

  /** Stores the network trace on an existing record. */
  void attachTrace(long recordId, JsonNode trace);

  /** Returns the most recent records of a monitor, newest first. */
  List<ExecutionRecord> findRecentExecutions(long monitorId, int limit);
}
