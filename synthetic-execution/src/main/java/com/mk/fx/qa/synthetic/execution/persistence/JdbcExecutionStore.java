package com.mk.fx.qa.synthetic.execution.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.synthetic.execution.model.ExecutionRecord;
import com.mk.fx.qa.synthetic.execution.model.ExecutionStatus;
import com.mk.fx.qa.synthetic.execution.model.MetricRow;
import com.mk.fx.qa.synthetic.execution.model.NewExecutionRecord;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link ExecutionStore} over the {@code execution_logs} and {@code performance_metrics} tables.
 *
 * <p>The trace is written as JSON text; on PostgreSQL the connection must use {@code
 * stringtype=unspecified} so the server casts it into the {@code jsonb} column.
 */
@Slf4j
@Repository
public class JdbcExecutionStore implements ExecutionStore {

  static final String INSERT_RECORD =
      "INSERT INTO execution_logs (monitor_id, started_at, completed_at, status, error_message)"
          + " VALUES (?, ?, ?, ?, ?)";

  static final String INSERT_METRIC =
      "INSERT INTO performance_metrics (execution_log_id, metric_name, metric_value, recorded_at)"
          + " VALUES (?, ?, ?, ?)";

  static final String ATTACH_TRACE = "UPDATE execution_logs SET har_data = ? WHERE id = ?";

  static final String RECENT_EXECUTIONS =
      "SELECT el.id, el.monitor_id, el.started_at, el.completed_at, el.status, el.error_message,"
          + " el.har_data,"
          + " (SELECT MAX(pm.metric_value) FROM performance_metrics pm"
          + "   WHERE pm.execution_log_id = el.id AND pm.metric_name = 'ttfb_ms') AS ttfb_ms,"
          + " (SELECT MAX(pm.metric_value) FROM performance_metrics pm"
          + "   WHERE pm.execution_log_id = el.id AND pm.metric_name = 'dom_content_loaded_ms')"
          + "   AS dom_content_loaded_ms,"
          + " (SELECT MAX(pm.metric_value) FROM performance_metrics pm"
          + "   WHERE pm.execution_log_id = el.id AND pm.metric_name = 'page_load_time_ms')"
          + "   AS page_load_time_ms"
          + " FROM execution_logs el"
          + " WHERE el.monitor_id = ?"
          + " ORDER BY el.started_at DESC, el.id DESC"
          + " LIMIT ?";

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final ObjectMapper objectMapper;

  public JdbcExecutionStore(
      JdbcTemplate jdbcTemplate,
      PlatformTransactionManager transactionManager,
      ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    this.objectMapper = objectMapper;
  }

  @Override
  public long insertExecutionRecord(NewExecutionRecord record) {
    var keyHolder = new GeneratedKeyHolder();
    try {
      jdbcTemplate.update(
          connection -> {
            PreparedStatement ps = connection.prepareStatement(INSERT_RECORD, new String[] {"id"});
            ps.setLong(1, record.monitorId());
            ps.setTimestamp(2, Timestamp.from(record.startedAt()));
            ps.setTimestamp(3, Timestamp.from(record.completedAt()));
            ps.setString(4, record.status().value());
            ps.setString(5, record.errorMessage());
            return ps;
          },
          keyHolder);
    } catch (DataAccessException e) {
      throw new PersistenceException(
          "Failed to insert execution record for monitor " + record.monitorId() + ": "
              + e.getMessage(),
          e);
    }

    Number key = keyHolder.getKey();
    if (key == null) {
      throw new PersistenceException(
          "No id generated for execution record of monitor " + record.monitorId());
    }
    return key.longValue();
  }

  @Override
  public void insertMetricRows(long recordId, List<MetricRow> rows) {
    if (rows.isEmpty()) {
      return;
    }
    try {
      transactionTemplate.executeWithoutResult(
          status ->
              jdbcTemplate.batchUpdate(
                  INSERT_METRIC,
                  rows,
                  rows.size(),
                  (ps, row) -> {
                    ps.setLong(1, recordId);
                    ps.setString(2, row.metricName().columnValue());
                    if (row.metricValue() != null) {
                      ps.setDouble(3, row.metricValue());
                    } else {
                      ps.setNull(3, Types.DOUBLE);
                    }
                    ps.setTimestamp(4, Timestamp.from(row.recordedAt()));
                  }));
    } catch (DataAccessException e) {
      throw new PersistenceException(
          "Failed to insert metric rows for execution " + recordId + ": " + e.getMessage(), e);
    }
  }

  @Override
  public void attachTrace(long recordId, JsonNode trace) {
    String json;
    try {
      json = objectMapper.writeValueAsString(trace);
    } catch (JsonProcessingException e) {
      throw new PersistenceException(
          "Failed to serialise trace for execution " + recordId + ": " + e.getMessage(), e);
    }

    int updated;
    try {
      updated = jdbcTemplate.update(ATTACH_TRACE, json, recordId);
    } catch (DataAccessException e) {
      throw new PersistenceException(
          "Failed to attach trace to execution " + recordId + ": " + e.getMessage(), e);
    }
    if (updated != 1) {
      throw new PersistenceException("Execution record " + recordId + " not found for trace");
    }
    log.debug("Attached trace of {} chars to execution {}", json.length(), recordId);
  }

  @Override
  public List<ExecutionRecord> findRecentExecutions(long monitorId, int limit) {
    try {
      return jdbcTemplate.query(
          RECENT_EXECUTIONS, (rs, rowNum) -> mapRecord(rs), monitorId, limit);
    } catch (DataAccessException e) {
      throw new PersistenceException(
          "Failed to load executions of monitor " + monitorId + ": " + e.getMessage(), e);
    }
  }

  private ExecutionRecord mapRecord(ResultSet rs) throws SQLException {
    return new ExecutionRecord(
        rs.getLong("id"),
        rs.getLong("monitor_id"),
        instant(rs.getTimestamp("started_at")),
        instant(rs.getTimestamp("completed_at")),
        ExecutionStatus.fromValue(rs.getString("status")),
        rs.getString("error_message"),
        nullableDouble(rs, "ttfb_ms"),
        nullableDouble(rs, "dom_content_loaded_ms"),
        nullableDouble(rs, "page_load_time_ms"),
        trace(rs.getLong("id"), rs.getString("har_data")));
  }

  private JsonNode trace(long recordId, String json) {
    if (json == null) {
      return null;
    }
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new PersistenceException(
          "Stored trace of execution " + recordId + " is not valid JSON: " + e.getMessage(), e);
    }
  }

  private static Instant instant(Timestamp timestamp) {
    return timestamp != null ? timestamp.toInstant() : null;
  }

  private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }
}
