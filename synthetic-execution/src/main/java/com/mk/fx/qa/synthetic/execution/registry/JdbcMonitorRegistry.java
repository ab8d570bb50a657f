package com.mk.fx.qa.synthetic.execution.registry;

import com.mk.fx.qa.synthetic.execution.model.Monitor;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Reads monitors from the {@code monitors} table. Data access failures propagate as Spring's
 * {@code DataAccessException}; the scheduler treats them as a failed tick.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcMonitorRegistry implements MonitorRegistry {

  static final String ENABLED_MONITORS =
      "SELECT id, name, url, timeout_seconds, enabled FROM monitors WHERE enabled = TRUE ORDER BY id";

  static final String MONITOR_BY_ID =
      "SELECT id, name, url, timeout_seconds, enabled FROM monitors WHERE id = ?";

  private final JdbcTemplate jdbcTemplate;

  @Override
  public List<Monitor> listEnabledMonitors() {
    var monitors = jdbcTemplate.query(ENABLED_MONITORS, (rs, rowNum) -> map(rs));
    log.debug("Loaded {} enabled monitors", monitors.size());
    return monitors;
  }

  @Override
  public Optional<Monitor> getMonitor(long monitorId) {
    return jdbcTemplate.query(MONITOR_BY_ID, (rs, rowNum) -> map(rs), monitorId).stream()
        .findFirst();
  }

  private static Monitor map(ResultSet rs) throws SQLException {
    return new Monitor(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("url"),
        rs.getInt("timeout_seconds"),
        rs.getBoolean("enabled"));
  }
}
