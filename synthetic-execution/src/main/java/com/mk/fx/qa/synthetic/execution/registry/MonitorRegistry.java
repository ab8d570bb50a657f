package com.mk.fx.qa.synthetic.execution.registry;

import com.mk.fx.qa.synthetic.execution.model.Monitor;
import java.util.List;
import java.util.Optional;

/** Read-only view of the monitor definitions. */
public interface MonitorRegistry {

  /** Enabled monitors, ordered by id. */
  List<Monitor> listEnabledMonitors();

  /** Looks up a monitor regardless of its enabled flag. */
  Optional<Monitor> getMonitor(long monitorId);
}
