package com.mk.fx.qa.synthetic.execution.checker;

import com.mk.fx.qa.synthetic.execution.model.ExecutionResult;

public interface MonitorChecker {

  /**
   * Runs one check against {@code url}. Never throws: timeouts and failures are encoded in the
   * returned status.
   */
  ExecutionResult execute(long monitorId, String url, int timeoutSeconds);
}
