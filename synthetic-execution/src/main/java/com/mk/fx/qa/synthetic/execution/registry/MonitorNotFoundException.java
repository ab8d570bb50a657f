package com.mk.fx.qa.synthetic.execution.registry;

public class MonitorNotFoundException extends RuntimeException {

  private final long monitorId;

  public MonitorNotFoundException(long monitorId) {
    super("Monitor " + monitorId + " not found");
    this.monitorId = monitorId;
  }

  public long getMonitorId() {
    return monitorId;
  }
}
