package com.mk.fx.qa.synthetic.execution.checker;

/** Phases a single check moves through; used for logging and failure messages. */
public enum CheckPhase {
  INIT,
  SESSION_ACQUIRED,
  NAVIGATING,
  LOADED,
  NAV_TIMEOUT,
  NAV_ERROR,
  TRACE_FINALIZED,
  RELEASED
}
