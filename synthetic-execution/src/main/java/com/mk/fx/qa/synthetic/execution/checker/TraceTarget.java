package com.mk.fx.qa.synthetic.execution.checker;

import java.nio.file.Path;

/**
 * The HAR file reserved for exactly one check. Closing the target deletes the file, so a trace
 * never outlives the check that recorded it.
 */
public final class TraceTarget implements AutoCloseable {

  private final long monitorId;
  private final Path path;
  private final TraceCapturer owner;
  private boolean consumed;
  private boolean closed;

  TraceTarget(long monitorId, Path path, TraceCapturer owner) {
    this.monitorId = monitorId;
    this.path = path;
    this.owner = owner;
  }

  public long monitorId() {
    return monitorId;
  }

  /** File to record into, or null when no trace is captured for this check. */
  public Path path() {
    return path;
  }

  public boolean isEnabled() {
    return path != null;
  }

  boolean isConsumed() {
    return consumed;
  }

  void markConsumed() {
    consumed = true;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    owner.release(this);
  }
}
