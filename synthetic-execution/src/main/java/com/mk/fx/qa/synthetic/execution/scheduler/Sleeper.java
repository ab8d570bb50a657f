package com.mk.fx.qa.synthetic.execution.scheduler;

import java.time.Duration;

/** Pause abstraction for the scheduler loop, replaced by a recording fake in tests. */
public interface Sleeper {

  /**
   * Blocks for up to {@code duration}. May return early after {@link #wake()}.
   *
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  void sleep(Duration duration) throws InterruptedException;

  /** Ends the current sleep early, or the next one if nobody is sleeping. */
  default void wake() {}

  /** Drops a wake that no sleep has consumed yet. */
  default void reset() {}
}
