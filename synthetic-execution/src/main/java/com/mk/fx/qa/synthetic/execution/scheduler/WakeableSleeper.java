package com.mk.fx.qa.synthetic.execution.scheduler;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Timed wait on a private monitor. A {@link #wake()} with nobody sleeping is remembered and ends
 * the next sleep immediately, so a stop issued just before the loop goes to sleep is not lost.
 * {@link #reset()} discards a wake left over from a loop that exited without sleeping again.
 */
public class WakeableSleeper implements Sleeper {

  private final Object lock = new Object();
  private boolean wakeRequested;

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    long remaining = duration.toNanos();
    long deadline = System.nanoTime() + remaining;
    synchronized (lock) {
      while (!wakeRequested && remaining > 0) {
        TimeUnit.NANOSECONDS.timedWait(lock, remaining);
        remaining = deadline - System.nanoTime();
      }
      wakeRequested = false;
    }
  }

  @Override
  public void wake() {
    synchronized (lock) {
      wakeRequested = true;
      lock.notifyAll();
    }
  }

  @Override
  public void reset() {
    synchronized (lock) {
      wakeRequested = false;
    }
  }
}
