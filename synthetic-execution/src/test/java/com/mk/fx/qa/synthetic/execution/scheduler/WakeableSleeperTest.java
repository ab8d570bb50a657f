package com.mk.fx.qa.synthetic.execution.scheduler;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class WakeableSleeperTest {

  @Test
  void sleep_waitsForTheFullDuration() throws Exception {
    var sleeper = new WakeableSleeper();
    long start = System.nanoTime();

    sleeper.sleep(Duration.ofMillis(100));

    assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(90));
  }

  @Test
  void wake_endsSleepEarly() {
    var sleeper = new WakeableSleeper();
    var sleeping =
        CompletableFuture.runAsync(
            () -> {
              try {
                sleeper.sleep(Duration.ofMinutes(5));
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
              }
            });

    await()
        .atMost(5, TimeUnit.SECONDS)
        .pollInterval(Duration.ofMillis(20))
        .until(
            () -> {
              sleeper.wake();
              return sleeping.isDone();
            });
    assertFalse(sleeping.isCompletedExceptionally());
  }

  @Test
  void wake_beforeSleepIsRememberedOnce() throws Exception {
    var sleeper = new WakeableSleeper();
    sleeper.wake();

    long start = System.nanoTime();
    sleeper.sleep(Duration.ofMinutes(5));
    assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));

    start = System.nanoTime();
    sleeper.sleep(Duration.ofMillis(50));
    assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(40));
  }

  @Test
  void reset_discardsPendingWake() throws Exception {
    var sleeper = new WakeableSleeper();
    sleeper.wake();
    sleeper.reset();

    long start = System.nanoTime();
    sleeper.sleep(Duration.ofMillis(100));
    assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(90));
  }
}
