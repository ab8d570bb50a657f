package com.mk.fx.qa.synthetic.execution.scheduler;

import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.synthetic.execution.cfg.SchedulerCfg;
import com.mk.fx.qa.synthetic.execution.checker.MonitorChecker;
import com.mk.fx.qa.synthetic.execution.model.ExecutionOutcome;
import com.mk.fx.qa.synthetic.execution.model.LoopState;
import com.mk.fx.qa.synthetic.execution.model.Monitor;
import com.mk.fx.qa.synthetic.execution.model.SchedulerStatus;
import com.mk.fx.qa.synthetic.execution.persistence.ExecutionResultLogger;
import com.mk.fx.qa.synthetic.execution.persistence.PersistenceException;
import com.mk.fx.qa.synthetic.execution.registry.MonitorNotFoundException;
import com.mk.fx.qa.synthetic.execution.registry.MonitorRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives the periodic check loop and on-demand runs.
 *
 * <p>The loop runs on one daemon thread. Each tick snapshots the enabled monitors, checks and logs
 * them one at a time in snapshot order, then sleeps for the tick interval. A {@link
 * PersistenceException} only skips the affected monitor; any other failure ends the tick and the
 * loop retries after the recovery interval.
 *
 * <p>{@link #stop()} flips the state and wakes the sleep. A tick already in progress still checks
 * and logs every monitor of its snapshot; no new tick starts afterwards.
 *
 * <p>Thread-safety: {@link #start()} and {@link #stop()} may be called from any thread. {@link
 * #runNow(long)} runs on the caller's thread and may overlap with a tick.
 */
@Slf4j
@Service
public class MonitorScheduler {

  static final String LOOP_THREAD_NAME = "monitor-scheduler-loop";

  private final MonitorRegistry registry;
  private final MonitorChecker checker;
  private final ExecutionResultLogger resultLogger;
  private final SchedulerCfg schedulerCfg;
  private final Sleeper sleeper;
  private final Clock clock;

  private final AtomicReference<LoopState> state = new AtomicReference<>(LoopState.STOPPED);
  private final AtomicLong ticksCompleted = new AtomicLong();
  private final AtomicLong monitorsChecked = new AtomicLong();
  private volatile Instant lastTickStartedAt;
  private volatile Instant lastTickCompletedAt;
  private volatile String lastError;
  private volatile Thread loopThread;

  public MonitorScheduler(
      MonitorRegistry registry,
      MonitorChecker checker,
      ExecutionResultLogger resultLogger,
      SchedulerCfg schedulerCfg,
      Sleeper sleeper,
      Clock clock) {
    this.registry = registry;
    this.checker = checker;
    this.resultLogger = resultLogger;
    this.schedulerCfg = schedulerCfg;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  /**
   * Starts the loop on a new daemon thread.
   *
   * @return false if the loop is already running or a previous loop thread is still draining
   */
  public synchronized boolean start() {
    var previous = loopThread;
    if (previous != null && previous.isAlive()) {
      log.warn(
          "Scheduler start rejected: loop thread still {}",
          state.get() == LoopState.RUNNING ? "running" : "draining");
      return false;
    }
    if (!state.compareAndSet(LoopState.STOPPED, LoopState.RUNNING)) {
      log.warn("Scheduler start rejected: state is {}", state.get());
      return false;
    }

    // a stop that arrived outside a sleep must not shorten the new loop's first interval
    sleeper.reset();
    var thread = new Thread(this::runLoop, LOOP_THREAD_NAME);
    thread.setDaemon(true);
    loopThread = thread;
    thread.start();
    log.info(
        "Scheduler started (tickInterval={} recoveryInterval={})",
        schedulerCfg.getTickInterval(),
        schedulerCfg.getRecoveryInterval());
    return true;
  }

  /**
   * Requests a graceful stop. Returns immediately; the current tick, if any, drains on the loop
   * thread.
   *
   * @return false if the loop was not running
   */
  public boolean stop() {
    if (!state.compareAndSet(LoopState.RUNNING, LoopState.STOPPED)) {
      log.debug("Scheduler stop ignored: not running");
      return false;
    }
    sleeper.wake();
    log.info("Scheduler stop requested");
    return true;
  }

  /**
   * Waits for the loop thread to exit.
   *
   * @return true if no loop thread is alive when this returns
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    var thread = loopThread;
    if (thread == null) {
      return true;
    }
    thread.join(Math.max(1, timeout.toMillis()));
    return !thread.isAlive();
  }

  @PreDestroy
  void shutdown() {
    stop();
    try {
      if (!awaitTermination(schedulerCfg.getShutdownTimeout())) {
        log.warn(
            "Scheduler loop still draining after {}, leaving it to exit on its own",
            schedulerCfg.getShutdownTimeout());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the scheduler loop to drain");
    }
  }

  /**
   * Checks one monitor immediately and logs the result, independent of the loop.
   *
   * @throws MonitorNotFoundException if the registry has no such monitor; nothing is checked or
   *     persisted in that case
   * @throws PersistenceException if the result could not be written
   */
  public ExecutionOutcome runNow(long monitorId) {
    Monitor monitor =
        registry.getMonitor(monitorId).orElseThrow(() -> new MonitorNotFoundException(monitorId));
    log.info("On-demand run of monitor {} ({})", monitor.id(), monitor.name());
    var result = checker.execute(monitor.id(), monitor.url(), monitor.timeoutSeconds());
    long recordId = resultLogger.log(monitor.id(), result);
    return new ExecutionOutcome(recordId, monitor.id(), result);
  }

  public SchedulerStatus status() {
    var thread = loopThread;
    return new SchedulerStatus(
        state.get(),
        thread != null && thread.isAlive(),
        ticksCompleted.get(),
        monitorsChecked.get(),
        lastTickStartedAt,
        lastTickCompletedAt,
        lastError);
  }

  private void runLoop() {
    log.info("Scheduler loop running on {}", Thread.currentThread().getName());
    try {
      while (state.get() == LoopState.RUNNING) {
        Duration pause;
        try {
          runTick();
          pause = schedulerCfg.getTickInterval();
        } catch (RuntimeException e) {
          lastError = e.getMessage();
          log.error(
              "Scheduler tick failed, retrying in {}: {}",
              schedulerCfg.getRecoveryInterval(),
              e.getMessage(),
              e);
          pause = schedulerCfg.getRecoveryInterval();
        }

        if (state.get() != LoopState.RUNNING) {
          break;
        }
        sleeper.sleep(pause);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      state.set(LoopState.STOPPED);
      log.warn("Scheduler loop interrupted");
    }
    log.info("Scheduler loop stopped after {} ticks", ticksCompleted.get());
  }

  /** One pass over a snapshot of the enabled monitors. */
  @VisibleForTesting
  void runTick() {
    lastTickStartedAt = clock.instant();
    List<Monitor> snapshot = List.copyOf(registry.listEnabledMonitors());
    log.debug("Tick started with {} monitors", snapshot.size());

    int persistenceFailures = 0;
    for (Monitor monitor : snapshot) {
      var result = checker.execute(monitor.id(), monitor.url(), monitor.timeoutSeconds());
      monitorsChecked.incrementAndGet();
      try {
        resultLogger.log(monitor.id(), result);
      } catch (PersistenceException e) {
        persistenceFailures++;
        lastError = e.getMessage();
        log.error(
            "Failed to log result of monitor {} ({}): {}",
            monitor.id(),
            monitor.name(),
            e.getMessage(),
            e);
      }
    }

    lastTickCompletedAt = clock.instant();
    ticksCompleted.incrementAndGet();
    log.info(
        "Tick completed: {} monitors checked, {} persistence failures",
        snapshot.size(),
        persistenceFailures);
  }
}
