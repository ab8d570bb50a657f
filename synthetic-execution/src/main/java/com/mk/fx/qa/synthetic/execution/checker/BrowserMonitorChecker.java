package com.mk.fx.qa.synthetic.execution.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.mk.fx.qa.synthetic.execution.browser.BrowserException;
import com.mk.fx.qa.synthetic.execution.browser.BrowserSession;
import com.mk.fx.qa.synthetic.execution.browser.BrowserSessionFactory;
import com.mk.fx.qa.synthetic.execution.browser.NavigationTimeoutException;
import com.mk.fx.qa.synthetic.execution.browser.SessionOptions;
import com.mk.fx.qa.synthetic.execution.cfg.BrowserCfg;
import com.mk.fx.qa.synthetic.execution.metrics.ExecutionStatistics;
import com.mk.fx.qa.synthetic.execution.model.ExecutionResult;
import java.time.Clock;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Runs a single browser check.
 *
 * <p>Lifecycle per check: {@code INIT → SESSION_ACQUIRED → NAVIGATING → LOADED | NAV_TIMEOUT |
 * NAV_ERROR → TRACE_FINALIZED → RELEASED}. The trace target and the browser session are both held
 * in try-with-resources, so they are released on every exit path. The HAR is flushed and read back
 * while the session is still held.
 *
 * <p>Thread-safety: stateless apart from its collaborators; concurrent checks each open their own
 * session.
 */
@Slf4j
@Component
public class BrowserMonitorChecker implements MonitorChecker {

  static final String TIMEOUT_MESSAGE_PREFIX = "Page load timeout: ";

  private final BrowserSessionFactory sessionFactory;
  private final PageMetricsExtractor metricsExtractor;
  private final TraceCapturer traceCapturer;
  private final BrowserCfg browserCfg;
  private final ExecutionStatistics statistics;
  private final Clock clock;

  public BrowserMonitorChecker(
      BrowserSessionFactory sessionFactory,
      PageMetricsExtractor metricsExtractor,
      TraceCapturer traceCapturer,
      BrowserCfg browserCfg,
      ExecutionStatistics statistics,
      Clock clock) {
    this.sessionFactory = sessionFactory;
    this.metricsExtractor = metricsExtractor;
    this.traceCapturer = traceCapturer;
    this.browserCfg = browserCfg;
    this.statistics = statistics;
    this.clock = clock;
  }

  @Override
  public ExecutionResult execute(long monitorId, String url, int timeoutSeconds) {
    var startedAt = clock.instant();
    var phase = CheckPhase.INIT;
    ExecutionResult result;
    try {
      var timeout = Duration.ofSeconds(timeoutSeconds);
      try (TraceTarget trace = traceCapturer.allocate(monitorId);
          BrowserSession session = sessionFactory.open(sessionOptions(trace, timeout))) {
        phase = enter(monitorId, CheckPhase.SESSION_ACQUIRED);

        phase = enter(monitorId, CheckPhase.NAVIGATING);
        try {
          var response = session.navigate(url, timeout);
          phase = enter(monitorId, CheckPhase.LOADED);
          var metrics = metricsExtractor.extract(session, response);
          result = ExecutionResult.success(metrics, startedAt, clock.instant());
        } catch (NavigationTimeoutException e) {
          phase = enter(monitorId, CheckPhase.NAV_TIMEOUT);
          log.warn("Monitor {} timeout after {}s: {}", monitorId, timeoutSeconds, e.getMessage());
          result =
              ExecutionResult.timeout(
                  TIMEOUT_MESSAGE_PREFIX + describe(e), startedAt, clock.instant());
        }

        result = result.withTrace(finalizeTrace(monitorId, session, trace));
        phase = enter(monitorId, CheckPhase.TRACE_FINALIZED);
      }
      enter(monitorId, CheckPhase.RELEASED);
    } catch (RuntimeException e) {
      var failedIn = phase;
      enter(monitorId, CheckPhase.NAV_ERROR);
      log.error("Monitor {} execution failed in {}: {}", monitorId, failedIn, e.getMessage(), e);
      result = ExecutionResult.error(describe(e), startedAt, clock.instant());
    }

    statistics.recordCheck(result.status());
    log.info(
        "Monitor {} finished with status {} (ttfb={} dcl={} load={} trace={})",
        monitorId,
        result.status().value(),
        result.ttfbMs(),
        result.domContentLoadedMs(),
        result.pageLoadMs(),
        result.hasTrace());
    return result;
  }

  /**
   * Flushes the HAR by closing the browser context, then reads it back. A failure here drops the
   * trace but keeps the measured result.
   */
  private JsonNode finalizeTrace(long monitorId, BrowserSession session, TraceTarget trace) {
    try {
      session.finishRecording();
    } catch (BrowserException e) {
      statistics.recordTraceCaptureFailure();
      log.warn("Monitor {} trace could not be flushed: {}", monitorId, e.getMessage());
      return null;
    }
    return traceCapturer.readBack(trace).orElse(null);
  }

  private SessionOptions sessionOptions(TraceTarget trace, Duration timeout) {
    return new SessionOptions(
        browserCfg.isHeadless(), browserCfg.getLaunchArgs(), trace.path(), timeout);
  }

  private static CheckPhase enter(long monitorId, CheckPhase phase) {
    log.debug("Monitor {} -> {}", monitorId, phase);
    return phase;
  }

  private static String describe(Throwable t) {
    String message = t.getMessage();
    if (message == null || message.isBlank()) {
      Throwable cause = t.getCause();
      if (cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()) {
        return cause.getMessage();
      }
      return t.getClass().getSimpleName();
    }
    return message;
  }
}
