package com.mk.fx.qa.synthetic.execution.checker;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.synthetic.execution.browser.BrowserException;
import com.mk.fx.qa.synthetic.execution.browser.BrowserSession;
import com.mk.fx.qa.synthetic.execution.browser.NavigationResponse;
import com.mk.fx.qa.synthetic.execution.browser.NavigationTimeoutException;
import com.mk.fx.qa.synthetic.execution.browser.SessionOptions;
import com.mk.fx.qa.synthetic.execution.cfg.BrowserCfg;
import com.mk.fx.qa.synthetic.execution.metrics.ExecutionStatistics;
import com.mk.fx.qa.synthetic.execution.model.ExecutionResult;
import com.mk.fx.qa.synthetic.execution.model.ExecutionStatus;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BrowserMonitorCheckerTest {

  private static final String HAR = "{\"log\":{\"version\":\"1.2\",\"entries\":[]}}";
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @TempDir Path tempDir;

  private ExecutionStatistics statistics;
  private TraceCapturer traceCapturer;
  private final List<FakeSession> sessions = new ArrayList<>();
  private final List<SessionOptions> openedWith = new ArrayList<>();

  @BeforeEach
  void setUp() {
    statistics = new ExecutionStatistics();
    traceCapturer = new TraceCapturer(tempDir, new ObjectMapper(), statistics);
  }

  private BrowserMonitorChecker checker(FakeSession session) {
    return new BrowserMonitorChecker(
        options -> {
          openedWith.add(options);
          session.harPath = options.harPath();
          sessions.add(session);
          return session;
        },
        new PageMetricsExtractor(),
        traceCapturer,
        new BrowserCfg(),
        statistics,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private long traceFilesLeft() throws IOException {
    try (Stream<Path> files = Files.list(tempDir)) {
      return files.count();
    }
  }

  @Test
  void execute_successReturnsMetricsAndTrace() throws Exception {
    var session = new FakeSession();
    session.response = new NavigationResponse(200, "https://example.com/", 85.0);
    session.timing =
        Map.of(
            "domContentLoaded", 400,
            "pageLoad", 1200,
            "navigationDomContentLoaded", 410.5,
            "navigationLoadComplete", 1210.5);

    ExecutionResult result = checker(session).execute(1, "https://example.com", 30);

    assertEquals(ExecutionStatus.SUCCESS, result.status());
    assertNull(result.errorMessage());
    assertEquals(85.0, result.ttfbMs());
    assertEquals(410.5, result.domContentLoadedMs());
    assertEquals(1210.5, result.pageLoadMs());
    assertTrue(result.hasTrace());
    assertEquals("1.2", result.trace().path("log").path("version").asText());
    assertEquals(NOW, result.startedAt());
    assertEquals(NOW, result.completedAt());

    assertTrue(session.closed);
    assertEquals(0, traceFilesLeft());
    assertEquals(1, statistics.checks(ExecutionStatus.SUCCESS));
  }

  @Test
  void execute_passesTimeoutAndBrowserSettingsToSession() {
    var session = new FakeSession();
    session.response = new NavigationResponse(200, "https://example.com/", 1.0);

    checker(session).execute(1, "https://example.com", 12);

    SessionOptions options = openedWith.get(0);
    assertTrue(options.headless());
    assertEquals(Duration.ofSeconds(12), options.operationTimeout());
    assertEquals(List.of("--no-sandbox", "--disable-setuid-sandbox"), options.launchArgs());
    assertTrue(options.recordsHar());
    assertEquals(Duration.ofSeconds(12), session.navigatedWith);
  }

  @Test
  void execute_timeoutHasPrefixedMessageNoMetricsAndKeepsTrace() throws Exception {
    var session = new FakeSession();
    session.navigationFailure =
        new NavigationTimeoutException(Duration.ofSeconds(5), "Timeout 5000ms exceeded.", null);

    ExecutionResult result = checker(session).execute(2, "https://slow.example.com", 5);

    assertEquals(ExecutionStatus.TIMEOUT, result.status());
    assertEquals("Page load timeout: Timeout 5000ms exceeded.", result.errorMessage());
    assertNull(result.ttfbMs());
    assertNull(result.domContentLoadedMs());
    assertNull(result.pageLoadMs());
    assertTrue(result.hasTrace());
    assertTrue(session.closed);
    assertEquals(0, traceFilesLeft());
    assertEquals(1, statistics.checks(ExecutionStatus.TIMEOUT));
  }

  @Test
  void execute_navigationErrorReturnsErrorAndDiscardsTrace() throws Exception {
    var session = new FakeSession();
    session.navigationFailure = new BrowserException("net::ERR_NAME_NOT_RESOLVED");

    ExecutionResult result = checker(session).execute(3, "https://nowhere.invalid", 30);

    assertEquals(ExecutionStatus.ERROR, result.status());
    assertEquals("net::ERR_NAME_NOT_RESOLVED", result.errorMessage());
    assertTrue(result.metrics().isEmpty());
    assertFalse(result.hasTrace());
    assertTrue(session.closed);
    assertEquals(0, traceFilesLeft());
    assertEquals(1, statistics.checks(ExecutionStatus.ERROR));
  }

  @Test
  void execute_blankMessageFallsBackToExceptionName() {
    var session = new FakeSession();
    session.navigationFailure = new IllegalStateException();

    ExecutionResult result = checker(session).execute(4, "https://example.com", 30);

    assertEquals(ExecutionStatus.ERROR, result.status());
    assertEquals("IllegalStateException", result.errorMessage());
  }

  @Test
  void execute_launchFailureIsErrorAndLeavesNoTraceFile() throws Exception {
    var checker =
        new BrowserMonitorChecker(
            options -> {
              throw new BrowserException("Failed to launch browser: missing dependencies");
            },
            new PageMetricsExtractor(),
            traceCapturer,
            new BrowserCfg(),
            statistics,
            Clock.fixed(NOW, ZoneOffset.UTC));

    ExecutionResult result = checker.execute(5, "https://example.com", 30);

    assertEquals(ExecutionStatus.ERROR, result.status());
    assertEquals("Failed to launch browser: missing dependencies", result.errorMessage());
    assertEquals(0, traceFilesLeft());
  }

  @Test
  void execute_failedTraceFlushKeepsMeasuredResult() {
    var session = new FakeSession();
    session.response = new NavigationResponse(200, "https://example.com/", 20.0);
    session.finishFailure = new BrowserException("context already crashed");

    ExecutionResult result = checker(session).execute(6, "https://example.com", 30);

    assertEquals(ExecutionStatus.SUCCESS, result.status());
    assertEquals(20.0, result.ttfbMs());
    assertFalse(result.hasTrace());
    assertEquals(1, statistics.traceCaptureFailures());
  }

  @Test
  void execute_releaseFailureBecomesError() {
    var session = new FakeSession();
    session.response = new NavigationResponse(200, "https://example.com/", 20.0);
    session.closeFailure = new BrowserException("Failed to release browser session: driver gone");

    ExecutionResult result = checker(session).execute(7, "https://example.com", 30);

    assertEquals(ExecutionStatus.ERROR, result.status());
    assertEquals("Failed to release browser session: driver gone", result.errorMessage());
  }

  @Test
  void execute_everyCheckGetsItsOwnSession() {
    var first = new FakeSession();
    first.response = NavigationResponse.empty("about:blank");
    var second = new FakeSession();
    second.response = NavigationResponse.empty("about:blank");
    var pending = new ArrayList<>(List.of(first, second));
    var checker =
        new BrowserMonitorChecker(
            options -> {
              var next = pending.remove(0);
              next.harPath = options.harPath();
              return next;
            },
            new PageMetricsExtractor(),
            traceCapturer,
            new BrowserCfg(),
            statistics,
            Clock.systemUTC());

    checker.execute(8, "about:blank", 30);
    checker.execute(8, "about:blank", 30);

    assertTrue(first.closed);
    assertTrue(second.closed);
    assertNotEquals(first.harPath, second.harPath);
  }

  /** Writes the HAR on context close, the way the real browser flushes it. */
  private static final class FakeSession implements BrowserSession {

    NavigationResponse response;
    RuntimeException navigationFailure;
    RuntimeException finishFailure;
    RuntimeException closeFailure;
    Object timing = Map.of();
    Path harPath;
    Duration navigatedWith;
    boolean recordingFinished;
    boolean closed;

    @Override
    public NavigationResponse navigate(String url, Duration timeout) {
      navigatedWith = timeout;
      if (navigationFailure != null) {
        throw navigationFailure;
      }
      return response;
    }

    @Override
    public Object evaluate(String script) {
      return timing;
    }

    @Override
    public void finishRecording() {
      if (finishFailure != null) {
        throw finishFailure;
      }
      flush();
    }

    @Override
    public void close() {
      flush();
      closed = true;
      if (closeFailure != null) {
        throw closeFailure;
      }
    }

    private void flush() {
      if (recordingFinished || harPath == null) {
        return;
      }
      recordingFinished = true;
      try {
        Files.writeString(harPath, HAR);
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
  }
}
