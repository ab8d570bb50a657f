package com.mk.fx.qa.synthetic.execution.checker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.mk.fx.qa.synthetic.execution.cfg.BrowserCfg;
import com.mk.fx.qa.synthetic.execution.metrics.ExecutionStatistics;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Hands out one fresh HAR file per check and reads it back once the browser context has flushed
 * it.
 *
 * <p>Trace capture is best effort: any failure is logged, counted in {@link ExecutionStatistics}
 * and the check continues without a trace.
 */
@Slf4j
@Component
public class TraceCapturer {

  private static final String DEFAULT_DIRECTORY_NAME = "synthetic-traces";

  private final Path traceDirectory;
  private final ObjectMapper objectMapper;
  private final ExecutionStatistics statistics;

  @Autowired
  public TraceCapturer(BrowserCfg browserCfg, ObjectMapper objectMapper, ExecutionStatistics statistics) {
    this(resolveDirectory(browserCfg.getTraceDirectory()), objectMapper, statistics);
  }

  public TraceCapturer(Path traceDirectory, ObjectMapper objectMapper, ExecutionStatistics statistics) {
    this.traceDirectory = traceDirectory;
    this.objectMapper = objectMapper;
    this.statistics = statistics;
  }

  private static Path resolveDirectory(String configured) {
    if (configured != null && !configured.isBlank()) {
      return Path.of(configured);
    }
    return Path.of(System.getProperty("java.io.tmpdir"), DEFAULT_DIRECTORY_NAME);
  }

  /**
   * Reserves a new, unique trace file for one check. When the directory cannot be prepared the
   * check runs without recording.
   */
  public TraceTarget allocate(long monitorId) {
    try {
      Files.createDirectories(traceDirectory);
    } catch (IOException e) {
      statistics.recordTraceCaptureFailure();
      log.warn(
          "Trace directory {} unavailable, monitor {} runs without a trace: {}",
          traceDirectory,
          monitorId,
          e.getMessage());
      return new TraceTarget(monitorId, null, this);
    }
    var fileName = "monitor_" + monitorId + "_" + UUID.randomUUID() + ".har";
    return new TraceTarget(monitorId, traceDirectory.resolve(fileName), this);
  }

  /**
   * Parses the recorded HAR. Must only be called after the browser context was closed.
   *
   * @return the trace, or empty when nothing usable was recorded
   */
  public Optional<JsonNode> readBack(TraceTarget target) {
    if (!target.isEnabled()) {
      return Optional.empty();
    }
    target.markConsumed();
    Path path = target.path();
    if (!Files.exists(path)) {
      statistics.recordTraceCaptureFailure();
      log.warn("No trace recorded for monitor {} at {}", target.monitorId(), path);
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readTree(path.toFile()));
    } catch (IOException e) {
      statistics.recordTraceCaptureFailure();
      log.warn("Failed to read trace for monitor {}: {}", target.monitorId(), e.getMessage());
      return Optional.empty();
    }
  }

  void release(TraceTarget target) {
    if (!target.isEnabled()) {
      return;
    }
    try {
      boolean deleted = Files.deleteIfExists(target.path());
      if (deleted && !target.isConsumed()) {
        log.warn("Discarded unread trace for monitor {}", target.monitorId());
      }
    } catch (IOException e) {
      statistics.recordTraceCaptureFailure();
      log.warn("Failed to delete trace file {}: {}", target.path(), e.getMessage());
    }
  }

  @VisibleForTesting
  Path traceDirectory() {
    return traceDirectory;
  }
}
