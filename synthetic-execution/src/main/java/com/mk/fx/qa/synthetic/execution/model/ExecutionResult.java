package com.mk.fx.qa.synthetic.execution.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one check, handed from the checker to the result logger.
 *
 * <p>Invariants: a {@link ExecutionStatus#TIMEOUT} or {@link ExecutionStatus#ERROR} result always
 * carries a non-blank error message and never carries metrics.
 */
public record ExecutionResult(
    ExecutionStatus status,
    String errorMessage,
    Double ttfbMs,
    Double domContentLoadedMs,
    Double pageLoadMs,
    JsonNode trace,
    Instant startedAt,
    Instant completedAt) {

  public ExecutionResult {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(completedAt, "completedAt");
    if (status != ExecutionStatus.SUCCESS) {
      if (errorMessage == null || errorMessage.isBlank()) {
        throw new IllegalArgumentException(status + " result requires an error message");
      }
      if (ttfbMs != null || domContentLoadedMs != null || pageLoadMs != null) {
        throw new IllegalArgumentException(status + " result must not carry metrics");
      }
    }
  }

  public static ExecutionResult success(PageMetrics metrics, Instant startedAt, Instant completedAt) {
    return new ExecutionResult(
        ExecutionStatus.SUCCESS,
        null,
        metrics.ttfbMs(),
        metrics.domContentLoadedMs(),
        metrics.pageLoadMs(),
        null,
        startedAt,
        completedAt);
  }

  public static ExecutionResult timeout(String message, Instant startedAt, Instant completedAt) {
    return new ExecutionResult(
        ExecutionStatus.TIMEOUT, message, null, null, null, null, startedAt, completedAt);
  }

  public static ExecutionResult error(String message, Instant startedAt, Instant completedAt) {
    return new ExecutionResult(
        ExecutionStatus.ERROR, message, null, null, null, null, startedAt, completedAt);
  }

  public ExecutionResult withTrace(JsonNode trace) {
    return new ExecutionResult(
        status,
        errorMessage,
        ttfbMs,
        domContentLoadedMs,
        pageLoadMs,
        trace,
        startedAt,
        completedAt);
  }

  public PageMetrics metrics() {
    return new PageMetrics(ttfbMs, domContentLoadedMs, pageLoadMs);
  }

  public boolean isSuccess() {
    return status == ExecutionStatus.SUCCESS;
  }

  public boolean hasTrace() {
    return trace != null;
  }
}
