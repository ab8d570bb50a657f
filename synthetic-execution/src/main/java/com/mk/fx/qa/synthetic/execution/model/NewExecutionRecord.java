package com.mk.fx.qa.synthetic.execution.model;

import java.time.Instant;

/** Column values for inserting an execution record; the store assigns the id. */
public record NewExecutionRecord(
    long monitorId,
    Instant startedAt,
    Instant completedAt,
    ExecutionStatus status,
    String errorMessage) {

  public static NewExecutionRecord of(long monitorId, ExecutionResult result) {
    return new NewExecutionRecord(
        monitorId,
        result.startedAt(),
        result.completedAt(),
        result.status(),
        result.errorMessage());
  }
}
