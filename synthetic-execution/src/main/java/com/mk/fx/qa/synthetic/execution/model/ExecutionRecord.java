package com.mk.fx.qa.synthetic.execution.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * A persisted execution, as read back from the store together with its pivoted metric rows.
 */
public record ExecutionRecord(
    long id,
    long monitorId,
    Instant startedAt,
    Instant completedAt,
    ExecutionStatus status,
    String errorMessage,
    Double ttfbMs,
    Double domContentLoadedMs,
    Double pageLoadMs,
    JsonNode trace) {}
