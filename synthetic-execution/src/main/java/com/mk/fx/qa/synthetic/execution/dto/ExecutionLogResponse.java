package com.mk.fx.qa.synthetic.execution.dto;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/** One persisted execution with its metrics pivoted into columns. */
public record ExecutionLogResponse(
    long id,
    long monitorId,
    Instant startedAt,
    Instant completedAt,
    String status,
    String errorMessage,
    Double ttfbMs,
    Double domContentLoadedMs,
    Double pageLoadMs,
    JsonNode trace) {}
