package com.mk.fx.qa.synthetic.execution.dto;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * Result of an on-demand execution.
 *
 * @param logId id of the persisted execution record
 * @param status {@code success}, {@code timeout} or {@code error}
 */
public record RunNowResponse(
    long logId,
    long monitorId,
    String status,
    String errorMessage,
    Double ttfbMs,
    Double domContentLoadedMs,
    Double pageLoadMs,
    Instant startedAt,
    Instant completedAt,
    JsonNode trace) {}
