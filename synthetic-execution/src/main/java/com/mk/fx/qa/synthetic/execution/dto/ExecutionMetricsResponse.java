package com.mk.fx.qa.synthetic.execution.dto;

import java.util.Map;

/**
 * Aggregate counters across all checks run by this instance since start-up.
 *
 * @param checksByStatus number of finished checks per status value
 * @param traceCaptureFailures traces that could not be read back and were dropped
 * @param persistenceFailures log attempts that failed in the store
 * @param recordsWritten execution records persisted
 * @param metricRowsWritten metric rows persisted
 */
public record ExecutionMetricsResponse(
    Map<String, Long> checksByStatus,
    long traceCaptureFailures,
    long persistenceFailures,
    long recordsWritten,
    long metricRowsWritten) {}
