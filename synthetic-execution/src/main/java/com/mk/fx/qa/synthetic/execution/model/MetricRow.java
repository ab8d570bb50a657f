package com.mk.fx.qa.synthetic.execution.model;

import java.time.Instant;

/** One timing metric of an execution record. {@code metricValue} is null when not measured. */
public record MetricRow(
    long executionRecordId, MetricName metricName, Double metricValue, Instant recordedAt) {}
