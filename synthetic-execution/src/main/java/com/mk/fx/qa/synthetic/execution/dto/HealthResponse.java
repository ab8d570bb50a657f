package com.mk.fx.qa.synthetic.execution.dto;

import java.time.Instant;

/** Response object for the health endpoint. */
public record HealthResponse(String status, Instant timestamp) {}
