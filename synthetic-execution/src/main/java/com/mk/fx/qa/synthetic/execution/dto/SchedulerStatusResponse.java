package com.mk.fx.qa.synthetic.execution.dto;

import java.time.Instant;

public record SchedulerStatusResponse(
    String state,
    boolean loopThreadAlive,
    long ticksCompleted,
    long monitorsChecked,
    Instant lastTickStartedAt,
    Instant lastTickCompletedAt,
    String lastError) {}
