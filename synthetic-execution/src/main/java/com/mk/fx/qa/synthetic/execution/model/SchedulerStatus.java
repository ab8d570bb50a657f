package com.mk.fx.qa.synthetic.execution.model;

import java.time.Instant;

/**
 * Point-in-time view of the scheduler loop.
 *
 * @param state current loop state
 * @param loopThreadAlive whether a loop thread is still running, possibly draining after a stop
 * @param ticksCompleted ticks that ran to the end of their snapshot
 * @param monitorsChecked checks performed by the loop since startup
 * @param lastTickStartedAt start of the most recent tick, null before the first one
 * @param lastTickCompletedAt end of the most recent completed tick
 * @param lastError message of the most recent loop or persistence failure
 */
public record SchedulerStatus(
    LoopState state,
    boolean loopThreadAlive,
    long ticksCompleted,
    long monitorsChecked,
    Instant lastTickStartedAt,
    Instant lastTickCompletedAt,
    String lastError) {}
