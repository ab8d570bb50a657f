package com.mk.fx.qa.synthetic.execution.model;

/** Result of an on-demand run: the persisted record id plus the check result itself. */
public record ExecutionOutcome(long recordId, long monitorId, ExecutionResult result) {}
