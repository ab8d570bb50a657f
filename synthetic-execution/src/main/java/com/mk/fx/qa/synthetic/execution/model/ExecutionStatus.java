package com.mk.fx.qa.synthetic.execution.model;

import java.util.Arrays;

/** Final status of a single check, stored in lower case. */
public enum ExecutionStatus {
  SUCCESS("success"),
  TIMEOUT("timeout"),
  ERROR("error");

  private final String value;

  ExecutionStatus(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ExecutionStatus fromValue(String value) {
    return Arrays.stream(values())
        .filter(status -> status.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unsupported execution status: " + value));
  }
}
