package com.mk.fx.qa.synthetic.execution.model;

import java.util.Objects;

/**
 * A registered monitor definition. Owned by the registry; this service only reads it.
 *
 * @param id registry identifier
 * @param name display name, used in logs
 * @param url page the check navigates to
 * @param timeoutSeconds navigation bound for a single check
 * @param enabled whether scheduled ticks pick the monitor up
 */
public record Monitor(long id, String name, String url, int timeoutSeconds, boolean enabled) {

  public Monitor {
    Objects.requireNonNull(url, "url");
    if (timeoutSeconds <= 0) {
      throw new IllegalArgumentException("timeoutSeconds must be positive, was " + timeoutSeconds);
    }
  }
}
