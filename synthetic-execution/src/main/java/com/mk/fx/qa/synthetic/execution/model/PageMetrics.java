package com.mk.fx.qa.synthetic.execution.model;

/** Page-load timings in milliseconds; any value may be null when the browser did not expose it. */
public record PageMetrics(Double ttfbMs, Double domContentLoadedMs, Double pageLoadMs) {

  public boolean isEmpty() {
    return ttfbMs == null && domContentLoadedMs == null && pageLoadMs == null;
  }
}
