package com.mk.fx.qa.synthetic.execution.model;

/**
 * Names of the timing metrics persisted per successful check. The stored column values are the
 * ones the dashboard queries already use, hence {@code page_load_time_ms} for page load.
 */
public enum MetricName {
  TTFB_MS("ttfb_ms"),
  DOM_CONTENT_LOADED_MS("dom_content_loaded_ms"),
  PAGE_LOAD_MS("page_load_time_ms");

  private final String columnValue;

  MetricName(String columnValue) {
    this.columnValue = columnValue;
  }

  public String columnValue() {
    return columnValue;
  }
}
