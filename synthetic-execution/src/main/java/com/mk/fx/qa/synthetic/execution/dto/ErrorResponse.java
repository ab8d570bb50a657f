package com.mk.fx.qa.synthetic.execution.dto;

/**
 * Body of every non-2xx response.
 *
 * @param error short title, e.g. {@code Not Found}
 * @param details human readable cause
 */
public record ErrorResponse(String error, String details) {}
