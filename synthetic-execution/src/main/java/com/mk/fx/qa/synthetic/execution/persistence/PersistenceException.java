package com.mk.fx.qa.synthetic.execution.persistence;

/** A write to, or read from, the execution store failed. Never retried by this service. */
public class PersistenceException extends RuntimeException {

  public PersistenceException(String message) {
    super(message);
  }

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
