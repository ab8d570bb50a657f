package com.mk.fx.qa.synthetic.execution.model;

public enum LoopState {
  STOPPED,
  RUNNING
}
