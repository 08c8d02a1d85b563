package com.retryengine.core.policy;

public enum RetryState {
  RUNNING,
  RETRYING,
  SUCCEEDED,
  FAILED_PERMANENTLY,
  EXHAUSTED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED_PERMANENTLY || this == EXHAUSTED;
  }
}
