package com.retryengine.core.policy;

public enum Classification {
  SUCCEED,
  RETRY,
  FAIL_PERMANENTLY
}
