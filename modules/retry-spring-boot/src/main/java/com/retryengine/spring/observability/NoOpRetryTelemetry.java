package com.retryengine.spring.observability;

import com.retryengine.core.events.RetryEvent;
import com.retryengine.core.policy.RetryPolicy;

public class NoOpRetryTelemetry implements RetryTelemetry {
  @Override
  public void onPolicyAdded(String name, RetryPolicy policy) {}

  @Override
  public void onPolicyRemoved(String name, RetryPolicy policy) {}

  @Override
  public void onRetryEvent(String name, RetryEvent event) {}
}
