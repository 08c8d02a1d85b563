package com.retryengine.spring.observability;

import com.retryengine.core.events.RetryEvent;
import com.retryengine.core.policy.RetryPolicy;

/** Receives policy lifecycle and attempt events keyed by the registry name they are bound to. */
public interface RetryTelemetry {
  void onPolicyAdded(String name, RetryPolicy policy);

  void onPolicyRemoved(String name, RetryPolicy policy);

  void onRetryEvent(String name, RetryEvent event);
}
