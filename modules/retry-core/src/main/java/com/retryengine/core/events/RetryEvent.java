package com.retryengine.core.events;

import com.retryengine.core.policy.Outcome;

/** Attempt lifecycle event published by a single retry policy. */
public interface RetryEvent extends Event {
  /** Name of the publishing policy, {@code null} for unnamed policies. */
  String policyName();

  int attempt();

  Outcome<?> lastOutcome();

  default Throwable lastThrowable() {
    Outcome<?> outcome = lastOutcome();
    return outcome == null ? null : outcome.failure();
  }
}
