package com.retryengine.core.errors;

import com.retryengine.core.policy.Outcome;

/** Raised when a policy configured to fail after its last attempt runs out of attempts. */
public class MaxAttemptsExceededException extends RetryEngineException {
  private final String policyName;
  private final int attempts;
  private final transient Outcome<?> lastOutcome;

  public MaxAttemptsExceededException(String policyName, int attempts, Outcome<?> lastOutcome) {
    super(
        String.format(
            "Retry '%s' has exhausted all attempts (%d)",
            policyName == null ? "unnamed" : policyName, attempts),
        lastOutcome == null ? null : lastOutcome.failure());
    this.policyName = policyName;
    this.attempts = attempts;
    this.lastOutcome = lastOutcome;
  }

  public String policyName() {
    return policyName;
  }

  public int attempts() {
    return attempts;
  }

  public Outcome<?> lastOutcome() {
    return lastOutcome;
  }
}
