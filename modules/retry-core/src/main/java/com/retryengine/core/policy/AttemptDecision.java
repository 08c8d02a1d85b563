package com.retryengine.core.policy;

import com.retryengine.core.errors.RetryEngineException;
import java.time.Duration;

/**
 * What the caller does after an attempt: wait {@code waitInterval} and try again when the state is
 * {@link RetryState#RETRYING}, otherwise hand back {@code outcome}.
 */
public record AttemptDecision<T>(RetryState state, Duration waitInterval, Outcome<T> outcome) {

  public boolean shouldRetry() {
    return state == RetryState.RETRYING;
  }

  /** Returns the final value or rethrows the final failure unchanged. */
  public T resultOrThrow() throws Exception {
    if (outcome.isSuccess()) {
      return outcome.value();
    }
    Throwable failure = outcome.failure();
    if (failure instanceof Exception exception) {
      throw exception;
    }
    if (failure instanceof Error error) {
      throw error;
    }
    throw new RetryEngineException("Attempt failed with a non-standard throwable", failure);
  }
}
