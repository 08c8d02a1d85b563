package com.retryengine.core.policy;

import com.retryengine.core.config.RetryConfig;
import com.retryengine.core.errors.MaxAttemptsExceededException;
import com.retryengine.core.events.RetryOnErrorEvent;
import com.retryengine.core.events.RetryOnIgnoredErrorEvent;
import com.retryengine.core.events.RetryOnRetryEvent;
import com.retryengine.core.events.RetryOnSuccessEvent;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State of one invocation running under a {@link RetryPolicy}. Starts at attempt 1 in {@link
 * RetryState#RUNNING}; confined to the invoking thread.
 */
public final class RetryContext<T> {
  private static final Logger log = LoggerFactory.getLogger(RetryContext.class);

  private final RetryPolicy policy;
  private int attempt = 1;
  private RetryState state = RetryState.RUNNING;

  RetryContext(RetryPolicy policy) {
    this.policy = policy;
  }

  public int attempt() {
    return attempt;
  }

  public RetryState state() {
    return state;
  }

  public AttemptDecision<T> onResult(T value) {
    return record(Outcome.success(value));
  }

  public AttemptDecision<T> onError(Exception exception) {
    return record(Outcome.failure(exception));
  }

  public AttemptDecision<T> record(Outcome<T> outcome) {
    Objects.requireNonNull(outcome, "outcome must not be null");
    if (state != RetryState.RUNNING) {
      throw new IllegalStateException("Cannot record an outcome in state " + state);
    }

    RetryConfig config = policy.config();
    Classification classification = policy.classifier().classify(outcome);
    switch (classification) {
      case SUCCEED:
        return succeed(outcome);
      case RETRY:
        return attempt < config.maxAttempts() ? retry(outcome) : exhaust(outcome, config);
      case FAIL_PERMANENTLY:
      default:
        return failPermanently(outcome);
    }
  }

  /** Moves a {@link RetryState#RETRYING} context on to the next attempt. */
  public void resume() {
    if (state != RetryState.RETRYING) {
      throw new IllegalStateException("Cannot resume in state " + state);
    }
    attempt++;
    state = RetryState.RUNNING;
  }

  private AttemptDecision<T> succeed(Outcome<T> outcome) {
    state = RetryState.SUCCEEDED;
    policy.metrics().recordSuccess(attempt);
    if (attempt > 1) {
      policy
          .eventPublisher()
          .publish(new RetryOnSuccessEvent(policy.eventName(), attempt, outcome, policy.now()));
    }
    return new AttemptDecision<>(state, Duration.ZERO, outcome);
  }

  private AttemptDecision<T> retry(Outcome<T> outcome) {
    Duration wait = waitInterval(outcome);
    state = RetryState.RETRYING;
    log.debug(
        "Retrying policy={} attempt={} wait={} failure={}",
        policy.eventName(),
        attempt,
        wait,
        outcome.isFailure() ? outcome.failure().toString() : "result");
    policy
        .eventPublisher()
        .publish(new RetryOnRetryEvent(policy.eventName(), attempt, wait, outcome, policy.now()));
    return new AttemptDecision<>(state, wait, outcome);
  }

  private AttemptDecision<T> exhaust(Outcome<T> outcome, RetryConfig config) {
    state = RetryState.EXHAUSTED;
    policy.metrics().recordFailure(attempt);
    policy
        .eventPublisher()
        .publish(new RetryOnErrorEvent(policy.eventName(), attempt, outcome, policy.now()));
    log.debug("Retry exhausted policy={} attempts={}", policy.eventName(), attempt);
    if (config.isFailAfterMaxAttempts()) {
      return new AttemptDecision<>(
          state,
          Duration.ZERO,
          Outcome.failure(new MaxAttemptsExceededException(policy.eventName(), attempt, outcome)));
    }
    return new AttemptDecision<>(state, Duration.ZERO, outcome);
  }

  private AttemptDecision<T> failPermanently(Outcome<T> outcome) {
    state = RetryState.FAILED_PERMANENTLY;
    policy.metrics().recordFailure(attempt);
    policy
        .eventPublisher()
        .publish(new RetryOnIgnoredErrorEvent(policy.eventName(), attempt, outcome, policy.now()));
    return new AttemptDecision<>(state, Duration.ZERO, outcome);
  }

  private Duration waitInterval(Outcome<T> outcome) {
    RetryConfig config = policy.config();
    Duration wait;
    try {
      wait = config.intervalBiFunction().apply(attempt, outcome);
    } catch (RuntimeException ex) {
      log.warn(
          "Interval function failed policy={} attempt={}, using waitDuration error={}",
          policy.eventName(),
          attempt,
          ex.toString());
      wait = config.waitDuration();
    }
    if (wait == null || wait.isNegative()) {
      return Duration.ZERO;
    }
    return wait;
  }
}
