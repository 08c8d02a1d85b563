package com.retryengine.core.interval;

import com.retryengine.core.policy.Outcome;
import java.time.Duration;

/** Like {@link IntervalFunction} but also sees the outcome of the attempt that just finished. */
@FunctionalInterface
public interface IntervalBiFunction {
  Duration apply(int attempt, Outcome<?> lastOutcome);

  static IntervalBiFunction of(IntervalFunction intervalFunction) {
    return (attempt, lastOutcome) -> intervalFunction.apply(attempt);
  }
}
