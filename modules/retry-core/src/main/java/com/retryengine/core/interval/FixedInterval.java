package com.retryengine.core.interval;

import com.retryengine.core.errors.InvalidRetryConfigException;
import java.time.Duration;
import java.util.Objects;

public class FixedInterval implements IntervalFunction {
  private final Duration interval;

  public FixedInterval(Duration interval) {
    Objects.requireNonNull(interval, "interval must not be null");
    if (interval.isNegative()) {
      throw new InvalidRetryConfigException("interval must be >= 0 but was " + interval);
    }
    this.interval = interval;
  }

  @Override
  public Duration apply(int attempt) {
    return interval;
  }

  public Duration interval() {
    return interval;
  }
}
