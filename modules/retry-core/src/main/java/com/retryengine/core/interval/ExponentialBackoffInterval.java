package com.retryengine.core.interval;

import com.retryengine.core.errors.InvalidRetryConfigException;
import java.time.Duration;
import java.util.Objects;

/** {@code initial * multiplier^(attempt - 1)}, never above {@code maxInterval}. */
public class ExponentialBackoffInterval implements IntervalFunction {
  private final Duration initialInterval;
  private final double multiplier;
  private final Duration maxInterval;

  public ExponentialBackoffInterval(
      Duration initialInterval, double multiplier, Duration maxInterval) {
    this.initialInterval = Objects.requireNonNull(initialInterval, "initialInterval must not be null");
    this.maxInterval = Objects.requireNonNull(maxInterval, "maxInterval must not be null");
    if (initialInterval.isNegative()) {
      throw new InvalidRetryConfigException(
          "initialInterval must be >= 0 but was " + initialInterval);
    }
    if (maxInterval.compareTo(initialInterval) < 0) {
      throw new InvalidRetryConfigException(
          "maxInterval must be >= initialInterval but was " + maxInterval);
    }
    if (Double.isNaN(multiplier) || multiplier < 1.0d) {
      throw new InvalidRetryConfigException("multiplier must be >= 1.0 but was " + multiplier);
    }
    this.multiplier = multiplier;
  }

  @Override
  public Duration apply(int attempt) {
    if (initialInterval.isZero()) {
      return Duration.ZERO;
    }

    int exponent = Math.max(0, attempt - 1);
    double scaled = Intervals.saturatedNanos(initialInterval) * Math.pow(multiplier, exponent);
    if (scaled >= Intervals.saturatedNanos(maxInterval)) {
      return maxInterval;
    }
    return Duration.ofNanos((long) scaled);
  }

  public Duration initialInterval() {
    return initialInterval;
  }

  public double multiplier() {
    return multiplier;
  }

  public Duration maxInterval() {
    return maxInterval;
  }
}
