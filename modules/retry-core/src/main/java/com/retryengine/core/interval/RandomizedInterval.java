package com.retryengine.core.interval;

import com.retryengine.core.errors.InvalidRetryConfigException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * Spreads the delegate's interval uniformly over {@code [interval * (1 - factor), interval * (1 +
 * factor)]}. The random source must yield values in {@code [0, 1)}.
 */
public class RandomizedInterval implements IntervalFunction {
  private final IntervalFunction delegate;
  private final double randomizationFactor;
  private final DoubleSupplier randomSource;

  public RandomizedInterval(
      IntervalFunction delegate, double randomizationFactor, DoubleSupplier randomSource) {
    this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    this.randomSource = Objects.requireNonNull(randomSource, "randomSource must not be null");
    if (Double.isNaN(randomizationFactor)
        || randomizationFactor < 0.0d
        || randomizationFactor > 1.0d) {
      throw new InvalidRetryConfigException(
          "randomizationFactor must be within [0, 1] but was " + randomizationFactor);
    }
    this.randomizationFactor = randomizationFactor;
  }

  @Override
  public Duration apply(int attempt) {
    Duration interval = delegate.apply(attempt);
    if (interval.isZero() || interval.isNegative() || randomizationFactor == 0.0d) {
      return interval.isNegative() ? Duration.ZERO : interval;
    }

    long intervalNanos = Intervals.saturatedNanos(interval);
    double random = Math.max(0.0d, Math.min(0.999999999d, randomSource.getAsDouble()));
    double delta = randomizationFactor * intervalNanos;
    double randomized = intervalNanos - delta + random * (2.0d * delta);
    long bounded = (long) Math.min((double) Long.MAX_VALUE, Math.floor(randomized));
    return Duration.ofNanos(Math.max(0L, bounded));
  }

  public double randomizationFactor() {
    return randomizationFactor;
  }
}
