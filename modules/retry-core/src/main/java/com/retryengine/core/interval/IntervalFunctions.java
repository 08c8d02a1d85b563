package com.retryengine.core.interval;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

public final class IntervalFunctions {
  public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(500L);
  public static final double DEFAULT_MULTIPLIER = 1.5d;
  public static final double DEFAULT_RANDOMIZATION_FACTOR = 0.5d;
  public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofMillis(Long.MAX_VALUE);

  private static final DoubleSupplier SYSTEM_RANDOM = () -> ThreadLocalRandom.current().nextDouble();

  private IntervalFunctions() {}

  public static IntervalFunction ofDefaults() {
    return fixed(DEFAULT_INTERVAL);
  }

  public static IntervalFunction fixed(Duration interval) {
    return new FixedInterval(interval);
  }

  public static IntervalFunction randomized(Duration interval) {
    return randomized(interval, DEFAULT_RANDOMIZATION_FACTOR);
  }

  public static IntervalFunction randomized(Duration interval, double randomizationFactor) {
    return randomized(interval, randomizationFactor, SYSTEM_RANDOM);
  }

  public static IntervalFunction randomized(
      Duration interval, double randomizationFactor, DoubleSupplier randomSource) {
    return new RandomizedInterval(new FixedInterval(interval), randomizationFactor, randomSource);
  }

  public static IntervalFunction exponentialBackoff(Duration initialInterval) {
    return exponentialBackoff(initialInterval, DEFAULT_MULTIPLIER);
  }

  public static IntervalFunction exponentialBackoff(Duration initialInterval, double multiplier) {
    return exponentialBackoff(initialInterval, multiplier, DEFAULT_MAX_INTERVAL);
  }

  public static IntervalFunction exponentialBackoff(
      Duration initialInterval, double multiplier, Duration maxInterval) {
    return new ExponentialBackoffInterval(initialInterval, multiplier, maxInterval);
  }

  public static IntervalFunction exponentialRandomBackoff(Duration initialInterval) {
    return exponentialRandomBackoff(
        initialInterval, DEFAULT_MULTIPLIER, DEFAULT_RANDOMIZATION_FACTOR);
  }

  public static IntervalFunction exponentialRandomBackoff(
      Duration initialInterval, double multiplier) {
    return exponentialRandomBackoff(initialInterval, multiplier, DEFAULT_RANDOMIZATION_FACTOR);
  }

  public static IntervalFunction exponentialRandomBackoff(
      Duration initialInterval, double multiplier, double randomizationFactor) {
    return exponentialRandomBackoff(
        initialInterval, multiplier, randomizationFactor, DEFAULT_MAX_INTERVAL);
  }

  public static IntervalFunction exponentialRandomBackoff(
      Duration initialInterval,
      double multiplier,
      double randomizationFactor,
      Duration maxInterval) {
    return exponentialRandomBackoff(
        initialInterval, multiplier, randomizationFactor, maxInterval, SYSTEM_RANDOM);
  }

  public static IntervalFunction exponentialRandomBackoff(
      Duration initialInterval,
      double multiplier,
      double randomizationFactor,
      Duration maxInterval,
      DoubleSupplier randomSource) {
    return new RandomizedInterval(
        new ExponentialBackoffInterval(initialInterval, multiplier, maxInterval),
        randomizationFactor,
        randomSource);
  }
}
