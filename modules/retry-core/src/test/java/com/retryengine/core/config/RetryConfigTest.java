package com.retryengine.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.retryengine.core.errors.InvalidRetryConfigException;
import com.retryengine.core.interval.IntervalBiFunction;
import com.retryengine.core.interval.IntervalFunction;
import com.retryengine.core.interval.IntervalFunctions;
import com.retryengine.core.policy.Outcome;
import java.time.Duration;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RetryConfigTest {
  @Test
  void shouldExposeDefaults() {
    RetryConfig config = RetryConfig.ofDefaults();

    assertEquals(3, config.maxAttempts());
    assertEquals(Duration.ofMillis(500), config.waitDuration());
    assertEquals(Duration.ofMillis(500), config.intervalFunction().apply(1));
    assertEquals(Duration.ofMillis(500), config.intervalBiFunction().apply(2, null));
    assertFalse(config.resultRetryPredicate().test("anything"));
    assertTrue(config.exceptionRetryPredicate().test(new IllegalStateException()));
    assertTrue(config.retryExceptions().isEmpty());
    assertTrue(config.ignoreExceptions().isEmpty());
    assertFalse(config.isFailAfterMaxAttempts());
    assertFalse(config.hasIntervalBiFunction());
  }

  @Test
  void shouldRejectMaxAttemptsBelowOne() {
    InvalidRetryConfigException error =
        assertThrows(
            InvalidRetryConfigException.class, () -> RetryConfig.custom().maxAttempts(0).build());

    assertEquals("maxAttempts must be >= 1 but was 0", error.getMessage());
  }

  @Test
  void shouldRejectNegativeWaitDuration() {
    assertThrows(
        InvalidRetryConfigException.class,
        () -> RetryConfig.custom().waitDuration(Duration.ofMillis(-5)).build());
  }

  @Test
  void shouldDeriveFixedIntervalFromWaitDuration() {
    RetryConfig config = RetryConfig.custom().waitDuration(Duration.ofMillis(40)).build();

    assertEquals(Duration.ofMillis(40), config.intervalFunction().apply(7));
  }

  @Test
  void shouldRebuildDerivedIntervalWhenCopiedWithNewWaitDuration() {
    RetryConfig base = RetryConfig.custom().waitDuration(Duration.ofMillis(40)).build();

    RetryConfig copy = RetryConfig.from(base).waitDuration(Duration.ofMillis(90)).build();

    assertEquals(Duration.ofMillis(90), copy.intervalFunction().apply(1));
    assertEquals(Duration.ofMillis(40), base.intervalFunction().apply(1));
  }

  @Test
  void shouldKeepExplicitIntervalFunctionWhenCopied() {
    IntervalFunction exponential = IntervalFunctions.exponentialBackoff(Duration.ofMillis(10), 2.0d);
    RetryConfig base = RetryConfig.custom().intervalFunction(exponential).build();

    RetryConfig copy = RetryConfig.from(base).maxAttempts(7).build();

    assertSame(exponential, copy.intervalFunction());
    assertEquals(7, copy.maxAttempts());
  }

  @Test
  void shouldRejectBothIntervalStrategies() {
    RetryConfig.Builder builder =
        RetryConfig.custom()
            .intervalFunction(IntervalFunctions.fixed(Duration.ofMillis(10)))
            .intervalBiFunction((attempt, outcome) -> Duration.ofMillis(20));

    InvalidRetryConfigException error =
        assertThrows(InvalidRetryConfigException.class, builder::build);

    assertEquals(
        "intervalFunction and intervalBiFunction are mutually exclusive", error.getMessage());
  }

  @Test
  void shouldRejectBiFunctionAddedToCopiedIntervalFunction() {
    RetryConfig base =
        RetryConfig.custom()
            .intervalFunction(IntervalFunctions.exponentialBackoff(Duration.ofMillis(10)))
            .build();

    assertThrows(
        InvalidRetryConfigException.class,
        () -> RetryConfig.from(base).intervalBiFunction((attempt, outcome) -> Duration.ZERO).build());
  }

  @Test
  void shouldUseIntervalBiFunctionWhenItIsTheOnlyStrategy() {
    IntervalBiFunction biFunction =
        (attempt, outcome) ->
            outcome.isFailure() ? Duration.ofMillis(attempt * 10L) : Duration.ZERO;

    RetryConfig config = RetryConfig.custom().intervalBiFunction(biFunction).build();

    assertTrue(config.hasIntervalBiFunction());
    assertNull(config.intervalFunction());
    assertEquals(
        Duration.ofMillis(30),
        config.intervalBiFunction().apply(3, Outcome.failure(new IllegalStateException())));
  }

  @Test
  void shouldCopyExceptionSets() {
    RetryConfig config =
        RetryConfig.custom()
            .retryExceptions(IllegalStateException.class)
            .ignoreExceptions(IllegalArgumentException.class, UnsupportedOperationException.class)
            .failAfterMaxAttempts(true)
            .build();

    assertEquals(Set.of(IllegalStateException.class), config.retryExceptions());
    assertEquals(
        Set.of(IllegalArgumentException.class, UnsupportedOperationException.class),
        config.ignoreExceptions());
    assertTrue(config.isFailAfterMaxAttempts());
  }
}
