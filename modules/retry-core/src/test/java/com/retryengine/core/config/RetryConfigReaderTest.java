package com.retryengine.core.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.retryengine.core.errors.InvalidRetryConfigException;
import com.retryengine.core.interval.IntervalBiFunction;
import com.retryengine.core.interval.IntervalFunction;
import com.retryengine.core.interval.IntervalFunctions;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.junit.jupiter.api.Test;

class RetryConfigReaderTest {
  @Test
  void shouldReadEveryRecognizedKey() {
    IntervalFunction interval = IntervalFunctions.fixed(Duration.ofMillis(20));
    Predicate<Object> resultPredicate = "retry"::equals;
    Predicate<Throwable> exceptionPredicate = ex -> ex instanceof IOException;
    Map<String, Object> values = new HashMap<>();
    values.put("max-attempts", 5);
    values.put("wait-duration", Duration.ofMillis(75));
    values.put("interval-function", interval);
    values.put("retry-on-result-predicate", resultPredicate);
    values.put("retry-exception-predicate", exceptionPredicate);
    values.put("retry-exceptions", List.of(IOException.class));
    values.put("ignore-exceptions", List.of(IllegalArgumentException.class));
    values.put("fail-after-max-attempts", true);

    RetryConfig config = RetryConfigReader.read(values);

    assertEquals(5, config.maxAttempts());
    assertEquals(Duration.ofMillis(75), config.waitDuration());
    assertSame(interval, config.intervalFunction());
    assertTrue(config.resultRetryPredicate().test("retry"));
    assertTrue(config.exceptionRetryPredicate().test(new IOException("io")));
    assertEquals(Set.of(IOException.class), config.retryExceptions());
    assertEquals(Set.of(IllegalArgumentException.class), config.ignoreExceptions());
    assertTrue(config.isFailAfterMaxAttempts());
  }

  @Test
  void shouldIgnoreUnknownKeysAndAcceptMillis() {
    RetryConfig config =
        RetryConfigReader.read(Map.of("wait-duration", 150L, "circuit-breaker", "ignored"));

    assertEquals(Duration.ofMillis(150), config.waitDuration());
    assertEquals(Duration.ofMillis(150), config.intervalFunction().apply(2));
    assertEquals(3, config.maxAttempts());
  }

  @Test
  void shouldReadIntervalBiFunction() {
    IntervalBiFunction biFunction = (attempt, outcome) -> Duration.ofMillis(attempt);

    RetryConfig config = RetryConfigReader.read(Map.of("interval-bi-function", biFunction));

    assertSame(biFunction, config.intervalBiFunction());
  }

  @Test
  void shouldRejectBothIntervalKeys() {
    Map<String, Object> values =
        Map.of(
            "interval-function", IntervalFunctions.ofDefaults(),
            "interval-bi-function", (IntervalBiFunction) (attempt, outcome) -> Duration.ZERO);

    assertThrows(InvalidRetryConfigException.class, () -> RetryConfigReader.read(values));
  }

  @Test
  void shouldReplaceIntervalStrategyInheritedFromBase() {
    RetryConfig base =
        RetryConfig.custom()
            .intervalFunction(IntervalFunctions.exponentialBackoff(Duration.ofMillis(10)))
            .build();
    IntervalBiFunction biFunction = (attempt, outcome) -> Duration.ofMillis(attempt * 7L);

    RetryConfig config = RetryConfigReader.read(Map.of("interval-bi-function", biFunction), base);

    assertSame(biFunction, config.intervalBiFunction());
    assertNull(config.intervalFunction());
  }

  @Test
  void shouldRejectValuesOfWrongType() {
    assertThrows(
        InvalidRetryConfigException.class,
        () -> RetryConfigReader.read(Map.of("max-attempts", "three")));
    assertThrows(
        InvalidRetryConfigException.class,
        () -> RetryConfigReader.read(Map.of("retry-exceptions", List.of(String.class))));
    assertThrows(
        InvalidRetryConfigException.class,
        () -> RetryConfigReader.read(Map.of("fail-after-max-attempts", "yes")));
  }

  @Test
  void shouldValidateReadValues() {
    assertThrows(
        InvalidRetryConfigException.class, () -> RetryConfigReader.read(Map.of("max-attempts", 0)));
  }
}
