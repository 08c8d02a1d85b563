package com.retryengine.core.config;

import com.retryengine.core.errors.InvalidRetryConfigException;
import com.retryengine.core.interval.IntervalBiFunction;
import com.retryengine.core.interval.IntervalFunction;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Builds a {@link RetryConfig} from the key/value configuration surface. Values are typed objects
 * (numbers, durations, strategy instances, classes); unknown keys are ignored.
 */
public final class RetryConfigReader {
  public static final String MAX_ATTEMPTS = "max-attempts";
  public static final String WAIT_DURATION = "wait-duration";
  public static final String INTERVAL_FUNCTION = "interval-function";
  public static final String INTERVAL_BI_FUNCTION = "interval-bi-function";
  public static final String RETRY_ON_RESULT_PREDICATE = "retry-on-result-predicate";
  public static final String RETRY_EXCEPTION_PREDICATE = "retry-exception-predicate";
  public static final String RETRY_EXCEPTIONS = "retry-exceptions";
  public static final String IGNORE_EXCEPTIONS = "ignore-exceptions";
  public static final String FAIL_AFTER_MAX_ATTEMPTS = "fail-after-max-attempts";

  private RetryConfigReader() {}

  public static RetryConfig read(Map<String, ?> values) {
    return read(values, RetryConfig.ofDefaults());
  }

  public static RetryConfig read(Map<String, ?> values, RetryConfig base) {
    Objects.requireNonNull(values, "values must not be null");
    RetryConfig.Builder builder = RetryConfig.from(base);

    if (values.get(INTERVAL_FUNCTION) != null && values.get(INTERVAL_BI_FUNCTION) != null) {
      throw new InvalidRetryConfigException(
          INTERVAL_FUNCTION + " and " + INTERVAL_BI_FUNCTION + " are mutually exclusive");
    }

    Object maxAttempts = values.get(MAX_ATTEMPTS);
    if (maxAttempts != null) {
      builder.maxAttempts(asInt(MAX_ATTEMPTS, maxAttempts));
    }
    Object waitDuration = values.get(WAIT_DURATION);
    if (waitDuration != null) {
      builder.waitDuration(asDuration(WAIT_DURATION, waitDuration));
    }
    // a strategy given here replaces whichever one the base config carried
    Object intervalFunction = values.get(INTERVAL_FUNCTION);
    if (intervalFunction != null) {
      builder
          .clearIntervalStrategy()
          .intervalFunction(asType(INTERVAL_FUNCTION, intervalFunction, IntervalFunction.class));
    }
    Object intervalBiFunction = values.get(INTERVAL_BI_FUNCTION);
    if (intervalBiFunction != null) {
      builder
          .clearIntervalStrategy()
          .intervalBiFunction(
              asType(INTERVAL_BI_FUNCTION, intervalBiFunction, IntervalBiFunction.class));
    }
    Object resultPredicate = values.get(RETRY_ON_RESULT_PREDICATE);
    if (resultPredicate != null) {
      builder.retryOnResult(asPredicate(RETRY_ON_RESULT_PREDICATE, resultPredicate));
    }
    Object exceptionPredicate = values.get(RETRY_EXCEPTION_PREDICATE);
    if (exceptionPredicate != null) {
      builder.retryOnException(asPredicate(RETRY_EXCEPTION_PREDICATE, exceptionPredicate));
    }
    Object retryExceptions = values.get(RETRY_EXCEPTIONS);
    if (retryExceptions != null) {
      builder.retryExceptions(asExceptionTypes(RETRY_EXCEPTIONS, retryExceptions));
    }
    Object ignoreExceptions = values.get(IGNORE_EXCEPTIONS);
    if (ignoreExceptions != null) {
      builder.ignoreExceptions(asExceptionTypes(IGNORE_EXCEPTIONS, ignoreExceptions));
    }
    Object failAfterMaxAttempts = values.get(FAIL_AFTER_MAX_ATTEMPTS);
    if (failAfterMaxAttempts != null) {
      builder.failAfterMaxAttempts(
          asType(FAIL_AFTER_MAX_ATTEMPTS, failAfterMaxAttempts, Boolean.class));
    }
    return builder.build();
  }

  private static int asInt(String key, Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short) {
      long number = ((Number) value).longValue();
      if (number > Integer.MAX_VALUE || number < Integer.MIN_VALUE) {
        throw new InvalidRetryConfigException(key + " is out of range: " + value);
      }
      return (int) number;
    }
    throw typeMismatch(key, value, "an integer");
  }

  private static Duration asDuration(String key, Object value) {
    if (value instanceof Duration duration) {
      return duration;
    }
    if (value instanceof Integer || value instanceof Long) {
      return Duration.ofMillis(((Number) value).longValue());
    }
    throw typeMismatch(key, value, "a Duration or a number of milliseconds");
  }

  @SuppressWarnings("unchecked")
  private static <T> Predicate<T> asPredicate(String key, Object value) {
    if (value instanceof Predicate<?> predicate) {
      return (Predicate<T>) predicate;
    }
    throw typeMismatch(key, value, "a java.util.function.Predicate");
  }

  private static List<Class<? extends Throwable>> asExceptionTypes(String key, Object value) {
    if (!(value instanceof Collection<?> collection)) {
      throw typeMismatch(key, value, "a collection of exception classes");
    }
    List<Class<? extends Throwable>> types = new ArrayList<>();
    for (Object element : collection) {
      if (!(element instanceof Class<?> type) || !Throwable.class.isAssignableFrom(type)) {
        throw new InvalidRetryConfigException(
            key + " must only contain Throwable subclasses but found " + element);
      }
      types.add(type.asSubclass(Throwable.class));
    }
    return types;
  }

  private static <T> T asType(String key, Object value, Class<T> type) {
    if (type.isInstance(value)) {
      return type.cast(value);
    }
    throw typeMismatch(key, value, "a " + type.getName());
  }

  private static InvalidRetryConfigException typeMismatch(
      String key, Object value, String expected) {
    return new InvalidRetryConfigException(
        String.format(
            "%s must be %s but was %s", key, expected, value.getClass().getName()));
  }
}
