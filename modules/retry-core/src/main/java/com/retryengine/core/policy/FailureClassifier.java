package com.retryengine.core.policy;

import com.retryengine.core.config.RetryConfig;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what an attempt's outcome means for the invocation. Ignored exception types are checked
 * first, then the retryable type allow-list, then the exception predicate.
 */
public class FailureClassifier {
  private static final Logger log = LoggerFactory.getLogger(FailureClassifier.class);

  private final RetryConfig config;

  public FailureClassifier(RetryConfig config) {
    this.config = Objects.requireNonNull(config, "config must not be null");
  }

  public Classification classify(Outcome<?> outcome) {
    Objects.requireNonNull(outcome, "outcome must not be null");
    if (outcome.isSuccess()) {
      return retryOnResult(outcome.value()) ? Classification.RETRY : Classification.SUCCEED;
    }

    Throwable failure = outcome.failure();
    if (matchesAny(config.ignoreExceptions(), failure)) {
      return Classification.FAIL_PERMANENTLY;
    }
    if (!config.retryExceptions().isEmpty() && !matchesAny(config.retryExceptions(), failure)) {
      return Classification.FAIL_PERMANENTLY;
    }
    return retryOnException(failure) ? Classification.RETRY : Classification.FAIL_PERMANENTLY;
  }

  private boolean retryOnResult(Object value) {
    try {
      return config.resultRetryPredicate().test(value);
    } catch (RuntimeException ex) {
      log.warn("Result retry predicate failed, not retrying error={}", ex.toString());
      return false;
    }
  }

  private boolean retryOnException(Throwable failure) {
    try {
      return config.exceptionRetryPredicate().test(failure);
    } catch (RuntimeException ex) {
      log.warn(
          "Exception retry predicate failed, not retrying failure={} error={}",
          failure.getClass().getName(),
          ex.toString());
      return false;
    }
  }

  private static boolean matchesAny(Set<Class<? extends Throwable>> types, Throwable failure) {
    for (Class<? extends Throwable> type : types) {
      if (type.isInstance(failure)) {
        return true;
      }
    }
    return false;
  }
}
