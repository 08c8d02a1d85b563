package com.retryengine.core.config;

import com.retryengine.core.errors.InvalidRetryConfigException;
import com.retryengine.core.interval.IntervalBiFunction;
import com.retryengine.core.interval.IntervalFunction;
import com.retryengine.core.interval.IntervalFunctions;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Immutable retry policy parameters. Instances are created through {@link #custom()} or {@link
 * #from(RetryConfig)} and validated on {@link Builder#build()}.
 */
public final class RetryConfig {
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_WAIT_DURATION = IntervalFunctions.DEFAULT_INTERVAL;

  private static final RetryConfig DEFAULTS = new Builder().build();

  private final int maxAttempts;
  private final Duration waitDuration;
  private final IntervalFunction intervalFunction;
  private final IntervalBiFunction intervalBiFunction;
  private final boolean derivedInterval;
  private final Predicate<Object> resultRetryPredicate;
  private final Predicate<Throwable> exceptionRetryPredicate;
  private final Set<Class<? extends Throwable>> retryExceptions;
  private final Set<Class<? extends Throwable>> ignoreExceptions;
  private final boolean failAfterMaxAttempts;

  private RetryConfig(Builder builder) {
    this.maxAttempts = builder.maxAttempts;
    this.waitDuration = builder.waitDuration;
    this.derivedInterval = builder.intervalFunction == null && builder.intervalBiFunction == null;
    this.intervalFunction =
        derivedInterval ? IntervalFunctions.fixed(builder.waitDuration) : builder.intervalFunction;
    this.intervalBiFunction = builder.intervalBiFunction;
    this.resultRetryPredicate = builder.resultRetryPredicate;
    this.exceptionRetryPredicate = builder.exceptionRetryPredicate;
    this.retryExceptions = Set.copyOf(builder.retryExceptions);
    this.ignoreExceptions = Set.copyOf(builder.ignoreExceptions);
    this.failAfterMaxAttempts = builder.failAfterMaxAttempts;
  }

  public static RetryConfig ofDefaults() {
    return DEFAULTS;
  }

  public static Builder custom() {
    return new Builder();
  }

  public static Builder from(RetryConfig base) {
    return new Builder(Objects.requireNonNull(base, "base must not be null"));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration waitDuration() {
    return waitDuration;
  }

  /** The configured attempt-only interval function, or {@code null} when a bi-function is set. */
  public IntervalFunction intervalFunction() {
    return intervalFunction;
  }

  /** The effective interval strategy; a plain interval function is adapted. */
  public IntervalBiFunction intervalBiFunction() {
    return intervalBiFunction != null
        ? intervalBiFunction
        : IntervalBiFunction.of(intervalFunction);
  }

  public boolean hasIntervalBiFunction() {
    return intervalBiFunction != null;
  }

  public Predicate<Object> resultRetryPredicate() {
    return resultRetryPredicate;
  }

  public Predicate<Throwable> exceptionRetryPredicate() {
    return exceptionRetryPredicate;
  }

  public Set<Class<? extends Throwable>> retryExceptions() {
    return retryExceptions;
  }

  public Set<Class<? extends Throwable>> ignoreExceptions() {
    return ignoreExceptions;
  }

  public boolean isFailAfterMaxAttempts() {
    return failAfterMaxAttempts;
  }

  @Override
  public String toString() {
    return "RetryConfig{maxAttempts="
        + maxAttempts
        + ", waitDuration="
        + waitDuration
        + ", retryExceptions="
        + retryExceptions
        + ", ignoreExceptions="
        + ignoreExceptions
        + ", failAfterMaxAttempts="
        + failAfterMaxAttempts
        + '}';
  }

  public static final class Builder {
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private Duration waitDuration = DEFAULT_WAIT_DURATION;
    private IntervalFunction intervalFunction;
    private IntervalBiFunction intervalBiFunction;
    private Predicate<Object> resultRetryPredicate = result -> false;
    private Predicate<Throwable> exceptionRetryPredicate = throwable -> true;
    private Set<Class<? extends Throwable>> retryExceptions = new LinkedHashSet<>();
    private Set<Class<? extends Throwable>> ignoreExceptions = new LinkedHashSet<>();
    private boolean failAfterMaxAttempts;

    private Builder() {}

    private Builder(RetryConfig base) {
      this.maxAttempts = base.maxAttempts;
      this.waitDuration = base.waitDuration;
      this.intervalBiFunction = base.intervalBiFunction;
      // a fixed interval derived from waitDuration is rebuilt on build()
      this.intervalFunction = base.derivedInterval ? null : base.intervalFunction;
      this.resultRetryPredicate = base.resultRetryPredicate;
      this.exceptionRetryPredicate = base.exceptionRetryPredicate;
      this.retryExceptions = new LinkedHashSet<>(base.retryExceptions);
      this.ignoreExceptions = new LinkedHashSet<>(base.ignoreExceptions);
      this.failAfterMaxAttempts = base.failAfterMaxAttempts;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Wait used by the default fixed interval when no interval function is set. */
    public Builder waitDuration(Duration waitDuration) {
      this.waitDuration = Objects.requireNonNull(waitDuration, "waitDuration must not be null");
      return this;
    }

    /** Mutually exclusive with {@link #intervalBiFunction(IntervalBiFunction)}. */
    public Builder intervalFunction(IntervalFunction intervalFunction) {
      this.intervalFunction =
          Objects.requireNonNull(intervalFunction, "intervalFunction must not be null");
      return this;
    }

    /** Mutually exclusive with {@link #intervalFunction(IntervalFunction)}. */
    public Builder intervalBiFunction(IntervalBiFunction intervalBiFunction) {
      this.intervalBiFunction =
          Objects.requireNonNull(intervalBiFunction, "intervalBiFunction must not be null");
      return this;
    }

    /** Drops an interval strategy inherited through {@link RetryConfig#from(RetryConfig)}. */
    Builder clearIntervalStrategy() {
      this.intervalFunction = null;
      this.intervalBiFunction = null;
      return this;
    }

    public Builder retryOnResult(Predicate<Object> resultRetryPredicate) {
      this.resultRetryPredicate =
          Objects.requireNonNull(resultRetryPredicate, "resultRetryPredicate must not be null");
      return this;
    }

    public Builder retryOnException(Predicate<Throwable> exceptionRetryPredicate) {
      this.exceptionRetryPredicate =
          Objects.requireNonNull(
              exceptionRetryPredicate, "exceptionRetryPredicate must not be null");
      return this;
    }

    @SafeVarargs
    public final Builder retryExceptions(Class<? extends Throwable>... exceptionTypes) {
      return retryExceptions(List.of(exceptionTypes));
    }

    public Builder retryExceptions(Collection<Class<? extends Throwable>> exceptionTypes) {
      this.retryExceptions = new LinkedHashSet<>(requireTypes(exceptionTypes, "retryExceptions"));
      return this;
    }

    @SafeVarargs
    public final Builder ignoreExceptions(Class<? extends Throwable>... exceptionTypes) {
      return ignoreExceptions(List.of(exceptionTypes));
    }

    public Builder ignoreExceptions(Collection<Class<? extends Throwable>> exceptionTypes) {
      this.ignoreExceptions = new LinkedHashSet<>(requireTypes(exceptionTypes, "ignoreExceptions"));
      return this;
    }

    public Builder failAfterMaxAttempts(boolean failAfterMaxAttempts) {
      this.failAfterMaxAttempts = failAfterMaxAttempts;
      return this;
    }

    public RetryConfig build() {
      if (maxAttempts < 1) {
        throw new InvalidRetryConfigException("maxAttempts must be >= 1 but was " + maxAttempts);
      }
      if (waitDuration.isNegative()) {
        throw new InvalidRetryConfigException("waitDuration must be >= 0 but was " + waitDuration);
      }
      if (intervalFunction != null && intervalBiFunction != null) {
        throw new InvalidRetryConfigException(
            "intervalFunction and intervalBiFunction are mutually exclusive");
      }
      return new RetryConfig(this);
    }

    private static Collection<Class<? extends Throwable>> requireTypes(
        Collection<Class<? extends Throwable>> exceptionTypes, String field) {
      Objects.requireNonNull(exceptionTypes, field + " must not be null");
      for (Class<? extends Throwable> type : exceptionTypes) {
        if (type == null) {
          throw new InvalidRetryConfigException(field + " must not contain null");
        }
      }
      return exceptionTypes;
    }
  }
}
