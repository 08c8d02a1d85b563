package com.retryengine.core.execution;

import com.retryengine.core.policy.AttemptDecision;
import com.retryengine.core.policy.RetryContext;
import com.retryengine.core.policy.RetryPolicy;
import com.retryengine.core.registry.RetryRegistry;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Runs work units under a {@link RetryPolicy} on the calling thread, sleeping between attempts.
 * Errors ({@link Error}) are never classified and propagate from the attempt that raised them.
 */
public class RetryExecutor {
  private final Sleeper sleeper;

  public RetryExecutor() {
    this(duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000));
  }

  public RetryExecutor(Sleeper sleeper) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
  }

  public <T> T execute(RetryPolicy policy, Callable<T> work) throws Exception {
    Objects.requireNonNull(policy, "policy must not be null");
    Objects.requireNonNull(work, "work must not be null");
    RetryContext<T> context = policy.context();
    while (true) {
      AttemptDecision<T> decision;
      try {
        decision = context.onResult(work.call());
      } catch (Exception ex) {
        decision = context.onError(ex);
      }
      if (!decision.shouldRetry()) {
        return decision.resultOrThrow();
      }
      sleep(decision.waitInterval());
      context.resume();
    }
  }

  public <T> T execute(RetryPolicy policy, WorkUnit<T> work, Object... args) throws Exception {
    Objects.requireNonNull(work, "work must not be null");
    Object[] arguments = args == null ? new Object[0] : args.clone();
    return execute(policy, () -> work.call(arguments));
  }

  /** Looks up or creates {@code name} in {@code registry} with its default config, then executes. */
  public <T> T execute(RetryRegistry registry, String name, Callable<T> work) throws Exception {
    Objects.requireNonNull(registry, "registry must not be null");
    return execute(registry.retry(name), work);
  }

  /** Like {@link #execute(RetryPolicy, Callable)} for work that only throws unchecked exceptions. */
  public <T> T executeSupplier(RetryPolicy policy, Supplier<T> work) {
    Objects.requireNonNull(work, "work must not be null");
    try {
      return execute(policy, work::get);
    } catch (RuntimeException ex) {
      throw ex;
    } catch (Exception ex) {
      throw new IllegalStateException("Supplier threw a checked exception", ex);
    }
  }

  public <T> Callable<T> decorateCallable(RetryPolicy policy, Callable<T> work) {
    Objects.requireNonNull(policy, "policy must not be null");
    Objects.requireNonNull(work, "work must not be null");
    return () -> execute(policy, work);
  }

  private void sleep(Duration duration) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      return;
    }
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted during retry backoff", interrupted);
    }
  }
}
