package com.retryengine.core.policy;

import com.retryengine.core.config.RetryConfig;
import com.retryengine.core.events.EventBus;
import com.retryengine.core.events.RetryEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * A reusable retry policy bound to one {@link RetryConfig}. Each invocation runs in its own {@link
 * RetryContext}; metrics and the event stream are shared by all invocations.
 */
public final class RetryPolicy {
  private final String name;
  private final RetryConfig config;
  private final FailureClassifier classifier;
  private final RetryMetrics metrics = new RetryMetrics();
  private final EventBus<RetryEvent> eventPublisher;
  private final Clock clock;

  private RetryPolicy(String name, RetryConfig config, Clock clock, Executor eventExecutor) {
    this.name = name;
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.classifier = new FailureClassifier(config);
    this.eventPublisher =
        new EventBus<>(
            "retry:" + (name == null ? "unnamed" : name),
            Objects.requireNonNull(eventExecutor, "eventExecutor must not be null"));
  }

  public static RetryPolicy of(String name, RetryConfig config) {
    return of(name, config, Clock.systemUTC(), ForkJoinPool.commonPool());
  }

  public static RetryPolicy of(
      String name, RetryConfig config, Clock clock, Executor eventExecutor) {
    if (name != null && name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    return new RetryPolicy(name, config, clock, eventExecutor);
  }

  /** An unnamed policy, for callers that do not keep policies in a registry. */
  public static RetryPolicy of(RetryConfig config) {
    return of(null, config);
  }

  public static RetryPolicy ofDefaults(String name) {
    return of(name, RetryConfig.ofDefaults());
  }

  public Optional<String> name() {
    return Optional.ofNullable(name);
  }

  public RetryConfig config() {
    return config;
  }

  public RetryMetrics metrics() {
    return metrics;
  }

  public EventBus<RetryEvent> eventPublisher() {
    return eventPublisher;
  }

  /** Opens the state of a new, independent invocation. */
  public <T> RetryContext<T> context() {
    return new RetryContext<>(this);
  }

  FailureClassifier classifier() {
    return classifier;
  }

  String eventName() {
    return name;
  }

  Instant now() {
    return clock.instant();
  }

  @Override
  public String toString() {
    return "RetryPolicy{name=" + (name == null ? "unnamed" : name) + ", config=" + config + '}';
  }
}
