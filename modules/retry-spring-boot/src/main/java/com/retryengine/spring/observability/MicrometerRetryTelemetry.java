package com.retryengine.spring.observability;

import com.retryengine.core.events.RetryEvent;
import com.retryengine.core.policy.RetryMetrics;
import com.retryengine.core.policy.RetryPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.function.ToDoubleFunction;

/**
 * Publishes policy call counters as {@code retry.calls} function counters and counts attempt events
 * as {@code retry.events}. Both are tagged with the registry name, not the policy's own name.
 */
public class MicrometerRetryTelemetry implements RetryTelemetry {
  static final String CALLS = "retry.calls";
  static final String EVENTS = "retry.events";

  private final MeterRegistry meterRegistry;

  public MicrometerRetryTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onPolicyAdded(String name, RetryPolicy policy) {
    String tagName = safeValue(name);
    RetryMetrics metrics = policy.metrics();
    registerCalls(tagName, "successful_without_retry", metrics, RetryMetrics::succeededWithoutRetry);
    registerCalls(tagName, "successful_with_retry", metrics, RetryMetrics::succeededWithRetry);
    registerCalls(tagName, "failed_without_retry", metrics, RetryMetrics::failedWithoutRetry);
    registerCalls(tagName, "failed_with_retry", metrics, RetryMetrics::failedWithRetry);
  }

  /** Drops the call counters of {@code name}; its event counters keep their totals. */
  @Override
  public void onPolicyRemoved(String name, RetryPolicy policy) {
    meterRegistry
        .find(CALLS)
        .tag("name", safeValue(name))
        .functionCounters()
        .forEach(meterRegistry::remove);
  }

  @Override
  public void onRetryEvent(String name, RetryEvent event) {
    Counter.builder(EVENTS)
        .description("Retry attempt events by type")
        .tag("name", safeValue(name))
        .tag("type", event.eventType().name().toLowerCase())
        .tag("error", safeError(event.lastThrowable()))
        .register(meterRegistry)
        .increment();
  }

  private void registerCalls(
      String name, String kind, RetryMetrics metrics, ToDoubleFunction<RetryMetrics> count) {
    FunctionCounter.builder(CALLS, metrics, count)
        .description("Calls completed under a retry policy by outcome")
        .tag("name", name)
        .tag("kind", kind)
        .register(meterRegistry);
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
