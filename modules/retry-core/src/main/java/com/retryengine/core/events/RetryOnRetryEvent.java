package com.retryengine.core.events;

import com.retryengine.core.policy.Outcome;
import java.time.Duration;
import java.time.Instant;

public record RetryOnRetryEvent(
    String policyName,
    int attempt,
    Duration waitInterval,
    Outcome<?> lastOutcome,
    Instant creationTime)
    implements RetryEvent {

  @Override
  public EventType eventType() {
    return EventType.RETRY;
  }
}
