package com.retryengine.core.events;

import com.retryengine.core.policy.Outcome;
import java.time.Instant;

public record RetryOnIgnoredErrorEvent(
    String policyName, int attempt, Outcome<?> lastOutcome, Instant creationTime)
    implements RetryEvent {

  @Override
  public EventType eventType() {
    return EventType.IGNORED_ERROR;
  }
}
