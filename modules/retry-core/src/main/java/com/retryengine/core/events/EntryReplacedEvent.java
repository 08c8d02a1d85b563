package com.retryengine.core.events;

import com.retryengine.core.policy.RetryPolicy;
import java.time.Instant;

public record EntryReplacedEvent(
    String entryName, RetryPolicy oldEntry, RetryPolicy newEntry, Instant creationTime)
    implements RegistryEvent {

  @Override
  public EventType eventType() {
    return EventType.REPLACED;
  }
}
