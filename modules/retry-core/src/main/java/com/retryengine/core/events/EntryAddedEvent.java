package com.retryengine.core.events;

import com.retryengine.core.policy.RetryPolicy;
import java.time.Instant;

public record EntryAddedEvent(String entryName, RetryPolicy addedEntry, Instant creationTime)
    implements RegistryEvent {

  @Override
  public EventType eventType() {
    return EventType.ADDED;
  }
}
