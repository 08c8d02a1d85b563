package com.retryengine.core.events;

import com.retryengine.core.policy.RetryPolicy;
import java.time.Instant;

public record EntryRemovedEvent(
    String entryName, RetryPolicy removedEntry, Instant creationTime)
    implements RegistryEvent {

  @Override
  public EventType eventType() {
    return EventType.REMOVED;
  }
}
