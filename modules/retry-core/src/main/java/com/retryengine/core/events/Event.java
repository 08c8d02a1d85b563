package com.retryengine.core.events;

import java.time.Instant;

public interface Event {
  EventType eventType();

  Instant creationTime();
}
