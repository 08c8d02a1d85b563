package com.retryengine.core.events;

public interface EventSubscription {
  EventFilter filter();

  /** Events this subscriber lost because its buffer was full or its consumer threw. */
  long droppedEvents();

  boolean isCancelled();

  void cancel();
}
