package com.retryengine.core.events;

public enum EventType {
  ADDED,
  REMOVED,
  REPLACED,
  RETRY,
  SUCCESS,
  ERROR,
  IGNORED_ERROR;

  public boolean isRegistryEvent() {
    return this == ADDED || this == REMOVED || this == REPLACED;
  }
}
