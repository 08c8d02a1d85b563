package com.retryengine.core.events;

/** Published by a retry registry whenever its name to policy mapping changes. */
public interface RegistryEvent extends Event {
  /** The registry key that changed; a policy may carry a different name of its own. */
  String entryName();
}
