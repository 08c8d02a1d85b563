package com.retryengine.spring.observability;

import com.retryengine.core.events.EntryAddedEvent;
import com.retryengine.core.events.EntryRemovedEvent;
import com.retryengine.core.events.EntryReplacedEvent;
import com.retryengine.core.events.EventFilter;
import com.retryengine.core.events.EventSubscription;
import com.retryengine.core.events.RegistryEvent;
import com.retryengine.core.events.RetryEvent;
import com.retryengine.core.policy.RetryPolicy;
import com.retryengine.core.registry.RetryRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches telemetry and the optional event logger to every policy of a registry, including the
 * ones created after binding. Observation follows the registry key: a removed or replaced policy
 * is detached and its subscriptions are cancelled. One binder serves one registry.
 */
public class RetryRegistryEventBinder {
  private static final Logger log = LoggerFactory.getLogger(RetryRegistryEventBinder.class);

  private final RetryTelemetry telemetry;
  private final Consumer<RetryEvent> eventListener;
  private final Map<String, Attachment> attachments = new HashMap<>();

  public RetryRegistryEventBinder(RetryTelemetry telemetry, Consumer<RetryEvent> eventListener) {
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.eventListener = eventListener;
  }

  public void bind(RetryRegistry registry) {
    // Registry events are handled on the publishing thread so a new policy is observed before use.
    registry.eventPublisher().subscribe(this::onRegistryEvent, EventFilter.all(), Runnable::run);
    registry.allEntries().forEach(this::attach);
  }

  /** Registry names currently observed. */
  public synchronized List<String> observedNames() {
    return List.copyOf(attachments.keySet());
  }

  private void onRegistryEvent(RegistryEvent event) {
    if (event instanceof EntryAddedEvent added) {
      attach(added.entryName(), added.addedEntry());
    } else if (event instanceof EntryRemovedEvent removed) {
      detach(removed.entryName());
    } else if (event instanceof EntryReplacedEvent replaced) {
      detach(replaced.entryName());
      attach(replaced.entryName(), replaced.newEntry());
    }
  }

  private synchronized void attach(String name, RetryPolicy policy) {
    Attachment current = attachments.get(name);
    if (current != null) {
      if (current.policy() == policy) {
        return;
      }
      detach(name);
    }

    telemetry.onPolicyAdded(name, policy);
    List<EventSubscription> subscriptions = new ArrayList<>();
    subscriptions.add(
        policy.eventPublisher().subscribe(event -> telemetry.onRetryEvent(name, event)));
    if (eventListener != null) {
      subscriptions.add(policy.eventPublisher().subscribe(eventListener));
    }
    attachments.put(name, new Attachment(policy, List.copyOf(subscriptions)));
    log.debug("Observing retry policy name={}", name);
  }

  private synchronized void detach(String name) {
    Attachment attachment = attachments.remove(name);
    if (attachment == null) {
      return;
    }
    attachment.subscriptions().forEach(EventSubscription::cancel);
    telemetry.onPolicyRemoved(name, attachment.policy());
    log.debug("Stopped observing retry policy name={}", name);
  }

  private record Attachment(RetryPolicy policy, List<EventSubscription> subscriptions) {}
}
