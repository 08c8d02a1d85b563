package com.retryengine.core.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.retryengine.core.config.RetryConfig;
import com.retryengine.core.errors.ConfigurationNotFoundException;
import com.retryengine.core.events.EntryAddedEvent;
import com.retryengine.core.events.EntryRemovedEvent;
import com.retryengine.core.events.EntryReplacedEvent;
import com.retryengine.core.events.Event;
import com.retryengine.core.events.EventFilter;
import com.retryengine.core.events.EventType;
import com.retryengine.core.policy.RetryPolicy;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class RetryRegistryTest {
  private static final Instant NOW = Instant.parse("2026-03-01T09:30:00Z");

  private final RetryRegistry registry =
      RetryRegistry.builder()
          .clock(Clock.fixed(NOW, ZoneOffset.UTC))
          .eventExecutor(Runnable::run)
          .build();

  @Test
  void shouldAlwaysExposeDefaultConfiguration() {
    RetryConfig defaults = RetryRegistry.ofDefaults().defaultConfig();

    assertEquals(3, defaults.maxAttempts());
    assertTrue(RetryRegistry.ofDefaults().configuration(RetryRegistry.DEFAULT_CONFIG).isPresent());
  }

  @Test
  void shouldLetSeedConfigurationOverrideDefault() {
    RetryConfig custom = RetryConfig.custom().maxAttempts(7).build();
    RetryConfig slow = RetryConfig.custom().maxAttempts(2).build();

    RetryRegistry seeded =
        RetryRegistry.of(Map.of(RetryRegistry.DEFAULT_CONFIG, custom, "slow", slow));

    assertSame(custom, seeded.defaultConfig());
    assertSame(slow, seeded.configuration("slow").orElseThrow());
    assertEquals(7, seeded.retry("orders").config().maxAttempts());
  }

  @Test
  void shouldCreatePolicyFromNamedConfiguration() {
    RetryConfig aggressive = RetryConfig.custom().maxAttempts(10).build();
    registry.addConfiguration("aggressive", aggressive);

    RetryPolicy policy = registry.retry("binance", "aggressive");

    assertSame(aggressive, policy.config());
    assertEquals("binance", policy.name().orElseThrow());
  }

  @Test
  void shouldOverwriteConfigurationWithSameName() {
    registry.addConfiguration("shared", RetryConfig.custom().maxAttempts(2).build());
    registry.addConfiguration("shared", RetryConfig.custom().maxAttempts(5).build());

    assertEquals(5, registry.configuration("shared").orElseThrow().maxAttempts());
  }

  @Test
  void shouldFailWhenNamedConfigurationIsMissing() {
    ConfigurationNotFoundException thrown =
        assertThrows(ConfigurationNotFoundException.class, () -> registry.retry("orders", "missing"));

    assertEquals("missing", thrown.configName());
    assertTrue(registry.find("orders").isEmpty());
  }

  @Test
  void shouldReturnExistingPolicyEvenWhenConfigurationIsMissing() {
    RetryPolicy existing = registry.retry("orders");

    assertSame(existing, registry.retry("orders", "missing"));
  }

  @Test
  void shouldIgnoreSuppliedConfigForExistingPolicy() {
    RetryPolicy first = registry.retry("orders", RetryConfig.custom().maxAttempts(4).build());
    RetryPolicy second = registry.retry("orders", RetryConfig.custom().maxAttempts(9).build());

    assertSame(first, second);
    assertEquals(4, second.config().maxAttempts());
  }

  @Test
  void shouldRejectBlankNames() {
    assertThrows(IllegalArgumentException.class, () -> registry.retry(" "));
    assertThrows(IllegalArgumentException.class, () -> registry.find(null));
    assertThrows(
        IllegalArgumentException.class,
        () -> registry.addConfiguration("", RetryConfig.ofDefaults()));
  }

  @Test
  void shouldCreateExactlyOnePolicyUnderConcurrentLookups() throws Exception {
    BlockingQueue<Event> added = new ArrayBlockingQueue<>(64);
    registry.eventPublisher().subscribe(added, EventFilter.only(EventType.ADDED));
    int callers = 32;
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<RetryPolicy>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < callers; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  return registry.retry("contended");
                }));
      }
      start.countDown();
      Set<RetryPolicy> distinct = new HashSet<>();
      for (Future<RetryPolicy> future : futures) {
        distinct.add(future.get(10, TimeUnit.SECONDS));
      }

      assertEquals(1, distinct.size());
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, added.size());
    assertEquals(1, registry.allRetryPolicies().size());
  }

  @Test
  void shouldPublishAddedEventWithCreationTime() {
    BlockingQueue<Event> events = new ArrayBlockingQueue<>(10);
    registry.eventPublisher().subscribe(events, EventFilter.all());

    RetryPolicy policy = registry.retry("orders");
    registry.retry("orders");

    EntryAddedEvent added = assertInstanceOf(EntryAddedEvent.class, events.poll());
    assertSame(policy, added.addedEntry());
    assertEquals("orders", added.entryName());
    assertEquals(NOW, added.creationTime());
    assertTrue(events.isEmpty());
  }

  @Test
  void shouldRemovePolicyAndPublishRemovedEvent() {
    BlockingQueue<Event> events = new ArrayBlockingQueue<>(10);
    RetryPolicy policy = registry.retry("orders");
    registry.eventPublisher().subscribe(events, EventFilter.all());

    assertSame(policy, registry.remove("orders").orElseThrow());
    assertTrue(registry.remove("orders").isEmpty());

    EntryRemovedEvent removed = assertInstanceOf(EntryRemovedEvent.class, events.poll());
    assertSame(policy, removed.removedEntry());
    assertEquals("orders", removed.entryName());
    assertTrue(events.isEmpty());
    assertTrue(registry.find("orders").isEmpty());
  }

  @Test
  void shouldReplaceOnlyExistingBinding() {
    RetryPolicy replacement = RetryPolicy.of("orders", RetryConfig.ofDefaults());

    assertTrue(registry.replace("orders", replacement).isEmpty());
    assertTrue(registry.find("orders").isEmpty());

    RetryPolicy original = registry.retry("orders");
    BlockingQueue<Event> events = new ArrayBlockingQueue<>(10);
    registry.eventPublisher().subscribe(events, EventFilter.all());

    assertSame(original, registry.replace("orders", replacement).orElseThrow());
    assertSame(replacement, registry.find("orders").orElseThrow());
    EntryReplacedEvent replaced = assertInstanceOf(EntryReplacedEvent.class, events.poll());
    assertSame(original, replaced.oldEntry());
    assertSame(replacement, replaced.newEntry());
  }

  @Test
  void shouldBindReplacementUnderKeyEvenWhenPolicyNameDiffers() {
    registry.retry("orders");
    RetryPolicy foreign = RetryPolicy.of("payments", RetryConfig.ofDefaults());
    BlockingQueue<Event> events = new ArrayBlockingQueue<>(10);
    registry.eventPublisher().subscribe(events, EventFilter.all());

    registry.replace("orders", foreign);

    RetryPolicy bound = registry.find("orders").orElseThrow();
    assertSame(foreign, bound);
    assertEquals("payments", bound.name().orElseThrow());
    assertTrue(registry.find("payments").isEmpty());
    assertEquals(Map.of("orders", foreign), registry.allEntries());
    EntryReplacedEvent replaced = assertInstanceOf(EntryReplacedEvent.class, events.poll());
    assertEquals("orders", replaced.entryName());
  }

  @Test
  void shouldDeliverOnlyRequestedRegistryEvents() {
    BlockingQueue<Event> onlyAdded = new ArrayBlockingQueue<>(10);
    BlockingQueue<Event> exceptAdded = new ArrayBlockingQueue<>(10);
    BlockingQueue<Event> onlyWins = new ArrayBlockingQueue<>(10);
    registry.eventPublisher().subscribe(onlyAdded, EventFilter.only(EventType.ADDED));
    registry.eventPublisher().subscribe(exceptAdded, EventFilter.exclude(EventType.ADDED));
    registry
        .eventPublisher()
        .subscribe(
            onlyWins, EventFilter.of(Set.of(EventType.REMOVED), Set.of(EventType.REMOVED)));

    registry.retry("orders");
    registry.remove("orders");

    assertEquals(EventType.ADDED, onlyAdded.poll().eventType());
    assertTrue(onlyAdded.isEmpty());
    assertEquals(EventType.REMOVED, exceptAdded.poll().eventType());
    assertTrue(exceptAdded.isEmpty());
    assertEquals(EventType.REMOVED, onlyWins.poll().eventType());
    assertTrue(onlyWins.isEmpty());
  }

  @Test
  void shouldShareEventExecutorWithCreatedPolicies() {
    List<Event> received = new ArrayList<>();
    RetryPolicy policy = registry.retry("orders");

    policy.eventPublisher().subscribe(received::add);
    policy.<String>context().onError(new IllegalStateException("boom"));

    assertEquals(1, received.size());
    assertEquals(EventType.RETRY, received.get(0).eventType());
  }

  @Test
  void shouldReturnSnapshotOfPolicies() {
    RetryPolicy orders = registry.retry("orders");
    Set<RetryPolicy> snapshot = registry.allRetryPolicies();
    RetryPolicy payments = registry.retry("payments");

    assertEquals(Set.of(orders), snapshot);
    assertFalse(snapshot.contains(payments));
    assertNotSame(orders, payments);
  }
}
