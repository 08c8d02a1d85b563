package com.retryengine.core.registry;

import com.retryengine.core.config.RetryConfig;
import com.retryengine.core.errors.ConfigurationNotFoundException;
import com.retryengine.core.events.EntryAddedEvent;
import com.retryengine.core.events.EntryRemovedEvent;
import com.retryengine.core.events.EntryReplacedEvent;
import com.retryengine.core.events.EventBus;
import com.retryengine.core.events.RegistryEvent;
import com.retryengine.core.policy.RetryPolicy;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Concurrent store of named retry policies and named configurations. The {@value #DEFAULT_CONFIG}
 * configuration is always present.
 *
 * <p>The registry key is authoritative: {@link #replace(String, RetryPolicy)} binds a policy under a
 * key even when the policy carries a different name of its own.
 */
public class RetryRegistry {
  private static final Logger log = LoggerFactory.getLogger(RetryRegistry.class);

  public static final String DEFAULT_CONFIG = "default";

  private final ConcurrentMap<String, RetryPolicy> entries = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, RetryConfig> configurations = new ConcurrentHashMap<>();
  private final EventBus<RegistryEvent> eventPublisher;
  private final Clock clock;
  private final Executor eventExecutor;

  private RetryRegistry(Builder builder) {
    this.clock = builder.clock;
    this.eventExecutor = builder.eventExecutor;
    this.eventPublisher = new EventBus<>("registry", eventExecutor);
    configurations.put(DEFAULT_CONFIG, RetryConfig.ofDefaults());
    configurations.putAll(builder.seedConfigs);
  }

  public static RetryRegistry ofDefaults() {
    return builder().build();
  }

  /**
   * Creates a registry holding {@code seedConfigs}; an entry named {@value #DEFAULT_CONFIG}
   * replaces the library defaults.
   */
  public static RetryRegistry of(Map<String, RetryConfig> seedConfigs) {
    return builder().seedConfigs(seedConfigs).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public RetryConfig defaultConfig() {
    return configurations.get(DEFAULT_CONFIG);
  }

  public Optional<RetryConfig> configuration(String configName) {
    return Optional.ofNullable(configurations.get(requireName(configName, "configName")));
  }

  /** Registers {@code config} under {@code configName}, overwriting any earlier binding. */
  public void addConfiguration(String configName, RetryConfig config) {
    requireName(configName, "configName");
    Objects.requireNonNull(config, "config must not be null");
    configurations.put(configName, config);
    log.debug("Registered retry configuration name={}", configName);
  }

  /** Returns the policy bound to {@code name}, creating it with the default config if absent. */
  public RetryPolicy retry(String name) {
    return lookupOrCreate(name, this::defaultConfig);
  }

  /**
   * Returns the policy bound to {@code name}, creating it with the configuration registered as
   * {@code configName} if absent.
   *
   * @throws ConfigurationNotFoundException when a policy has to be created and no configuration is
   *     registered under {@code configName}
   */
  public RetryPolicy retry(String name, String configName) {
    requireName(configName, "configName");
    return lookupOrCreate(
        name,
        () -> {
          RetryConfig config = configurations.get(configName);
          if (config == null) {
            throw new ConfigurationNotFoundException(configName);
          }
          return config;
        });
  }

  /** Returns the policy bound to {@code name}, creating it with {@code config} if absent. */
  public RetryPolicy retry(String name, RetryConfig config) {
    Objects.requireNonNull(config, "config must not be null");
    return lookupOrCreate(name, () -> config);
  }

  public Optional<RetryPolicy> find(String name) {
    return Optional.ofNullable(entries.get(requireName(name, "name")));
  }

  public Optional<RetryPolicy> remove(String name) {
    RetryPolicy removed = entries.remove(requireName(name, "name"));
    if (removed != null) {
      eventPublisher.publish(new EntryRemovedEvent(name, removed, clock.instant()));
    }
    return Optional.ofNullable(removed);
  }

  /**
   * Rebinds an existing {@code name} to {@code newPolicy}. Absent names are left untouched. The
   * policy is not renamed.
   */
  public Optional<RetryPolicy> replace(String name, RetryPolicy newPolicy) {
    requireName(name, "name");
    Objects.requireNonNull(newPolicy, "newPolicy must not be null");
    RetryPolicy previous = entries.replace(name, newPolicy);
    if (previous != null) {
      eventPublisher.publish(new EntryReplacedEvent(name, previous, newPolicy, clock.instant()));
    }
    return Optional.ofNullable(previous);
  }

  public Set<RetryPolicy> allRetryPolicies() {
    return Set.copyOf(entries.values());
  }

  /** Snapshot of the registry keys and the policies bound to them. */
  public Map<String, RetryPolicy> allEntries() {
    return Map.copyOf(entries);
  }

  public EventBus<RegistryEvent> eventPublisher() {
    return eventPublisher;
  }

  private RetryPolicy lookupOrCreate(String name, Supplier<RetryConfig> configSupplier) {
    requireName(name, "name");
    RetryPolicy existing = entries.get(name);
    if (existing != null) {
      return existing;
    }

    RetryPolicy[] created = new RetryPolicy[1];
    RetryPolicy policy =
        entries.computeIfAbsent(
            name,
            key -> {
              created[0] = RetryPolicy.of(key, configSupplier.get(), clock, eventExecutor);
              return created[0];
            });
    if (policy == created[0]) {
      log.debug("Created retry policy name={}", name);
      eventPublisher.publish(new EntryAddedEvent(name, policy, clock.instant()));
    }
    return policy;
  }

  private static String requireName(String name, String field) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException(field + " must not be blank");
    }
    return name;
  }

  public static final class Builder {
    private final Map<String, RetryConfig> seedConfigs = new LinkedHashMap<>();
    private Clock clock = Clock.systemUTC();
    private Executor eventExecutor = ForkJoinPool.commonPool();

    private Builder() {}

    public Builder seedConfigs(Map<String, RetryConfig> seedConfigs) {
      Objects.requireNonNull(seedConfigs, "seedConfigs must not be null");
      seedConfigs.forEach(this::seedConfig);
      return this;
    }

    public Builder seedConfig(String configName, RetryConfig config) {
      requireName(configName, "configName");
      seedConfigs.put(configName, Objects.requireNonNull(config, "config must not be null"));
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock must not be null");
      return this;
    }

    /** Executor that delivers callback subscriptions of the registry and of its policies. */
    public Builder eventExecutor(Executor eventExecutor) {
      this.eventExecutor = Objects.requireNonNull(eventExecutor, "eventExecutor must not be null");
      return this;
    }

    public RetryRegistry build() {
      return new RetryRegistry(this);
    }
  }
}
