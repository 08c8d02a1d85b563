package com.retryengine.spring.config;

import com.retryengine.core.config.RetryConfig;
import com.retryengine.core.config.RetryConfigReader;
import com.retryengine.core.errors.InvalidRetryConfigException;
import com.retryengine.core.interval.IntervalBiFunction;
import com.retryengine.core.interval.IntervalFunction;
import com.retryengine.core.interval.IntervalFunctions;
import com.retryengine.core.registry.RetryRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Turns bound {@link RetryEngineProperties.Config} entries into {@link RetryConfig}s. Strategy and
 * predicate classes are instantiated through their public no-arg constructor.
 */
public final class RetryConfigFactory {
  private RetryConfigFactory() {}

  /**
   * Resolves every named config. A config without {@code base-config} inherits from the {@code
   * default} entry, which itself starts from the library defaults. An inherited {@code backoff} is
   * rebuilt from the inheriting config's own {@code wait-duration}.
   */
  public static Map<String, RetryConfig> createAll(Map<String, RetryEngineProperties.Config> configs) {
    Map<String, RetryConfig> resolved = new LinkedHashMap<>();
    if (configs == null) {
      return resolved;
    }
    Map<String, RetryEngineProperties.Backoff> backoffs = new HashMap<>();
    for (String name : configs.keySet()) {
      resolve(name, configs, resolved, backoffs, new LinkedHashSet<>());
    }
    return resolved;
  }

  public static RetryConfig create(RetryEngineProperties.Config config, RetryConfig base) {
    return create(config, base, null);
  }

  /** Like {@link #create(RetryEngineProperties.Config, RetryConfig)} with the base's backoff. */
  public static RetryConfig create(
      RetryEngineProperties.Config config,
      RetryConfig base,
      RetryEngineProperties.Backoff inheritedBackoff) {
    if (config == null) {
      return base;
    }

    Map<String, Object> values = new HashMap<>();
    values.put(RetryConfigReader.MAX_ATTEMPTS, config.getMaxAttempts());
    values.put(RetryConfigReader.WAIT_DURATION, config.getWaitDuration());
    values.put(RetryConfigReader.FAIL_AFTER_MAX_ATTEMPTS, config.getFailAfterMaxAttempts());
    if (hasText(config.getIntervalFunction())) {
      values.put(
          RetryConfigReader.INTERVAL_FUNCTION,
          instantiate(
              RetryConfigReader.INTERVAL_FUNCTION,
              config.getIntervalFunction(),
              IntervalFunction.class));
    }
    if (hasText(config.getIntervalBiFunction())) {
      values.put(
          RetryConfigReader.INTERVAL_BI_FUNCTION,
          instantiate(
              RetryConfigReader.INTERVAL_BI_FUNCTION,
              config.getIntervalBiFunction(),
              IntervalBiFunction.class));
    }
    if (!hasText(config.getIntervalFunction()) && !hasText(config.getIntervalBiFunction())) {
      Duration waitDuration =
          config.getWaitDuration() == null ? base.waitDuration() : config.getWaitDuration();
      IntervalFunction backoff =
          backoffInterval(effectiveBackoff(config, inheritedBackoff), waitDuration);
      if (backoff != null) {
        values.put(RetryConfigReader.INTERVAL_FUNCTION, backoff);
      }
    }
    if (hasText(config.getRetryOnResultPredicate())) {
      values.put(
          RetryConfigReader.RETRY_ON_RESULT_PREDICATE,
          instantiate(
              RetryConfigReader.RETRY_ON_RESULT_PREDICATE,
              config.getRetryOnResultPredicate(),
              Predicate.class));
    }
    if (hasText(config.getRetryExceptionPredicate())) {
      values.put(
          RetryConfigReader.RETRY_EXCEPTION_PREDICATE,
          instantiate(
              RetryConfigReader.RETRY_EXCEPTION_PREDICATE,
              config.getRetryExceptionPredicate(),
              Predicate.class));
    }
    List<Class<? extends Throwable>> retryExceptions =
        resolveExceptionTypes(RetryConfigReader.RETRY_EXCEPTIONS, config.getRetryExceptions());
    if (!retryExceptions.isEmpty()) {
      values.put(RetryConfigReader.RETRY_EXCEPTIONS, retryExceptions);
    }
    List<Class<? extends Throwable>> ignoreExceptions =
        resolveExceptionTypes(RetryConfigReader.IGNORE_EXCEPTIONS, config.getIgnoreExceptions());
    if (!ignoreExceptions.isEmpty()) {
      values.put(RetryConfigReader.IGNORE_EXCEPTIONS, ignoreExceptions);
    }
    return RetryConfigReader.read(values, base);
  }

  private static RetryConfig resolve(
      String name,
      Map<String, RetryEngineProperties.Config> configs,
      Map<String, RetryConfig> resolved,
      Map<String, RetryEngineProperties.Backoff> backoffs,
      Set<String> resolving) {
    RetryConfig done = resolved.get(name);
    if (done != null) {
      return done;
    }
    if (!resolving.add(name)) {
      throw new InvalidRetryConfigException(
          "Cyclic retry-engine base-config chain: " + String.join(" -> ", resolving) + " -> " + name);
    }

    RetryEngineProperties.Config config = configs.get(name);
    String baseName = config == null ? null : config.getBaseConfig();
    String parent = null;
    if (hasText(baseName)) {
      parent = baseName.trim();
      if (!configs.containsKey(parent)) {
        throw new InvalidRetryConfigException(
            "Unknown retry-engine base-config '" + baseName + "' for config '" + name + "'");
      }
    } else if (!RetryRegistry.DEFAULT_CONFIG.equals(name)
        && configs.containsKey(RetryRegistry.DEFAULT_CONFIG)) {
      parent = RetryRegistry.DEFAULT_CONFIG;
    }
    RetryConfig base =
        parent == null
            ? RetryConfig.ofDefaults()
            : resolve(parent, configs, resolved, backoffs, resolving);
    RetryEngineProperties.Backoff inheritedBackoff = parent == null ? null : backoffs.get(parent);

    RetryConfig created = create(config, base, inheritedBackoff);
    resolved.put(name, created);
    backoffs.put(name, effectiveBackoff(config, inheritedBackoff));
    resolving.remove(name);
    return created;
  }

  /** The backoff that drives {@code config}; an interval class of its own overrides any backoff. */
  private static RetryEngineProperties.Backoff effectiveBackoff(
      RetryEngineProperties.Config config, RetryEngineProperties.Backoff inheritedBackoff) {
    if (config == null) {
      return inheritedBackoff;
    }
    if (hasText(config.getIntervalFunction()) || hasText(config.getIntervalBiFunction())) {
      return null;
    }
    RetryEngineProperties.Backoff own = config.getBackoff();
    return own != null && hasText(own.getMode()) ? own : inheritedBackoff;
  }

  private static IntervalFunction backoffInterval(
      RetryEngineProperties.Backoff backoff, Duration waitDuration) {
    if (backoff == null || !hasText(backoff.getMode())) {
      return null;
    }
    Duration maxInterval =
        backoff.getMaxInterval() == null
            ? IntervalFunctions.DEFAULT_MAX_INTERVAL
            : backoff.getMaxInterval();
    String mode = backoff.getMode().trim().toLowerCase();
    switch (mode) {
      case "fixed":
        return IntervalFunctions.fixed(waitDuration);
      case "randomized":
        return IntervalFunctions.randomized(waitDuration, backoff.getRandomizationFactor());
      case "exponential":
        return IntervalFunctions.exponentialBackoff(
            waitDuration, backoff.getMultiplier(), maxInterval);
      case "exponential-random":
        return IntervalFunctions.exponentialRandomBackoff(
            waitDuration, backoff.getMultiplier(), backoff.getRandomizationFactor(), maxInterval);
      default:
        throw new InvalidRetryConfigException(
            "Unsupported retry-engine backoff mode: " + backoff.getMode());
    }
  }

  private static <T> T instantiate(String key, String className, Class<T> expectedType) {
    Class<?> clazz = loadClass(key, className);
    if (!expectedType.isAssignableFrom(clazz)) {
      throw new InvalidRetryConfigException(
          key + " class " + className + " does not implement " + expectedType.getName());
    }
    try {
      return expectedType.cast(clazz.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException ex) {
      throw new InvalidRetryConfigException(
          key + " class " + className + " needs a public no-arg constructor", ex);
    }
  }

  private static List<Class<? extends Throwable>> resolveExceptionTypes(
      String key, List<String> configuredTypes) {
    List<Class<? extends Throwable>> resolvedTypes = new ArrayList<>();
    if (configuredTypes == null) {
      return resolvedTypes;
    }

    for (String configuredType : configuredTypes) {
      if (!hasText(configuredType)) {
        continue;
      }
      Class<?> clazz = loadClass(key, configuredType);
      if (!Throwable.class.isAssignableFrom(clazz)) {
        throw new InvalidRetryConfigException(
            key + " type is not a Throwable: " + configuredType);
      }
      resolvedTypes.add(clazz.asSubclass(Throwable.class));
    }
    return resolvedTypes;
  }

  private static Class<?> loadClass(String key, String className) {
    try {
      return Class.forName(className.trim(), true, classLoader());
    } catch (ClassNotFoundException ex) {
      throw new InvalidRetryConfigException(key + " class not found: " + className, ex);
    }
  }

  private static ClassLoader classLoader() {
    ClassLoader contextLoader = Thread.currentThread().getContextClassLoader();
    return contextLoader == null ? RetryConfigFactory.class.getClassLoader() : contextLoader;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
