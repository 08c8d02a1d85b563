package com.retryengine.spring.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "retry-engine")
public class RetryEngineProperties {
  private Map<String, Config> configs = new LinkedHashMap<>();
  private Map<String, Instance> instances = new LinkedHashMap<>();
  private Events events = new Events();

  public Map<String, Config> getConfigs() {
    return configs;
  }

  public void setConfigs(Map<String, Config> configs) {
    this.configs = configs;
  }

  public Map<String, Instance> getInstances() {
    return instances;
  }

  public void setInstances(Map<String, Instance> instances) {
    this.instances = instances;
  }

  public Events getEvents() {
    return events;
  }

  public void setEvents(Events events) {
    this.events = events;
  }

  /** One named retry configuration. Unset values are inherited from the base configuration. */
  public static class Config {
    private String baseConfig;
    private Integer maxAttempts;
    private Duration waitDuration;
    private String intervalFunction;
    private String intervalBiFunction;
    private String retryOnResultPredicate;
    private String retryExceptionPredicate;
    private List<String> retryExceptions = new ArrayList<>();
    private List<String> ignoreExceptions = new ArrayList<>();
    private Boolean failAfterMaxAttempts;
    private Backoff backoff = new Backoff();

    public String getBaseConfig() {
      return baseConfig;
    }

    public void setBaseConfig(String baseConfig) {
      this.baseConfig = baseConfig;
    }

    public Integer getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(Integer maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getWaitDuration() {
      return waitDuration;
    }

    public void setWaitDuration(Duration waitDuration) {
      this.waitDuration = waitDuration;
    }

    public String getIntervalFunction() {
      return intervalFunction;
    }

    public void setIntervalFunction(String intervalFunction) {
      this.intervalFunction = intervalFunction;
    }

    public String getIntervalBiFunction() {
      return intervalBiFunction;
    }

    public void setIntervalBiFunction(String intervalBiFunction) {
      this.intervalBiFunction = intervalBiFunction;
    }

    public String getRetryOnResultPredicate() {
      return retryOnResultPredicate;
    }

    public void setRetryOnResultPredicate(String retryOnResultPredicate) {
      this.retryOnResultPredicate = retryOnResultPredicate;
    }

    public String getRetryExceptionPredicate() {
      return retryExceptionPredicate;
    }

    public void setRetryExceptionPredicate(String retryExceptionPredicate) {
      this.retryExceptionPredicate = retryExceptionPredicate;
    }

    public List<String> getRetryExceptions() {
      return retryExceptions;
    }

    public void setRetryExceptions(List<String> retryExceptions) {
      this.retryExceptions = retryExceptions;
    }

    public List<String> getIgnoreExceptions() {
      return ignoreExceptions;
    }

    public void setIgnoreExceptions(List<String> ignoreExceptions) {
      this.ignoreExceptions = ignoreExceptions;
    }

    public Boolean getFailAfterMaxAttempts() {
      return failAfterMaxAttempts;
    }

    public void setFailAfterMaxAttempts(Boolean failAfterMaxAttempts) {
      this.failAfterMaxAttempts = failAfterMaxAttempts;
    }

    public Backoff getBackoff() {
      return backoff;
    }

    public void setBackoff(Backoff backoff) {
      this.backoff = backoff;
    }
  }

  /** Built-in interval strategy, used when no interval class is configured. */
  public static class Backoff {
    private String mode;
    private double multiplier = 1.5d;
    private double randomizationFactor = 0.5d;
    private Duration maxInterval;

    public String getMode() {
      return mode;
    }

    public void setMode(String mode) {
      this.mode = mode;
    }

    public double getMultiplier() {
      return multiplier;
    }

    public void setMultiplier(double multiplier) {
      this.multiplier = multiplier;
    }

    public double getRandomizationFactor() {
      return randomizationFactor;
    }

    public void setRandomizationFactor(double randomizationFactor) {
      this.randomizationFactor = randomizationFactor;
    }

    public Duration getMaxInterval() {
      return maxInterval;
    }

    public void setMaxInterval(Duration maxInterval) {
      this.maxInterval = maxInterval;
    }
  }

  public static class Instance {
    private String config = "default";

    public String getConfig() {
      return config;
    }

    public void setConfig(String config) {
      this.config = config;
    }
  }

  public static class Events {
    private boolean loggingEnabled = true;

    public boolean isLoggingEnabled() {
      return loggingEnabled;
    }

    public void setLoggingEnabled(boolean loggingEnabled) {
      this.loggingEnabled = loggingEnabled;
    }
  }
}
