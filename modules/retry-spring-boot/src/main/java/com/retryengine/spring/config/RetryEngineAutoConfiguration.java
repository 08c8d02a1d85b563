package com.retryengine.spring.config;

import com.retryengine.core.config.RetryConfig;
import com.retryengine.core.execution.RetryExecutor;
import com.retryengine.core.registry.RetryRegistry;
import com.retryengine.spring.observability.LoggingRetryEventListener;
import com.retryengine.spring.observability.MicrometerRetryTelemetry;
import com.retryengine.spring.observability.NoOpRetryTelemetry;
import com.retryengine.spring.observability.RetryRegistryEventBinder;
import com.retryengine.spring.observability.RetryTelemetry;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(RetryEngineProperties.class)
public class RetryEngineAutoConfiguration {
  private static final Logger log = LoggerFactory.getLogger(RetryEngineAutoConfiguration.class);

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(name = "retryEventExecutor")
  public Executor retryEventExecutor() {
    return ForkJoinPool.commonPool();
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(RetryTelemetry.class)
  public RetryTelemetry micrometerRetryTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerRetryTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(RetryTelemetry.class)
  public RetryTelemetry noOpRetryTelemetry() {
    return new NoOpRetryTelemetry();
  }

  @Bean
  @ConditionalOnProperty(
      prefix = "retry-engine.events",
      name = "logging-enabled",
      havingValue = "true",
      matchIfMissing = true)
  @ConditionalOnMissingBean
  public LoggingRetryEventListener loggingRetryEventListener() {
    return new LoggingRetryEventListener();
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryRegistryEventBinder retryRegistryEventBinder(
      RetryTelemetry retryTelemetry, ObjectProvider<LoggingRetryEventListener> eventListener) {
    return new RetryRegistryEventBinder(retryTelemetry, eventListener.getIfAvailable());
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryRegistry retryRegistry(
      RetryEngineProperties properties,
      @Qualifier("retryEventExecutor") Executor retryEventExecutor,
      RetryRegistryEventBinder retryRegistryEventBinder) {
    Map<String, RetryConfig> configs = RetryConfigFactory.createAll(properties.getConfigs());
    RetryRegistry registry =
        RetryRegistry.builder().seedConfigs(configs).eventExecutor(retryEventExecutor).build();
    retryRegistryEventBinder.bind(registry);

    properties
        .getInstances()
        .forEach(
            (name, instance) -> {
              String configName =
                  instance == null || instance.getConfig() == null
                      ? RetryRegistry.DEFAULT_CONFIG
                      : instance.getConfig();
              registry.retry(name, configName);
            });
    log.info(
        "Retry registry ready configs={} instances={}",
        configs.keySet(),
        properties.getInstances().keySet());
    return registry;
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryExecutor retryExecutor() {
    return new RetryExecutor();
  }
}
