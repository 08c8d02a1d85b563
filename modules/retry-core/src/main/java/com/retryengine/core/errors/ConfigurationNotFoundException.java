package com.retryengine.core.errors;

public class ConfigurationNotFoundException extends RetryEngineException {
  private final String configName;

  public ConfigurationNotFoundException(String configName) {
    super(String.format("Retry configuration '%s' was not found", configName));
    this.configName = configName;
  }

  public String configName() {
    return configName;
  }
}
