package com.retryengine.core.errors;

public class InvalidRetryConfigException extends RetryEngineException {
  public InvalidRetryConfigException(String message) {
    super(message);
  }

  public InvalidRetryConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
