package com.retryengine.core.errors;

public class RetryEngineException extends RuntimeException {
  public RetryEngineException(String message) {
    super(message);
  }

  public RetryEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
