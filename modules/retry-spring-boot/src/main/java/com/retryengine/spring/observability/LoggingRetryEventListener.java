package com.retryengine.spring.observability;

import com.retryengine.core.events.RetryEvent;
import com.retryengine.core.events.RetryOnRetryEvent;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingRetryEventListener implements Consumer<RetryEvent> {
  private static final Logger log = LoggerFactory.getLogger(LoggingRetryEventListener.class);

  @Override
  public void accept(RetryEvent event) {
    switch (event.eventType()) {
      case RETRY:
        log.info(
            "Retrying call policy={} attempt={} wait={} error={}",
            event.policyName(),
            event.attempt(),
            event instanceof RetryOnRetryEvent retry ? retry.waitInterval() : null,
            errorMessage(event));
        break;
      case SUCCESS:
        log.info(
            "Call succeeded after retry policy={} attempts={}", event.policyName(), event.attempt());
        break;
      case ERROR:
        log.warn(
            "Retries exhausted policy={} attempts={} error={}",
            event.policyName(),
            event.attempt(),
            errorMessage(event));
        break;
      case IGNORED_ERROR:
        log.warn(
            "Call failed without retry policy={} attempt={} error={}",
            event.policyName(),
            event.attempt(),
            errorMessage(event));
        break;
      default:
        log.debug("Ignoring retry event policy={} type={}", event.policyName(), event.eventType());
    }
  }

  private static String errorMessage(RetryEvent event) {
    Throwable error = event.lastThrowable();
    return error == null ? "result" : error.toString();
  }
}
