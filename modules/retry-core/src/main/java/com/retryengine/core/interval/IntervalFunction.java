package com.retryengine.core.interval;

import java.time.Duration;

/** Maps an attempt number (starting at 1) to the wait before the next attempt. */
@FunctionalInterface
public interface IntervalFunction {
  Duration apply(int attempt);
}
