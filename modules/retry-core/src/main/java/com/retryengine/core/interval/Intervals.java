package com.retryengine.core.interval;

import java.time.Duration;

final class Intervals {
  private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

  private Intervals() {}

  /** Nanoseconds of {@code duration}, capped at {@link Long#MAX_VALUE}. */
  static long saturatedNanos(Duration duration) {
    return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
  }
}
