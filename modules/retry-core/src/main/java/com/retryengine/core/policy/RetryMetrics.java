package com.retryengine.core.policy;

import java.util.concurrent.atomic.LongAdder;

/** Call counters of a policy; they only ever grow. */
public class RetryMetrics {
  private final LongAdder succeededWithoutRetry = new LongAdder();
  private final LongAdder succeededWithRetry = new LongAdder();
  private final LongAdder failedWithoutRetry = new LongAdder();
  private final LongAdder failedWithRetry = new LongAdder();

  public long succeededWithoutRetry() {
    return succeededWithoutRetry.sum();
  }

  public long succeededWithRetry() {
    return succeededWithRetry.sum();
  }

  public long failedWithoutRetry() {
    return failedWithoutRetry.sum();
  }

  public long failedWithRetry() {
    return failedWithRetry.sum();
  }

  public Snapshot snapshot() {
    return new Snapshot(
        succeededWithoutRetry(), succeededWithRetry(), failedWithoutRetry(), failedWithRetry());
  }

  void recordSuccess(int attempt) {
    if (attempt > 1) {
      succeededWithRetry.increment();
    } else {
      succeededWithoutRetry.increment();
    }
  }

  void recordFailure(int attempt) {
    if (attempt > 1) {
      failedWithRetry.increment();
    } else {
      failedWithoutRetry.increment();
    }
  }

  public record Snapshot(
      long succeededWithoutRetry,
      long succeededWithRetry,
      long failedWithoutRetry,
      long failedWithRetry) {

    public long totalCalls() {
      return succeededWithoutRetry + succeededWithRetry + failedWithoutRetry + failedWithRetry;
    }
  }
}
