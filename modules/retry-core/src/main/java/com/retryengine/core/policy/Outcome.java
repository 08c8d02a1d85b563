package com.retryengine.core.policy;

import java.util.Objects;

/** The observed result of one attempt: a value (possibly {@code null}) or a failure. */
public record Outcome<T>(T value, Throwable failure) {

  public static <T> Outcome<T> success(T value) {
    return new Outcome<>(value, null);
  }

  public static <T> Outcome<T> failure(Throwable failure) {
    return new Outcome<>(null, Objects.requireNonNull(failure, "failure must not be null"));
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public boolean isFailure() {
    return failure != null;
  }
}
