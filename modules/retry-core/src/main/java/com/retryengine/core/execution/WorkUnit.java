package com.retryengine.core.execution;

/** An operation that is invoked with the same arguments on every attempt. */
@FunctionalInterface
public interface WorkUnit<T> {
  T call(Object... args) throws Exception;
}
