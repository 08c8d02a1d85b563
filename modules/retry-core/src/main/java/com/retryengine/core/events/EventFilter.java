package com.retryengine.core.events;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Inclusion filter of a subscription. A non-empty {@code only} set wins over {@code exclude}; with
 * neither set every event passes.
 */
public record EventFilter(Set<EventType> only, Set<EventType> exclude) {
  private static final EventFilter ALL = new EventFilter(Set.of(), Set.of());

  public EventFilter {
    only = Set.copyOf(Objects.requireNonNull(only, "only must not be null"));
    exclude = Set.copyOf(Objects.requireNonNull(exclude, "exclude must not be null"));
  }

  public static EventFilter all() {
    return ALL;
  }

  public static EventFilter only(EventType... types) {
    return new EventFilter(toSet(Arrays.asList(types)), Set.of());
  }

  public static EventFilter exclude(EventType... types) {
    return new EventFilter(Set.of(), toSet(Arrays.asList(types)));
  }

  public static EventFilter of(Collection<EventType> only, Collection<EventType> exclude) {
    return new EventFilter(
        only == null ? Set.of() : toSet(only), exclude == null ? Set.of() : toSet(exclude));
  }

  public boolean accepts(EventType type) {
    if (!only.isEmpty()) {
      return only.contains(type);
    }
    return !exclude.contains(type);
  }

  private static Set<EventType> toSet(Collection<EventType> types) {
    return types.isEmpty() ? Set.of() : EnumSet.copyOf(types);
  }
}
