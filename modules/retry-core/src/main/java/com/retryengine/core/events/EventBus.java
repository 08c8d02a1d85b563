package com.retryengine.core.events;

import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publish/subscribe stream of one policy or registry.
 *
 * <p>{@link #publish(Event)} never blocks and never throws: queue subscribers receive events through
 * {@link Queue#offer(Object)}, callback subscribers through a bounded buffer drained serially on an
 * {@link Executor}. Whatever does not fit is dropped and counted on the subscription.
 */
public class EventBus<E extends Event> {
  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  public static final int DEFAULT_BUFFER_CAPACITY = 256;

  private final String source;
  private final Executor executor;
  private final int bufferCapacity;
  private final List<Subscriber<E>> subscribers = new CopyOnWriteArrayList<>();

  public EventBus(String source, Executor executor) {
    this(source, executor, DEFAULT_BUFFER_CAPACITY);
  }

  public EventBus(String source, Executor executor, int bufferCapacity) {
    this.source = source;
    this.executor = Objects.requireNonNull(executor, "executor must not be null");
    if (bufferCapacity < 1) {
      throw new IllegalArgumentException("bufferCapacity must be >= 1 but was " + bufferCapacity);
    }
    this.bufferCapacity = bufferCapacity;
  }

  public EventSubscription subscribe(Consumer<? super E> consumer) {
    return subscribe(consumer, EventFilter.all());
  }

  public EventSubscription subscribe(Consumer<? super E> consumer, EventFilter filter) {
    return subscribe(consumer, filter, executor);
  }

  public EventSubscription subscribe(
      Consumer<? super E> consumer, EventFilter filter, Executor deliveryExecutor) {
    Objects.requireNonNull(consumer, "consumer must not be null");
    Objects.requireNonNull(filter, "filter must not be null");
    Objects.requireNonNull(deliveryExecutor, "deliveryExecutor must not be null");
    return register(new CallbackSubscriber<>(this, filter, consumer, deliveryExecutor, bufferCapacity));
  }

  /** Events are offered to {@code channel}; a full channel drops them. */
  public EventSubscription subscribe(Queue<? super E> channel, EventFilter filter) {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(filter, "filter must not be null");
    return register(new ChannelSubscriber<>(this, filter, channel));
  }

  /** Subscribes a new bounded channel of {@code capacity} events and returns it. */
  public BlockingQueue<E> channel(int capacity, EventFilter filter) {
    BlockingQueue<E> channel = new ArrayBlockingQueue<>(capacity);
    subscribe(channel, filter);
    return channel;
  }

  public void publish(E event) {
    if (event == null) {
      return;
    }
    for (Subscriber<E> subscriber : subscribers) {
      if (!subscriber.filter().accepts(event.eventType())) {
        continue;
      }
      try {
        if (!subscriber.offer(event)) {
          subscriber.dropped.incrementAndGet();
          log.debug(
              "Dropped event source={} type={} reason=subscriber-full", source, event.eventType());
        }
      } catch (RuntimeException ex) {
        subscriber.dropped.incrementAndGet();
        log.warn(
            "Event subscriber failed source={} type={} error={}",
            source,
            event.eventType(),
            ex.toString());
      }
    }
  }

  public boolean hasSubscribers() {
    return !subscribers.isEmpty();
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  private EventSubscription register(Subscriber<E> subscriber) {
    subscribers.add(subscriber);
    return subscriber;
  }

  private abstract static class Subscriber<E extends Event> implements EventSubscription {
    private final EventBus<E> bus;
    private final EventFilter filter;
    private final AtomicBoolean cancelled = new AtomicBoolean();
    final AtomicLong dropped = new AtomicLong();

    Subscriber(EventBus<E> bus, EventFilter filter) {
      this.bus = bus;
      this.filter = filter;
    }

    abstract boolean offer(E event);

    @Override
    public EventFilter filter() {
      return filter;
    }

    @Override
    public long droppedEvents() {
      return dropped.get();
    }

    @Override
    public boolean isCancelled() {
      return cancelled.get();
    }

    @Override
    public void cancel() {
      if (cancelled.compareAndSet(false, true)) {
        bus.subscribers.remove(this);
      }
    }
  }

  private static final class ChannelSubscriber<E extends Event> extends Subscriber<E> {
    private final Queue<? super E> channel;

    ChannelSubscriber(EventBus<E> bus, EventFilter filter, Queue<? super E> channel) {
      super(bus, filter);
      this.channel = channel;
    }

    @Override
    boolean offer(E event) {
      return channel.offer(event);
    }
  }

  private static final class CallbackSubscriber<E extends Event> extends Subscriber<E> {
    private final Consumer<? super E> consumer;
    private final Executor deliveryExecutor;
    private final Queue<E> buffer;
    private final AtomicBoolean draining = new AtomicBoolean();
    private final String source;

    CallbackSubscriber(
        EventBus<E> bus,
        EventFilter filter,
        Consumer<? super E> consumer,
        Executor deliveryExecutor,
        int capacity) {
      super(bus, filter);
      this.consumer = consumer;
      this.deliveryExecutor = deliveryExecutor;
      this.buffer = new ArrayBlockingQueue<>(capacity);
      this.source = bus.source;
    }

    @Override
    boolean offer(E event) {
      boolean accepted = buffer.offer(event);
      scheduleDrain();
      return accepted;
    }

    private void scheduleDrain() {
      if (!draining.compareAndSet(false, true)) {
        return;
      }
      try {
        deliveryExecutor.execute(this::drain);
      } catch (RejectedExecutionException ex) {
        draining.set(false);
        log.warn("Event delivery rejected source={} error={}", source, ex.toString());
      }
    }

    private void drain() {
      try {
        E event;
        while (!isCancelled() && (event = buffer.poll()) != null) {
          try {
            consumer.accept(event);
          } catch (RuntimeException ex) {
            dropped.incrementAndGet();
            log.warn(
                "Event consumer failed source={} type={} error={}",
                source,
                event.eventType(),
                ex.toString());
          }
        }
      } finally {
        // an Error from the consumer still propagates; the next offer restarts delivery
        draining.set(false);
      }
      if (!isCancelled() && !buffer.isEmpty()) {
        scheduleDrain();
      }
    }
  }
}
