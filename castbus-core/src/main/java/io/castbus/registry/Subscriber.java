package io.castbus.registry;

import io.castbus.AsyncEventHandler;
import io.castbus.Event;
import io.castbus.EventPayload;
import io.castbus.EventPriority;
import io.castbus.Subscription;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry entry pairing a subscription handle with its handler.
 *
 * <p>Instances are created by a {@link SubscriptionRegistry}; {@link #close()} removes the
 * entry from the registry that created it.
 */
public final class Subscriber implements Subscription {

  private final String id;
  private final String eventType;
  private final AsyncEventHandler<?> handler;
  private final boolean once;
  private final EventPriority priority;
  private final SubscriptionRegistry owner;
  private final AtomicBoolean fired = new AtomicBoolean();
  private volatile boolean active = true;

  Subscriber(String id, String eventType, AsyncEventHandler<?> handler, boolean once,
      EventPriority priority, SubscriptionRegistry owner) {
    this.id = Objects.requireNonNull(id, "id");
    this.eventType = Objects.requireNonNull(eventType, "eventType");
    this.handler = Objects.requireNonNull(handler, "handler");
    this.once = once;
    this.priority = Objects.requireNonNull(priority, "priority");
    this.owner = owner;
  }

  /**
   * Claims the right to run this subscriber for one event. Always succeeds for regular
   * subscriptions, even after removal, because delivery works on the subscriber snapshot
   * taken when the event started. A one-shot subscription succeeds at most once and never
   * after removal.
   *
   * @return {@code true} if the handler may be invoked
   */
  public boolean tryFire() {
    if (!once) return true;
    return active && fired.compareAndSet(false, true);
  }

  /**
   * Invokes the handler. Synchronous failures are returned as a failed stage.
   *
   * @param event the event to deliver
   * @return the handler's completion stage, never {@code null}
   */
  public CompletionStage<Void> invoke(Event<? extends EventPayload> event) {
    try {
      CompletionStage<Void> stage = invoke(handler, event);
      return stage != null ? stage : CompletableFuture.completedFuture(null);
    } catch (RuntimeException | Error e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  @SuppressWarnings("unchecked")
  private static <P extends EventPayload> CompletionStage<Void> invoke(
      AsyncEventHandler<P> handler, Event<? extends EventPayload> event) {
    return handler.onEvent((Event<P>) event);
  }

  void deactivate() {
    active = false;
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public String eventType() {
    return eventType;
  }

  @Override
  public boolean once() {
    return once;
  }

  @Override
  public EventPriority priority() {
    return priority;
  }

  @Override
  public boolean isActive() {
    return active;
  }

  @Override
  public void close() {
    if (owner != null) {
      owner.remove(this);
    }
  }

  @Override
  public String toString() {
    return "Subscriber{id=" + id + ", eventType=" + eventType + ", once=" + once + '}';
  }
}
