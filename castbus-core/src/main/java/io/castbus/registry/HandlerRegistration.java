package io.castbus.registry;

import io.castbus.AsyncEventHandler;
import io.castbus.EventHandler;
import io.castbus.EventPayload;
import io.castbus.EventPriority;
import io.castbus.EventType;

import java.util.Objects;

/**
 * One entry of a batch registration: an event type, its handler and a declared priority.
 *
 * @param eventType the event type
 * @param handler the handler
 * @param priority declared priority, informational only
 * @param <P> the payload type
 * @see EventHandlers#register(io.castbus.EventBus, java.util.List)
 */
public record HandlerRegistration<P extends EventPayload>(
    EventType<P> eventType, AsyncEventHandler<P> handler, EventPriority priority) {

  public HandlerRegistration {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(priority, "priority");
  }

  public static <P extends EventPayload> HandlerRegistration<P> of(
      EventType<P> eventType, EventHandler<P> handler, EventPriority priority) {
    return new HandlerRegistration<>(eventType, AsyncEventHandler.of(handler), priority);
  }

  public static <P extends EventPayload> HandlerRegistration<P> of(EventType<P> eventType, EventHandler<P> handler) {
    return of(eventType, handler, EventPriority.NORMAL);
  }
}
