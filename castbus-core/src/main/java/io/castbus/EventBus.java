package io.castbus;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * In-process publish/subscribe bus.
 *
 * <p>Publishing is non-blocking: events are buffered and delivered later, strictly in
 * publish order, to every subscriber registered for the event's type at the moment the
 * event is delivered. Subscribers of one event are invoked in registration order and the
 * bus waits for all of them before it delivers the next event.
 *
 * <p>Delivery is best-effort and in-memory only. Events still buffered when the process
 * stops are lost.
 *
 * @see io.castbus.dispatch.DefaultEventBus
 */
public interface EventBus {

  /**
   * Publishes an event stamped with the bus clock.
   *
   * @param type the event type
   * @param payload the payload
   * @param <P> the payload type
   * @throws io.castbus.dispatch.EventLoopException in strict mode, when {@code type} was
   *     published more often than the loop threshold allows
   */
  default <P extends EventPayload> void publish(EventType<P> type, P payload) {
    publish(type, payload, null);
  }

  /**
   * Publishes an event with an explicit timestamp.
   *
   * @param type the event type
   * @param payload the payload
   * @param timestamp the event time, or {@code null} to use the bus clock
   * @param <P> the payload type
   * @throws io.castbus.dispatch.EventLoopException in strict mode, when {@code type} was
   *     published more often than the loop threshold allows
   */
  <P extends EventPayload> void publish(EventType<P> type, P payload, Instant timestamp);

  /**
   * Publishes an event and returns a future that completes once the bus has delivered it
   * and has no further events queued.
   *
   * <p>The future tells that the bus went idle, not which cascade depth finished. Never
   * wait on it from a handler.
   *
   * @param type the event type
   * @param payload the payload
   * @param <P> the payload type
   * @return a future completed when the queue has drained
   */
  <P extends EventPayload> CompletableFuture<Void> publishAsync(EventType<P> type, P payload);

  /**
   * Registers a subscription. All subscribe variants delegate here.
   *
   * @param type the event type
   * @param handler the handler
   * @param once whether to remove the subscription after its first delivery
   * @param priority declared priority, informational only
   * @param <P> the payload type
   * @return the subscription handle
   */
  <P extends EventPayload> Subscription subscribe(
      EventType<P> type, AsyncEventHandler<P> handler, boolean once, EventPriority priority);

  /**
   * Subscribes a synchronous handler.
   *
   * @param type the event type
   * @param handler the handler
   * @param <P> the payload type
   * @return the subscription handle
   */
  default <P extends EventPayload> Subscription subscribe(EventType<P> type, EventHandler<P> handler) {
    return subscribe(type, AsyncEventHandler.of(handler), false, EventPriority.NORMAL);
  }

  /**
   * Subscribes an asynchronous handler.
   *
   * @param type the event type
   * @param handler the handler
   * @param <P> the payload type
   * @return the subscription handle
   */
  default <P extends EventPayload> Subscription subscribeAsync(EventType<P> type, AsyncEventHandler<P> handler) {
    return subscribe(type, handler, false, EventPriority.NORMAL);
  }

  /**
   * Subscribes a handler that fires for exactly one event and is then removed.
   *
   * @param type the event type
   * @param handler the handler
   * @param <P> the payload type
   * @return the subscription handle
   */
  default <P extends EventPayload> Subscription subscribeOnce(EventType<P> type, EventHandler<P> handler) {
    return subscribe(type, AsyncEventHandler.of(handler), true, EventPriority.NORMAL);
  }

  /**
   * Removes a subscription. Unknown or already removed subscriptions are ignored.
   *
   * @param subscription the subscription to remove
   */
  void unsubscribe(Subscription subscription);

  /**
   * Returns the number of live subscriptions for an event type.
   *
   * @param type the event type
   * @return the subscriber count, {@code 0} if none
   */
  int subscriberCount(EventType<?> type);
}
