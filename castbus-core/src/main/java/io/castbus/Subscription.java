package io.castbus;

/**
 * A registered interest in one event type.
 *
 * <p>Returned by the subscribe methods of {@link EventBus}. Pass it to
 * {@link EventBus#unsubscribe(Subscription)} or simply {@link #close()} it; both are
 * idempotent. Unsubscribing takes effect from the next delivered event and cannot cancel
 * an invocation already in flight.
 */
public interface Subscription extends Registration {

  /**
   * Returns the unique subscription id (a ULID).
   *
   * @return the id
   */
  String id();

  /**
   * Returns the name of the subscribed event type.
   *
   * @return the event type name
   */
  String eventType();

  /**
   * Returns {@code true} if this subscription is removed after its first delivery.
   *
   * @return whether this is a one-shot subscription
   */
  boolean once();

  /**
   * Returns the declared priority. Informational only; it does not affect delivery order.
   *
   * @return the priority
   */
  EventPriority priority();

  /**
   * Returns {@code true} while the subscription is still registered.
   *
   * @return whether the subscription is active
   */
  boolean isActive();
}
