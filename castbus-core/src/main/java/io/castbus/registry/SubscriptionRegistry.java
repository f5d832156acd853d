package io.castbus.registry;

import io.castbus.AsyncEventHandler;
import io.castbus.EventPriority;
import io.castbus.Subscription;

import java.util.List;
import java.util.Set;

/**
 * Mapping from event type name to the ordered list of live subscribers.
 *
 * <p>The bus looks up a snapshot per delivered event, so additions and removals made while
 * an event is being delivered only apply from the next event onward.
 *
 * @see DefaultSubscriptionRegistry
 */
public interface SubscriptionRegistry {

  /**
   * Adds a subscriber at the end of the list for {@code eventType}.
   *
   * @param eventType the event type name
   * @param handler the handler
   * @param once whether the subscriber is removed after its first delivery
   * @param priority declared priority
   * @return the new subscriber
   */
  Subscriber add(String eventType, AsyncEventHandler<?> handler, boolean once, EventPriority priority);

  /**
   * Removes a subscription. Removing the last subscriber of a type drops the type's bucket.
   *
   * @param subscription the subscription
   * @return {@code true} if it was registered
   */
  boolean remove(Subscription subscription);

  /**
   * Returns the subscribers for a type in registration order.
   *
   * @param eventType the event type name
   * @return an immutable snapshot, possibly empty
   */
  List<Subscriber> subscribersFor(String eventType);

  /**
   * Returns the names of all types that currently have at least one subscriber.
   *
   * @return an immutable set
   */
  Set<String> eventTypes();
}
