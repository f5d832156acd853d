package io.castbus.registry;

import com.github.f4b6a3.ulid.UlidCreator;
import io.castbus.AsyncEventHandler;
import io.castbus.EventPriority;
import io.castbus.Subscription;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe subscription registry.
 *
 * <p>Each event type owns a copy-on-write bucket, so a lookup is a cheap, consistent
 * snapshot even while other threads subscribe or unsubscribe. Empty buckets are removed.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * SubscriptionRegistry registry = new DefaultSubscriptionRegistry();
 * Subscriber audit = registry.add("character.updated", handler, false, EventPriority.NORMAL);
 * registry.subscribersFor("character.updated"); // [audit]
 * audit.close();
 * registry.eventTypes();                        // []
 * }</pre>
 */
public final class DefaultSubscriptionRegistry implements SubscriptionRegistry {

  private final Map<String, CopyOnWriteArrayList<Subscriber>> buckets = new ConcurrentHashMap<>();

  @Override
  public Subscriber add(String eventType, AsyncEventHandler<?> handler, boolean once, EventPriority priority) {
    Objects.requireNonNull(eventType, "eventType");
    Subscriber subscriber = new Subscriber(
        UlidCreator.getMonotonicUlid().toString(), eventType, handler, once, priority, this);
    buckets.compute(eventType, (type, bucket) -> {
      CopyOnWriteArrayList<Subscriber> target = bucket != null ? bucket : new CopyOnWriteArrayList<>();
      target.add(subscriber);
      return target;
    });
    return subscriber;
  }

  @Override
  public boolean remove(Subscription subscription) {
    if (subscription == null) {
      return false;
    }
    boolean[] removed = new boolean[1];
    buckets.computeIfPresent(subscription.eventType(), (type, bucket) -> {
      removed[0] = bucket.removeIf(s -> s.id().equals(subscription.id()));
      return bucket.isEmpty() ? null : bucket;
    });
    if (removed[0] && subscription instanceof Subscriber subscriber) {
      subscriber.deactivate();
    }
    return removed[0];
  }

  @Override
  public List<Subscriber> subscribersFor(String eventType) {
    CopyOnWriteArrayList<Subscriber> bucket = buckets.get(eventType);
    return bucket == null ? List.of() : List.copyOf(bucket);
  }

  @Override
  public Set<String> eventTypes() {
    return Set.copyOf(buckets.keySet());
  }
}
