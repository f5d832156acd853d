package io.castbus.registry;

import io.castbus.AsyncEventHandler;
import io.castbus.EventPriority;
import io.castbus.TestEvents;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultSubscriptionRegistryTest {

    private final AsyncEventHandler<TestEvents.Ping> handler = AsyncEventHandler.of(event -> { });

    @Test
    void keepsRegistrationOrderPerType() {
        DefaultSubscriptionRegistry registry = new DefaultSubscriptionRegistry();
        Subscriber first = registry.add("a", handler, false, EventPriority.LOW);
        Subscriber second = registry.add("a", handler, false, EventPriority.HIGH);
        Subscriber other = registry.add("b", handler, true, EventPriority.NORMAL);

        assertEquals(List.of(first, second), registry.subscribersFor("a"));
        assertEquals(List.of(other), registry.subscribersFor("b"));
        assertEquals(Set.of("a", "b"), registry.eventTypes());
        assertNotEquals(first.id(), second.id());
        assertEquals(EventPriority.HIGH, second.priority());
    }

    @Test
    void unknownTypeHasNoSubscribers() {
        assertTrue(new DefaultSubscriptionRegistry().subscribersFor("missing").isEmpty());
    }

    @Test
    void removingLastSubscriberDropsTheBucket() {
        DefaultSubscriptionRegistry registry = new DefaultSubscriptionRegistry();
        Subscriber subscriber = registry.add("a", handler, false, EventPriority.NORMAL);

        assertTrue(registry.remove(subscriber));

        assertFalse(subscriber.isActive());
        assertTrue(registry.eventTypes().isEmpty());
    }

    @Test
    void removeIsIdempotent() {
        DefaultSubscriptionRegistry registry = new DefaultSubscriptionRegistry();
        Subscriber subscriber = registry.add("a", handler, false, EventPriority.NORMAL);

        subscriber.close();

        assertFalse(registry.remove(subscriber));
        assertFalse(registry.remove(null));
    }

    @Test
    void snapshotIsNotAffectedByLaterChanges() {
        DefaultSubscriptionRegistry registry = new DefaultSubscriptionRegistry();
        Subscriber first = registry.add("a", handler, false, EventPriority.NORMAL);
        List<Subscriber> snapshot = registry.subscribersFor("a");

        registry.add("a", handler, false, EventPriority.NORMAL);
        registry.remove(first);

        assertEquals(List.of(first), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(first));
    }

    @Test
    void oneShotSubscriberFiresOnce() {
        DefaultSubscriptionRegistry registry = new DefaultSubscriptionRegistry();
        Subscriber once = registry.add("a", handler, true, EventPriority.NORMAL);
        Subscriber regular = registry.add("a", handler, false, EventPriority.NORMAL);

        assertTrue(once.tryFire());
        assertFalse(once.tryFire());
        assertTrue(regular.tryFire());
        assertTrue(regular.tryFire());
    }

    @Test
    void removedOneShotSubscriberDoesNotFire() {
        DefaultSubscriptionRegistry registry = new DefaultSubscriptionRegistry();
        Subscriber subscriber = registry.add("a", handler, true, EventPriority.NORMAL);
        registry.remove(subscriber);

        assertFalse(subscriber.tryFire());
        assertTrue(registry.subscribersFor("a").isEmpty());
    }

    @Test
    void removedRegularSubscriberStillFiresFromSnapshot() {
        DefaultSubscriptionRegistry registry = new DefaultSubscriptionRegistry();
        Subscriber subscriber = registry.add("a", handler, false, EventPriority.NORMAL);
        var snapshot = registry.subscribersFor("a");
        registry.remove(subscriber);

        assertEquals(List.of(subscriber), snapshot);
        assertTrue(subscriber.tryFire());
        assertFalse(subscriber.isActive());
    }
}
