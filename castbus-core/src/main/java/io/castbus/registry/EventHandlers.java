package io.castbus.registry;

import io.castbus.EventBus;
import io.castbus.EventPayload;
import io.castbus.Registration;
import io.castbus.Subscription;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Batch subscription helper.
 *
 * <pre>{@code
 * Registration handlers = EventHandlers.register(bus, List.of(
 *     HandlerRegistration.of(CharacterEventTypes.CHARACTER_CREATED, this::onCreated, EventPriority.HIGH),
 *     HandlerRegistration.of(CharacterEventTypes.CHARACTER_UPDATED, this::onUpdated)));
 * ...
 * handlers.close(); // unsubscribes both
 * }</pre>
 *
 * <p>Priorities are recorded on each subscription but do not change delivery order.
 */
public final class EventHandlers {

  private EventHandlers() {}

  /**
   * Subscribes every entry in list order and returns one registration that removes them all.
   *
   * @param bus the bus to subscribe on
   * @param registrations the entries to subscribe
   * @return a registration whose {@code close()} unsubscribes every entry
   */
  public static Registration register(EventBus bus, List<? extends HandlerRegistration<?>> registrations) {
    Objects.requireNonNull(bus, "bus");
    Objects.requireNonNull(registrations, "registrations");
    List<Subscription> subscriptions = new ArrayList<>(registrations.size());
    for (HandlerRegistration<?> registration : registrations) {
      subscriptions.add(subscribe(bus, registration));
    }
    return new CompositeRegistration(bus, subscriptions);
  }

  private static <P extends EventPayload> Subscription subscribe(EventBus bus, HandlerRegistration<P> registration) {
    return bus.subscribe(registration.eventType(), registration.handler(), false, registration.priority());
  }

  /** Registration over a fixed list of subscriptions. */
  static final class CompositeRegistration implements Registration {
    private final EventBus bus;
    private final List<Subscription> subscriptions;
    private final AtomicBoolean closed = new AtomicBoolean();

    CompositeRegistration(EventBus bus, List<Subscription> subscriptions) {
      this.bus = bus;
      this.subscriptions = Collections.unmodifiableList(subscriptions);
    }

    List<Subscription> subscriptions() {
      return subscriptions;
    }

    @Override
    public void close() {
      if (!closed.compareAndSet(false, true)) {
        return;
      }
      for (Subscription subscription : subscriptions) {
        bus.unsubscribe(subscription);
      }
    }
  }
}
