package io.castbus;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable event as delivered to subscribers.
 *
 * <p>The bus creates events on publish: it assigns a monotonic ULID {@code eventId} and,
 * when the publisher did not supply one, a {@code timestamp} from its clock. A delivered
 * event therefore never has a null timestamp.
 *
 * @param eventId unique event identifier
 * @param type the typed event name
 * @param payload the payload, an instance of {@code type.payloadType()}
 * @param timestamp when the event occurred
 * @param <P> the payload type
 */
public record Event<P extends EventPayload>(String eventId, EventType<P> type, P payload, Instant timestamp) {

  public Event {
    Objects.requireNonNull(eventId, "eventId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(timestamp, "timestamp");
    if (!type.payloadType().isInstance(payload)) {
      throw new IllegalArgumentException("Payload " + payload.getClass().getName()
          + " does not match event type " + type.name() + " (" + type.payloadType().getName() + ")");
    }
  }

  /**
   * Creates an event with a fresh ULID identifier.
   *
   * @param type the event type
   * @param payload the payload
   * @param timestamp the event time
   * @param <P> the payload type
   * @return a new event
   */
  public static <P extends EventPayload> Event<P> create(EventType<P> type, P payload, Instant timestamp) {
    return new Event<>(UlidCreator.getMonotonicUlid().toString(), type, payload, timestamp);
  }

  @Override
  public String toString() {
    return "Event{eventId=" + eventId + ", type=" + type.name() + ", timestamp=" + timestamp + '}';
  }
}
