package io.castbus;

import java.util.Objects;

/**
 * Typed event name binding an event to the payload it carries.
 *
 * <p>Subscribers and publishers are checked against the payload type at compile time:
 *
 * <pre>{@code
 * EventType<ChapterPublished> CHAPTER_PUBLISHED =
 *     EventType.of("chapter.published", ChapterPublished.class);
 *
 * bus.subscribe(CHAPTER_PUBLISHED, event -> index(event.payload().chapterNumber()));
 * bus.publish(CHAPTER_PUBLISHED, new ChapterPublished(12));
 * }</pre>
 *
 * <p>Two types are equal when their names are equal; subscriptions are keyed by name.
 *
 * @param <P> the payload type
 * @see io.castbus.event.CharacterEventTypes
 */
public final class EventType<P extends EventPayload> {

  private final String name;
  private final Class<P> payloadType;
  private final EventPriority priority;

  private EventType(String name, Class<P> payloadType, EventPriority priority) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isBlank()) {
      throw new IllegalArgumentException("Event type name cannot be blank");
    }
    this.payloadType = Objects.requireNonNull(payloadType, "payloadType");
    this.priority = Objects.requireNonNull(priority, "priority");
  }

  /**
   * Creates an event type with {@link EventPriority#NORMAL} priority.
   *
   * @param name the event type name
   * @param payloadType the payload class
   * @param <P> the payload type
   * @return the event type
   */
  public static <P extends EventPayload> EventType<P> of(String name, Class<P> payloadType) {
    return new EventType<>(name, payloadType, EventPriority.NORMAL);
  }

  /**
   * Creates an event type with a declared priority.
   *
   * @param name the event type name
   * @param payloadType the payload class
   * @param priority the declared priority
   * @param <P> the payload type
   * @return the event type
   */
  public static <P extends EventPayload> EventType<P> of(
      String name, Class<P> payloadType, EventPriority priority) {
    return new EventType<>(name, payloadType, priority);
  }

  public String name() {
    return name;
  }

  public Class<P> payloadType() {
    return payloadType;
  }

  public EventPriority priority() {
    return priority;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof EventType)) return false;
    EventType<?> that = (EventType<?>) o;
    return name.equals(that.name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public String toString() {
    return name;
  }
}
