package io.castbus;

/**
 * Minimal event types for bus tests.
 */
public final class TestEvents {

    public record Ping(int n) implements EventPayload {}

    public record Pong(int n) implements EventPayload {}

    public static final EventType<Ping> PING = EventType.of("test.ping", Ping.class);
    public static final EventType<Pong> PONG = EventType.of("test.pong", Pong.class, EventPriority.LOW);

    private TestEvents() {}
}
