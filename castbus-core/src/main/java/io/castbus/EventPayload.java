package io.castbus;

/**
 * Marker for the structured payload carried by an {@link Event}.
 *
 * <p>Payloads should be immutable; records are the intended implementation. The domain
 * catalog narrows this further with the sealed {@link io.castbus.event.CharacterEvent}.
 */
public interface EventPayload {
}
