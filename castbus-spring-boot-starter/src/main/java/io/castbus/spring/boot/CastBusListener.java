package io.castbus.spring.boot;

import io.castbus.EventPriority;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as an event bus handler.
 *
 * <p>The annotated bean must implement {@link io.castbus.EventHandler} or
 * {@link io.castbus.AsyncEventHandler}. {@link #eventType()} names a type from
 * {@link io.castbus.event.CharacterEventTypes}.
 *
 * <pre>{@code
 * @Component
 * @CastBusListener(eventType = "character.promoted")
 * public class PromotionNotifier implements EventHandler<CharacterPromoted> {
 *   public void onEvent(Event<CharacterPromoted> event) { ... }
 * }
 * }</pre>
 *
 * @see CastBusListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface CastBusListener {

    /**
     * Dotted event type name, e.g. {@code "relationship.updated"}.
     */
    String eventType();

    /**
     * Remove the subscription after its first delivery.
     */
    boolean once() default false;

    /**
     * Informational subscription priority.
     */
    EventPriority priority() default EventPriority.NORMAL;
}
