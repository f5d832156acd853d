/**
 * Spring Boot auto-configuration for the character event bus.
 *
 * <p>{@link io.castbus.spring.boot.CastBusAutoConfiguration} builds one
 * {@link io.castbus.dispatch.DefaultEventBus} per application context from {@code castbus.*}
 * properties, wires the character and relationship cascades, and exposes a
 * {@link io.castbus.service.RelationshipService}.
 *
 * <p>Use {@link io.castbus.spring.boot.CastBusListener @CastBusListener} on handler beans
 * to subscribe them declaratively.
 *
 * @see io.castbus.spring.boot.CastBusAutoConfiguration
 * @see io.castbus.spring.boot.CastBusProperties
 * @see io.castbus.spring.boot.CastBusListener
 * @see io.castbus.spring.boot.CastBusListenerRegistrar
 */
package io.castbus.spring.boot;
