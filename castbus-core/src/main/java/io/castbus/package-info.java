/**
 * Core API of the castbus event bus.
 *
 * <p>{@link io.castbus.EventBus} accepts typed events ({@link io.castbus.EventType},
 * {@link io.castbus.Event}) and delivers them to {@link io.castbus.EventHandler} and
 * {@link io.castbus.AsyncEventHandler} subscribers.
 *
 * @see io.castbus.dispatch.DefaultEventBus
 * @see io.castbus.event.CharacterEventTypes
 */
package io.castbus;
