/**
 * Event catalog: payload records and their {@link io.castbus.EventType} constants.
 */
package io.castbus.event;
