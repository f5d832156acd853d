package io.castbus;

/**
 * Declared importance of an event type or a handler registration.
 *
 * <p>Priority is informational. Dispatch order is always publish order, and within one
 * event subscribers are invoked in registration order regardless of priority.
 */
public enum EventPriority {
  LOWEST,
  LOW,
  NORMAL,
  HIGH,
  HIGHEST,
  CRITICAL
}
