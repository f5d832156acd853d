package io.castbus.dispatch;

/**
 * Thrown by a strict-mode bus when an event type is published more often than the loop
 * threshold allows within one window. The offending event is not buffered.
 */
public class EventLoopException extends RuntimeException {

  private final String eventType;
  private final int threshold;

  public EventLoopException(String eventType, int threshold) {
    super("Event loop detected: " + eventType + " exceeded threshold of " + threshold);
    this.eventType = eventType;
    this.threshold = threshold;
  }

  public String eventType() {
    return eventType;
  }

  public int threshold() {
    return threshold;
  }
}
