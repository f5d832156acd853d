package io.castbus;

/**
 * Handler that reacts to events of one type.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers run on the bus dispatch thread, one event at a time. A handler may publish
 * further events; they are appended to the queue and delivered after the current event.
 *
 * <h2>Error Handling</h2>
 * <p>An exception thrown from a handler is logged and counted by the bus. It never reaches
 * the publisher and does not stop the other handlers subscribed to the same event.
 *
 * <p>Do not block on {@link EventBus#publishAsync} from inside a handler: the returned future
 * completes only once the bus is idle, which cannot happen while the handler is running.
 *
 * @param <P> the payload type
 * @see AsyncEventHandler
 */
@FunctionalInterface
public interface EventHandler<P extends EventPayload> {

  /**
   * Processes an event.
   *
   * @param event the event, with a non-null timestamp
   * @throws Exception if processing fails; logged by the bus
   */
  void onEvent(Event<P> event) throws Exception;
}
