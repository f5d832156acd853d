package io.castbus;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Handler whose work completes asynchronously.
 *
 * <p>The bus waits for the returned stage (together with the stages of every other
 * subscriber of the same event) before it moves on to the next event. A stage that
 * completes exceptionally is treated like a thrown exception from {@link EventHandler}.
 *
 * @param <P> the payload type
 */
@FunctionalInterface
public interface AsyncEventHandler<P extends EventPayload> {

  /**
   * Starts processing an event.
   *
   * @param event the event, with a non-null timestamp
   * @return a stage completing when processing has finished; {@code null} counts as done
   */
  CompletionStage<Void> onEvent(Event<P> event);

  /**
   * Adapts a synchronous handler. Exceptions become an exceptionally completed stage.
   *
   * @param handler the synchronous handler
   * @param <P> the payload type
   * @return an asynchronous view of {@code handler}
   */
  static <P extends EventPayload> AsyncEventHandler<P> of(EventHandler<P> handler) {
    Objects.requireNonNull(handler, "handler");
    return event -> {
      try {
        handler.onEvent(event);
        return CompletableFuture.completedFuture(null);
      } catch (Exception e) {
        return CompletableFuture.failedFuture(e);
      }
    };
  }
}
