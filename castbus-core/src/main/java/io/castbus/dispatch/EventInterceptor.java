package io.castbus.dispatch;

import io.castbus.Event;

/**
 * Cross-cutting hook for observing event delivery.
 *
 * <p>Interceptors run around the delivery of each event to its subscribers:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>every subscriber of the event</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, the event is not delivered to any subscriber and
 * the interceptors that already ran see the failure in {@code afterDispatch}.
 * {@code afterDispatch} exceptions are logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DefaultEventBus.builder()
 *     .interceptor(EventInterceptor.before(event ->
 *         audit.log(event.type().name(), event.eventId())))
 *     .interceptor(EventInterceptor.after((event, error) -> {
 *         if (error != null) alerts.raise(event.type().name());
 *     }))
 *     .build();
 * }</pre>
 */
public interface EventInterceptor {

    /**
     * Called before the event is handed to its subscribers.
     *
     * @param event the event about to be delivered
     * @throws Exception to skip delivery of this event
     */
    default void beforeDispatch(Event<?> event) throws Exception {
    }

    /**
     * Called after every subscriber finished (or after a beforeDispatch failure).
     *
     * @param event the delivered event
     * @param error null on success, otherwise the first failure
     */
    default void afterDispatch(Event<?> event, Throwable error) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static EventInterceptor before(BeforeHook hook) {
        return new EventInterceptor() {
            @Override
            public void beforeDispatch(Event<?> event) throws Exception {
                hook.accept(event);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static EventInterceptor after(AfterHook hook) {
        return new EventInterceptor() {
            @Override
            public void afterDispatch(Event<?> event, Throwable error) {
                hook.accept(event, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(Event<?> event) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Event<?> event, Throwable error);
    }
}
