/**
 * Buffered single-threaded dispatch.
 *
 * <p>{@link io.castbus.dispatch.DefaultEventBus} drains a FIFO queue on its own daemon
 * thread, guards against publish storms with a {@link io.castbus.dispatch.LoopDetector},
 * and runs {@link io.castbus.dispatch.EventInterceptor}s around each delivery.
 *
 * @see io.castbus.dispatch.DefaultEventBus
 * @see io.castbus.dispatch.EventInterceptor
 * @see io.castbus.dispatch.EventLoopException
 */
package io.castbus.dispatch;
