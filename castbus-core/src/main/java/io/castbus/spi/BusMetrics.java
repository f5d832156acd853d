package io.castbus.spi;

/**
 * Observability hook for exporting bus counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface BusMetrics {

    /**
     * No-op instance that discards all metrics.
     */
    BusMetrics NOOP = new Noop();

    /**
     * Increments the count of events accepted into the dispatch queue.
     */
    void incrementPublished();

    /**
     * Increments the count of events dropped because the bus was closed.
     */
    void incrementDropped();

    /**
     * Increments the count of successful handler invocations.
     */
    void incrementDelivered();

    /**
     * Increments the count of handler invocations that failed.
     */
    void incrementHandlerFailure();

    /**
     * Increments the count of publishes that exceeded the loop threshold.
     */
    void incrementLoopWarning();

    /**
     * Records the number of events waiting in the dispatch queue.
     *
     * @param depth current queue depth
     */
    void recordQueueDepth(int depth);

    /**
     * Records the time spent in one handler invocation.
     *
     * @param durationMs handler execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements BusMetrics {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementDropped() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementHandlerFailure() {
        }

        @Override
        public void incrementLoopWarning() {
        }

        @Override
        public void recordQueueDepth(int depth) {
        }
    }
}
