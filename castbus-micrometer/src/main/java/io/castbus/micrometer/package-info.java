/**
 * Micrometer bridge for exporting event bus metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.castbus.micrometer.MicrometerBusMetrics} implements the
 * {@link io.castbus.spi.BusMetrics} SPI using Micrometer counters, a gauge and a timer.
 *
 * @see io.castbus.micrometer.MicrometerBusMetrics
 */
package io.castbus.micrometer;
