package io.castbus.micrometer;

import io.castbus.spi.BusMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link BusMetrics}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code castbus.publish}: events accepted into the dispatch queue</li>
 *   <li>{@code castbus.publish.dropped}: events dropped because the bus was closed</li>
 *   <li>{@code castbus.dispatch.delivered}: successful handler invocations</li>
 *   <li>{@code castbus.dispatch.failure}: failed handler invocations</li>
 *   <li>{@code castbus.loop.warning}: publishes over the loop threshold</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code castbus.queue.depth}: events waiting for dispatch</li>
 *   <li>{@code castbus.handler.duration}: time spent per handler invocation</li>
 * </ul>
 *
 * @see BusMetrics
 */
public final class MicrometerBusMetrics implements BusMetrics, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter published;
  private final Counter dropped;
  private final Counter delivered;
  private final Counter handlerFailure;
  private final Counter loopWarning;
  private final Gauge queueDepthGauge;
  private final Timer handlerDuration;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates metrics with the default name prefix {@code "castbus"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerBusMetrics(MeterRegistry registry) {
    this(registry, "castbus");
  }

  /**
   * Creates metrics with a custom name prefix, for running several buses in one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "story.castbus"})
   */
  public MicrometerBusMetrics(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.published = Counter.builder(namePrefix + ".publish")
        .description("Events accepted into the dispatch queue")
        .register(registry);
    this.dropped = Counter.builder(namePrefix + ".publish.dropped")
        .description("Events dropped (bus closed)")
        .register(registry);
    this.delivered = Counter.builder(namePrefix + ".dispatch.delivered")
        .description("Successful handler invocations")
        .register(registry);
    this.handlerFailure = Counter.builder(namePrefix + ".dispatch.failure")
        .description("Failed handler invocations")
        .register(registry);
    this.loopWarning = Counter.builder(namePrefix + ".loop.warning")
        .description("Publishes over the loop detection threshold")
        .register(registry);
    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .register(registry);
    this.handlerDuration = Timer.builder(namePrefix + ".handler.duration")
        .description("Time spent in one handler invocation")
        .register(registry);
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementDropped() {
    if (closed) return;
    dropped.increment();
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementHandlerFailure() {
    if (closed) return;
    handlerFailure.increment();
  }

  @Override
  public void incrementLoopWarning() {
    if (closed) return;
    loopWarning.increment();
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(durationMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this instance from the registry.
   *
   * <p>Call this after the bus is closed to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(published, dropped, delivered, handlerFailure, loopWarning,
        queueDepthGauge, handlerDuration)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
