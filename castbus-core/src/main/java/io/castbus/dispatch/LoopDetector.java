package io.castbus.dispatch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-event-type publish counter with a decay window.
 *
 * <p>Each {@link #record(String)} increments the counter of its type and reports whether
 * the count now exceeds the threshold. A counter whose window has elapsed starts over at
 * zero, either on its next record or when {@link #resetExpired()} runs; the bus calls the
 * latter from a fixed-rate timer.
 *
 * <p>This class is thread-safe.
 */
public final class LoopDetector {

  private final int threshold;
  private final Duration window;
  private final Clock clock;
  private final Map<String, LoopCounter> counters = new ConcurrentHashMap<>();

  /**
   * Creates a detector.
   *
   * @param threshold number of publishes allowed per window; must be &gt; 0
   * @param window length of the counting window; must be positive
   * @param clock time source
   */
  public LoopDetector(int threshold, Duration window, Clock clock) {
    if (threshold <= 0) {
      throw new IllegalArgumentException("threshold must be > 0");
    }
    Objects.requireNonNull(window, "window");
    if (window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be positive");
    }
    this.threshold = threshold;
    this.window = window;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Counts one publish of {@code eventType}.
   *
   * @param eventType the event type name
   * @return {@code true} if the count exceeds the threshold within the current window
   */
  public boolean record(String eventType) {
    Instant now = clock.instant();
    LoopCounter counter = counters.computeIfAbsent(eventType, ignored -> new LoopCounter(now));
    return counter.increment(now, window) > threshold;
  }

  /**
   * Resets every counter whose window has elapsed.
   */
  public void resetExpired() {
    Instant now = clock.instant();
    for (LoopCounter counter : counters.values()) {
      counter.resetIfExpired(now, window);
    }
  }

  /**
   * Returns the current count for a type within its window.
   *
   * @param eventType the event type name
   * @return the count, {@code 0} if never recorded
   */
  public int count(String eventType) {
    LoopCounter counter = counters.get(eventType);
    return counter == null ? 0 : counter.count();
  }

  public int threshold() {
    return threshold;
  }

  public Duration window() {
    return window;
  }

  private static final class LoopCounter {
    private int count;
    private Instant windowStart;

    LoopCounter(Instant windowStart) {
      this.windowStart = windowStart;
    }

    synchronized int increment(Instant now, Duration window) {
      resetIfExpired(now, window);
      return ++count;
    }

    synchronized void resetIfExpired(Instant now, Duration window) {
      if (!now.isBefore(windowStart.plus(window))) {
        count = 0;
        windowStart = now;
      }
    }

    synchronized int count() {
      return count;
    }
  }
}
