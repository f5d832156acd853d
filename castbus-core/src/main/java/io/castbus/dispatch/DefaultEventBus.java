package io.castbus.dispatch;

import io.castbus.AsyncEventHandler;
import io.castbus.Event;
import io.castbus.EventBus;
import io.castbus.EventPayload;
import io.castbus.EventPriority;
import io.castbus.EventType;
import io.castbus.Subscription;
import io.castbus.registry.DefaultSubscriptionRegistry;
import io.castbus.registry.Subscriber;
import io.castbus.registry.SubscriptionRegistry;
import io.castbus.spi.BusMetrics;
import io.castbus.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Buffered, single-threaded {@link EventBus} implementation.
 *
 * <p>Published events go into a {@link DispatchQueue}. One daemon dispatch thread drains
 * the queue one event at a time: it snapshots the subscribers of the event type, runs the
 * {@link EventInterceptor interceptors}, invokes every subscriber and waits for all of them
 * before it re-submits itself for the next event. Handler failures are logged and counted
 * and never reach the publisher or the other subscribers.
 *
 * <p>A {@link LoopDetector} counts publishes per event type. Exceeding the threshold logs a
 * warning; in strict mode {@link #publish} throws {@link EventLoopException} instead.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 *
 * @see DefaultEventBus.Builder
 */
public final class DefaultEventBus implements EventBus, AutoCloseable {
  private static final Logger logger = Logger.getLogger(DefaultEventBus.class.getName());

  private final SubscriptionRegistry registry;
  private final LoopDetector loopDetector;
  private final boolean strict;
  private final BusMetrics metrics;
  private final List<EventInterceptor> interceptors;
  private final Clock clock;
  private final long drainTimeoutMs;

  private final DispatchQueue queue = new DispatchQueue();
  private final Queue<IdleWaiter> idleWaiters = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean draining = new AtomicBoolean();
  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final ExecutorService dispatcher;
  private final ScheduledExecutorService loopReset;

  private DefaultEventBus(Builder builder) {
    this.registry = builder.registry != null ? builder.registry : new DefaultSubscriptionRegistry();
    this.clock = Objects.requireNonNull(builder.clock, "clock");
    this.metrics = builder.metrics != null ? builder.metrics : BusMetrics.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.strict = builder.strict;

    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.loopDetector = new LoopDetector(builder.loopThreshold, builder.loopWindow, clock);

    this.dispatcher = Executors.newSingleThreadExecutor(new DaemonThreadFactory("castbus-dispatch-"));
    this.loopReset = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("castbus-loop-reset-"));
    long windowMs = Math.max(1, builder.loopWindow.toMillis());
    loopReset.scheduleAtFixedRate(loopDetector::resetExpired, windowMs, windowMs, TimeUnit.MILLISECONDS);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public <P extends EventPayload> void publish(EventType<P> type, P payload, Instant timestamp) {
    enqueue(type, payload, timestamp);
  }

  /**
   * {@inheritDoc}
   *
   * <p>If the bus is closed the returned future fails with {@link IllegalStateException};
   * in strict mode a loop violation fails it with {@link EventLoopException}.
   */
  @Override
  public <P extends EventPayload> CompletableFuture<Void> publishAsync(EventType<P> type, P payload) {
    long seq;
    try {
      seq = enqueue(type, payload, null);
    } catch (EventLoopException e) {
      return CompletableFuture.failedFuture(e);
    }
    if (seq < 0) {
      return CompletableFuture.failedFuture(new IllegalStateException("Event bus is closed"));
    }
    return awaitIdle(seq);
  }

  private <P extends EventPayload> long enqueue(EventType<P> type, P payload, Instant timestamp) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(payload, "payload");
    if (!accepting.get()) {
      logger.log(Level.WARNING, "Event bus is closed; dropping event " + type.name());
      metrics.incrementDropped();
      return -1;
    }
    if (loopDetector.record(type.name())) {
      metrics.incrementLoopWarning();
      if (strict) {
        throw new EventLoopException(type.name(), loopDetector.threshold());
      }
      logger.log(Level.WARNING, "Possible event loop: " + type.name() + " published "
          + loopDetector.count(type.name()) + " times within " + loopDetector.window().toMillis() + " ms");
    }
    Event<P> event = Event.create(type, payload, timestamp != null ? timestamp : clock.instant());
    long seq = queue.offer(event);
    metrics.incrementPublished();
    metrics.recordQueueDepth(queue.size());
    if (draining.compareAndSet(false, true)) {
      scheduleDrain();
    }
    return seq;
  }

  private void scheduleDrain() {
    try {
      dispatcher.execute(this::drainStep);
    } catch (RejectedExecutionException e) {
      draining.set(false);
      logger.log(Level.WARNING, "Dispatch thread stopped; " + queue.size() + " events left undelivered", e);
    }
  }

  private void drainStep() {
    DispatchQueue.Pending next = queue.poll();
    if (next == null) {
      draining.set(false);
      completeIdleWaiters();
      // a publish may have slipped in between the empty poll and the flag reset
      if (!queue.isEmpty() && draining.compareAndSet(false, true)) {
        scheduleDrain();
      }
      return;
    }
    try {
      deliver(next.event());
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Drain loop error for eventId=" + next.event().eventId(), t);
    } finally {
      queue.markDelivered(next.sequence());
    }
    metrics.recordQueueDepth(queue.size());
    scheduleDrain();
  }

  private void deliver(Event<?> event) {
    List<Subscriber> subscribers = registry.subscribersFor(event.type().name());

    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDispatch(event);
        completedBefore = i + 1;
      }
    } catch (Exception e) {
      logger.log(Level.SEVERE, "Interceptor beforeDispatch failed; skipping eventId=" + event.eventId(), e);
      runAfterDispatch(event, e, completedBefore);
      return;
    }

    List<CompletableFuture<Throwable>> outcomes = new ArrayList<>(subscribers.size());
    for (Subscriber subscriber : subscribers) {
      if (!subscriber.tryFire()) {
        continue;
      }
      long start = System.nanoTime();
      outcomes.add(subscriber.invoke(event).toCompletableFuture()
          .handle((ignored, error) -> complete(event, subscriber, start, error)));
    }
    CompletableFuture.allOf(outcomes.toArray(new CompletableFuture<?>[0])).join();

    Throwable firstError = null;
    for (CompletableFuture<Throwable> outcome : outcomes) {
      Throwable error = outcome.join();
      if (error != null && firstError == null) {
        firstError = error;
      }
    }
    runAfterDispatch(event, firstError, completedBefore);
  }

  private Throwable complete(Event<?> event, Subscriber subscriber, long startNanos, Throwable error) {
    metrics.recordHandlerDurationMs(Math.max(0, (System.nanoTime() - startNanos) / 1_000_000));
    if (subscriber.once()) {
      registry.remove(subscriber);
    }
    if (error == null) {
      metrics.incrementDelivered();
      return null;
    }
    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    metrics.incrementHandlerFailure();
    logger.log(Level.SEVERE, "Handler failed for " + event.type().name() + " eventId=" + event.eventId()
        + " subscription=" + subscriber.id(), cause);
    return cause;
  }

  private void runAfterDispatch(Event<?> event, Throwable error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(event, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
      }
    }
  }

  private CompletableFuture<Void> awaitIdle(long seq) {
    IdleWaiter waiter = new IdleWaiter(seq, new CompletableFuture<>());
    idleWaiters.add(waiter);
    if (isIdle()) {
      completeIdleWaiters();
    }
    return waiter.future();
  }

  private void completeIdleWaiters() {
    long delivered = queue.deliveredSequence();
    idleWaiters.removeIf(waiter -> {
      if (waiter.sequence() > delivered) {
        return false;
      }
      waiter.future().complete(null);
      return true;
    });
  }

  @Override
  public <P extends EventPayload> Subscription subscribe(
      EventType<P> type, AsyncEventHandler<P> handler, boolean once, EventPriority priority) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(handler, "handler");
    return registry.add(type.name(), handler, once, priority != null ? priority : EventPriority.NORMAL);
  }

  @Override
  public void unsubscribe(Subscription subscription) {
    registry.remove(subscription);
  }

  @Override
  public int subscriberCount(EventType<?> type) {
    return registry.subscribersFor(type.name()).size();
  }

  /**
   * Returns the number of events buffered and not yet taken by the dispatch thread.
   *
   * @return the pending event count
   */
  public int pendingCount() {
    return queue.size();
  }

  /**
   * Returns {@code true} when no event is buffered and no delivery is running.
   *
   * @return whether the bus is idle
   */
  public boolean isIdle() {
    return !draining.get() && queue.isEmpty();
  }

  /**
   * Initiates graceful shutdown: stops accepting new events, waits up to the drain timeout
   * for buffered events to be delivered, then stops the dispatch and loop-reset threads.
   * Events published by handlers during shutdown are dropped.
   */
  @Override
  public void close() {
    if (!accepting.compareAndSet(true, false)) {
      return;
    }
    try {
      awaitIdle(queue.lastSequence()).get(drainTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown. Remaining: " + queue.size());
    } catch (ExecutionException e) {
      logger.log(Level.WARNING, "Drain wait failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      dispatcher.shutdownNow();
      loopReset.shutdownNow();
    }
  }

  private record IdleWaiter(long sequence, CompletableFuture<Void> future) {}

  /** Builder for {@link DefaultEventBus}. */
  public static final class Builder {
    private SubscriptionRegistry registry;
    private int loopThreshold = 10;
    private Duration loopWindow = Duration.ofSeconds(1);
    private boolean strict;
    private BusMetrics metrics;
    private final List<EventInterceptor> interceptors = new ArrayList<>();
    private Clock clock = Clock.systemUTC();
    private long drainTimeoutMs = 5000;

    private Builder() {}

    /**
     * Sets the subscription registry.
     *
     * <p>Optional. Defaults to a new {@link DefaultSubscriptionRegistry}.
     *
     * @param registry the registry
     * @return this builder
     */
    public Builder registry(SubscriptionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets how many publishes of one event type are allowed per loop window.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     *
     * @param loopThreshold the per-window publish limit
     * @return this builder
     */
    public Builder loopThreshold(int loopThreshold) {
      this.loopThreshold = loopThreshold;
      return this;
    }

    /**
     * Sets the loop counting window.
     *
     * <p>Optional. Defaults to one second. Must be positive.
     *
     * @param loopWindow the window length
     * @return this builder
     */
    public Builder loopWindow(Duration loopWindow) {
      this.loopWindow = loopWindow;
      return this;
    }

    /**
     * Makes loop violations throw {@link EventLoopException} from {@code publish} instead of
     * only logging a warning.
     *
     * <p>Optional. Defaults to {@code false}.
     *
     * @param strict whether loop violations are fatal
     * @return this builder
     */
    public Builder strict(boolean strict) {
      this.strict = strict;
      return this;
    }

    /**
     * Sets the metrics sink.
     *
     * <p>Optional. Defaults to {@link BusMetrics#NOOP}.
     *
     * @param metrics the metrics sink
     * @return this builder
     */
    public Builder metrics(BusMetrics metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Appends a single event interceptor.
     *
     * <p>Optional. Interceptors are invoked in registration order before delivery,
     * and in reverse order after delivery.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(EventInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Appends multiple event interceptors.
     *
     * @param interceptors the interceptors to add
     * @return this builder
     */
    public Builder interceptors(List<EventInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    /**
     * Sets the clock used for default timestamps and loop windows.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the maximum time in milliseconds {@link #close()} waits for buffered events.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds and starts the bus.
     *
     * @return a new {@link DefaultEventBus}
     * @throws NullPointerException if {@code clock} or {@code loopWindow} is null
     * @throws IllegalArgumentException if {@code loopThreshold <= 0}, the loop window is
     *     not positive, or {@code drainTimeoutMs < 0}
     */
    public DefaultEventBus build() {
      return new DefaultEventBus(this);
    }
  }
}
