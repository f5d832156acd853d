package io.castbus.dispatch;

import io.castbus.Event;
import io.castbus.Subscription;
import io.castbus.TestEvents.Ping;
import io.castbus.TestEvents.Pong;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static io.castbus.TestEvents.PING;
import static io.castbus.TestEvents.PONG;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultEventBusTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    // ── Builder validation ──────────────────────────────────────────

    @Test
    void builderRejectsNonPositiveLoopThreshold() {
        assertThrows(IllegalArgumentException.class, () ->
                DefaultEventBus.builder().loopThreshold(0).build());
    }

    @Test
    void builderRejectsZeroLoopWindow() {
        assertThrows(IllegalArgumentException.class, () ->
                DefaultEventBus.builder().loopWindow(Duration.ZERO).build());
    }

    @Test
    void builderRejectsNullClock() {
        assertThrows(NullPointerException.class, () ->
                DefaultEventBus.builder().clock(null).build());
    }

    @Test
    void builderRejectsNegativeDrainTimeout() {
        assertThrows(IllegalArgumentException.class, () ->
                DefaultEventBus.builder().drainTimeoutMs(-1).build());
    }

    @Test
    void builderRejectsNullInterceptor() {
        assertThrows(NullPointerException.class, () ->
                DefaultEventBus.builder().interceptor(null));
    }

    // ── Delivery ────────────────────────────────────────────────────

    @Test
    void deliversEventsInPublishOrder() throws Exception {
        try (var bus = newBus()) {
            List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(PING, event -> seen.add(event.payload().n()));

            for (int i = 1; i <= 5; i++) {
                bus.publish(PING, new Ping(i));
            }
            bus.publishAsync(PING, new Ping(6)).get(5, TimeUnit.SECONDS);

            assertEquals(List.of(1, 2, 3, 4, 5, 6), seen);
        }
    }

    @Test
    void publishReturnsBeforeDelivery() throws Exception {
        try (var bus = newBus()) {
            CountDownLatch release = new CountDownLatch(1);
            AtomicBoolean handled = new AtomicBoolean();
            bus.subscribe(PING, event -> {
                release.await(5, TimeUnit.SECONDS);
                handled.set(true);
            });

            bus.publish(PING, new Ping(1));
            assertFalse(handled.get());

            release.countDown();
            bus.publishAsync(PONG, new Pong(0)).get(5, TimeUnit.SECONDS);
            assertTrue(handled.get());
        }
    }

    @Test
    void assignsTimestampFromClockWhenMissing() throws Exception {
        try (var bus = DefaultEventBus.builder().clock(Clock.fixed(NOW, ZoneOffset.UTC)).build()) {
            AtomicReference<Event<Ping>> received = new AtomicReference<>();
            bus.subscribe(PING, received::set);

            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);

            assertEquals(NOW, received.get().timestamp());
            assertNotNull(received.get().eventId());
        }
    }

    @Test
    void keepsExplicitTimestamp() throws Exception {
        try (var bus = newBus()) {
            AtomicReference<Instant> received = new AtomicReference<>();
            bus.subscribe(PING, event -> received.set(event.timestamp()));
            Instant explicit = Instant.parse("2020-01-01T00:00:00Z");

            bus.publish(PING, new Ping(1), explicit);
            bus.publishAsync(PONG, new Pong(0)).get(5, TimeUnit.SECONDS);

            assertEquals(explicit, received.get());
        }
    }

    @Test
    void deliversOnlyToSubscribersOfTheType() throws Exception {
        try (var bus = newBus()) {
            AtomicInteger pings = new AtomicInteger();
            AtomicInteger pongs = new AtomicInteger();
            bus.subscribe(PING, event -> pings.incrementAndGet());
            bus.subscribe(PONG, event -> pongs.incrementAndGet());

            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);

            assertEquals(1, pings.get());
            assertEquals(0, pongs.get());
        }
    }

    @Test
    void invokesSubscribersInRegistrationOrder() throws Exception {
        try (var bus = newBus()) {
            List<String> order = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(PING, event -> order.add("first"));
            bus.subscribe(PING, event -> order.add("second"));
            bus.subscribe(PING, event -> order.add("third"));

            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);

            assertEquals(List.of("first", "second", "third"), order);
        }
    }

    // ── Subscriptions ───────────────────────────────────────────────

    @Test
    void unsubscribedHandlerIsNotInvoked() throws Exception {
        try (var bus = newBus()) {
            AtomicInteger kept = new AtomicInteger();
            AtomicInteger removed = new AtomicInteger();
            bus.subscribe(PING, event -> kept.incrementAndGet());
            Subscription subscription = bus.subscribe(PING, event -> removed.incrementAndGet());

            bus.unsubscribe(subscription);
            bus.unsubscribe(subscription);
            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);

            assertEquals(1, kept.get());
            assertEquals(0, removed.get());
            assertFalse(subscription.isActive());
            assertEquals(1, bus.subscriberCount(PING));
        }
    }

    @Test
    void closingSubscriptionUnsubscribes() throws Exception {
        try (var bus = newBus()) {
            AtomicInteger count = new AtomicInteger();
            Subscription subscription = bus.subscribe(PING, event -> count.incrementAndGet());

            subscription.close();
            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);

            assertEquals(0, count.get());
            assertEquals(0, bus.subscriberCount(PING));
        }
    }

    @Test
    void oneShotSubscriptionFiresExactlyOnce() throws Exception {
        try (var bus = newBus()) {
            AtomicInteger count = new AtomicInteger();
            Subscription subscription = bus.subscribeOnce(PING, event -> count.incrementAndGet());

            bus.publish(PING, new Ping(1));
            bus.publish(PING, new Ping(2));
            bus.publishAsync(PING, new Ping(3)).get(5, TimeUnit.SECONDS);

            assertEquals(1, count.get());
            assertTrue(subscription.once());
            assertEquals(0, bus.subscriberCount(PING));
        }
    }

    @Test
    void oneShotSubscriptionIsRemovedEvenWhenItFails() throws Exception {
        try (var bus = newBus()) {
            AtomicInteger count = new AtomicInteger();
            bus.subscribeOnce(PING, event -> {
                count.incrementAndGet();
                throw new IllegalStateException("boom");
            });

            bus.publish(PING, new Ping(1));
            bus.publishAsync(PING, new Ping(2)).get(5, TimeUnit.SECONDS);

            assertEquals(1, count.get());
            assertEquals(0, bus.subscriberCount(PING));
        }
    }

    @Test
    void subscriptionAddedDuringDeliveryAppliesFromNextEvent() throws Exception {
        try (var bus = newBus()) {
            AtomicInteger late = new AtomicInteger();
            AtomicBoolean added = new AtomicBoolean();
            bus.subscribe(PING, event -> {
                if (added.compareAndSet(false, true)) {
                    bus.subscribe(PING, e -> late.incrementAndGet());
                }
            });

            bus.publish(PING, new Ping(1));
            bus.publishAsync(PING, new Ping(2)).get(5, TimeUnit.SECONDS);

            assertEquals(1, late.get());
        }
    }

    @Test
    void subscriptionRemovedDuringDeliveryStillReceivesCurrentEvent() throws Exception {
        try (var bus = newBus()) {
            AtomicInteger removedCalls = new AtomicInteger();
            AtomicReference<Subscription> removed = new AtomicReference<>();
            bus.subscribe(PING, event -> bus.unsubscribe(removed.get()));
            removed.set(bus.subscribe(PING, event -> removedCalls.incrementAndGet()));

            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);
            assertEquals(1, removedCalls.get());

            bus.publishAsync(PING, new Ping(2)).get(5, TimeUnit.SECONDS);
            assertEquals(1, removedCalls.get());
            assertEquals(1, bus.subscriberCount(PING));
        }
    }

    // ── Failures ────────────────────────────────────────────────────

    @Test
    void handlerFailureDoesNotAffectSiblingsOrLaterEvents() throws Exception {
        CountingBusMetrics metrics = new CountingBusMetrics();
        try (var bus = DefaultEventBus.builder().metrics(metrics).build()) {
            AtomicInteger ok = new AtomicInteger();
            bus.subscribe(PING, event -> {
                throw new IllegalStateException("boom");
            });
            bus.subscribe(PING, event -> ok.incrementAndGet());

            bus.publish(PING, new Ping(1));
            bus.publishAsync(PING, new Ping(2)).get(5, TimeUnit.SECONDS);

            assertEquals(2, ok.get());
            assertEquals(2, metrics.failures.get());
            assertEquals(2, metrics.delivered.get());
            assertEquals(2, metrics.published.get());
            assertEquals(4, metrics.durations.get());
        }
    }

    @Test
    void failedAsyncStageCountsAsFailure() throws Exception {
        CountingBusMetrics metrics = new CountingBusMetrics();
        try (var bus = DefaultEventBus.builder().metrics(metrics).build()) {
            bus.subscribeAsync(PING, event -> CompletableFuture.failedFuture(new IllegalStateException("async")));

            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);

            assertEquals(1, metrics.failures.get());
        }
    }

    // ── Asynchronous handlers and cascades ──────────────────────────

    @Test
    void waitsForAsyncHandlersBeforeNextEvent() throws Exception {
        try (var bus = newBus()) {
            AtomicBoolean firstDone = new AtomicBoolean();
            AtomicBoolean sawFirstDone = new AtomicBoolean();
            bus.subscribeAsync(PING, event -> CompletableFuture.runAsync(() -> {
                sleep(50);
                firstDone.set(true);
            }));
            bus.subscribe(PONG, event -> sawFirstDone.set(firstDone.get()));

            bus.publish(PING, new Ping(1));
            bus.publishAsync(PONG, new Pong(1)).get(5, TimeUnit.SECONDS);

            assertTrue(sawFirstDone.get());
        }
    }

    @Test
    void publishAsyncCompletesAfterCascadeDrains() throws Exception {
        try (var bus = newBus()) {
            AtomicInteger pongs = new AtomicInteger();
            bus.subscribe(PING, event -> bus.publish(PONG, new Pong(event.payload().n())));
            bus.subscribe(PONG, event -> {
                sleep(20);
                pongs.incrementAndGet();
            });

            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);

            assertEquals(1, pongs.get());
            assertTrue(bus.isIdle());
            assertEquals(0, bus.pendingCount());
        }
    }

    // ── Interceptors ────────────────────────────────────────────────

    @Test
    void interceptorsRunBeforeInOrderAndAfterInReverse() throws Exception {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        EventInterceptor outer = new EventInterceptor() {
            @Override
            public void beforeDispatch(Event<?> event) {
                calls.add("before-outer");
            }

            @Override
            public void afterDispatch(Event<?> event, Throwable error) {
                calls.add("after-outer");
            }
        };
        EventInterceptor inner = new EventInterceptor() {
            @Override
            public void beforeDispatch(Event<?> event) {
                calls.add("before-inner");
            }

            @Override
            public void afterDispatch(Event<?> event, Throwable error) {
                calls.add("after-inner");
            }
        };
        try (var bus = DefaultEventBus.builder().interceptors(List.of(outer, inner)).build()) {
            bus.subscribe(PING, event -> calls.add("handler"));

            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);

            assertEquals(List.of("before-outer", "before-inner", "handler", "after-inner", "after-outer"), calls);
        }
    }

    @Test
    void beforeDispatchFailureSkipsDelivery() throws Exception {
        AtomicReference<Throwable> seenError = new AtomicReference<>();
        AtomicInteger handled = new AtomicInteger();
        try (var bus = DefaultEventBus.builder()
                .interceptor(EventInterceptor.after((event, error) -> seenError.set(error)))
                .interceptor(EventInterceptor.before(event -> {
                    throw new IllegalStateException("veto");
                }))
                .build()) {
            bus.subscribe(PING, event -> handled.incrementAndGet());

            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);

            assertEquals(0, handled.get());
            assertInstanceOf(IllegalStateException.class, seenError.get());
        }
    }

    @Test
    void afterDispatchSeesFirstHandlerError() throws Exception {
        AtomicReference<Throwable> seenError = new AtomicReference<>();
        try (var bus = DefaultEventBus.builder()
                .interceptor(EventInterceptor.after((event, error) -> seenError.set(error)))
                .build()) {
            bus.subscribe(PING, event -> {
                throw new IllegalArgumentException("bad");
            });

            bus.publishAsync(PING, new Ping(1)).get(5, TimeUnit.SECONDS);

            assertInstanceOf(IllegalArgumentException.class, seenError.get());
        }
    }

    // ── Loop detection ──────────────────────────────────────────────

    @Test
    void exceedingLoopThresholdOnlyWarnsByDefault() throws Exception {
        CountingBusMetrics metrics = new CountingBusMetrics();
        MutableClock clock = new MutableClock(NOW);
        try (var bus = DefaultEventBus.builder().loopThreshold(3).clock(clock).metrics(metrics).build()) {
            AtomicInteger count = new AtomicInteger();
            bus.subscribe(PING, event -> count.incrementAndGet());

            for (int i = 0; i < 4; i++) {
                bus.publish(PING, new Ping(i));
            }
            bus.publishAsync(PING, new Ping(4)).get(5, TimeUnit.SECONDS);

            assertEquals(5, count.get());
            assertEquals(2, metrics.loopWarnings.get());
        }
    }

    @Test
    void strictModeRejectsPublishAboveThreshold() {
        MutableClock clock = new MutableClock(NOW);
        try (var bus = DefaultEventBus.builder().loopThreshold(2).strict(true).clock(clock).build()) {
            bus.publish(PING, new Ping(1));
            bus.publish(PING, new Ping(2));

            EventLoopException ex = assertThrows(EventLoopException.class, () -> bus.publish(PING, new Ping(3)));
            assertEquals("test.ping", ex.eventType());
            assertEquals(2, ex.threshold());

            ExecutionException async = assertThrows(ExecutionException.class, () ->
                    bus.publishAsync(PING, new Ping(4)).get(5, TimeUnit.SECONDS));
            assertInstanceOf(EventLoopException.class, async.getCause());
        }
    }

    @Test
    void loopCounterResetsAfterWindow() {
        MutableClock clock = new MutableClock(NOW);
        try (var bus = DefaultEventBus.builder().loopThreshold(2).strict(true).clock(clock).build()) {
            bus.publish(PING, new Ping(1));
            bus.publish(PING, new Ping(2));

            clock.advance(Duration.ofSeconds(1));

            bus.publish(PING, new Ping(3));
            bus.publish(PING, new Ping(4));
        }
    }

    // ── Shutdown ────────────────────────────────────────────────────

    @Test
    void closeDrainsPendingEvents() {
        AtomicInteger count = new AtomicInteger();
        var bus = newBus();
        bus.subscribe(PING, event -> {
            sleep(10);
            count.incrementAndGet();
        });
        for (int i = 0; i < 5; i++) {
            bus.publish(PING, new Ping(i));
        }

        bus.close();

        assertEquals(5, count.get());
        assertTrue(bus.isIdle());
    }

    @Test
    void publishAfterCloseIsDropped() {
        CountingBusMetrics metrics = new CountingBusMetrics();
        var bus = DefaultEventBus.builder().metrics(metrics).build();
        bus.close();

        bus.publish(PING, new Ping(1));
        ExecutionException ex = assertThrows(ExecutionException.class, () ->
                bus.publishAsync(PING, new Ping(2)).get(5, TimeUnit.SECONDS));

        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertEquals(2, metrics.dropped.get());
        assertEquals(0, metrics.published.get());
    }

    @Test
    void closeIsIdempotent() {
        var bus = newBus();
        bus.close();
        bus.close();
        assertTrue(bus.isIdle());
    }

    private static DefaultEventBus newBus() {
        return DefaultEventBus.builder().build();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
