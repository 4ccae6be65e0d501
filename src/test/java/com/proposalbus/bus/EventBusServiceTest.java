package com.proposalbus.bus;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class EventBusServiceTest {

    private VirtualTimeScheduler clock;
    private EventBusService bus;

    @BeforeEach
    void setUp() {
        clock = VirtualTimeScheduler.create();
        EventBusProperties properties = new EventBusProperties();
        properties.setDefaultTimeout(Duration.ofSeconds(5));
        properties.setDefaultRetries(3);
        properties.setRetryDelay(Duration.ofMillis(100));
        bus = new EventBusService(properties, new InMemoryEventJournal(100), clock);
    }

    @AfterEach
    void tearDown() {
        clock.dispose();
    }

    private long now() {
        return clock.now(TimeUnit.MILLISECONDS);
    }

    private List<HandlerOutcome> publishAndSettle(String type, Object payload, Duration settle) {
        AtomicReference<List<HandlerOutcome>> result = new AtomicReference<>();
        bus.publishAwaitable(type, payload).subscribe(result::set);
        clock.advanceTimeBy(settle);
        assertNotNull(result.get(), "dispatch did not complete");
        return result.get();
    }

    @Nested
    @DisplayName("Retry and timeout")
    class RetryAndTimeout {

        @Test
        @DisplayName("always-failing handler is retried exactly `retries` times with growing delays")
        void failingHandler_retriedWithLinearBackoff() {
            List<Long> attempts = new ArrayList<>();
            List<Long> siblingCalls = new ArrayList<>();
            bus.subscribe("test:fail", event -> {
                attempts.add(now());
                return Mono.error(new IllegalStateException("boom"));
            });
            bus.subscribe("test:fail", event -> {
                siblingCalls.add(now());
                return Mono.just(HandlerResult.proceed("ok"));
            });

            long start = now();
            List<HandlerOutcome> outcomes = publishAndSettle("test:fail", "payload", Duration.ofSeconds(2));

            assertEquals(4, attempts.size(), "one initial attempt plus three retries");
            List<Long> gaps = new ArrayList<>();
            for (int i = 1; i < attempts.size(); i++) {
                gaps.add(attempts.get(i) - attempts.get(i - 1));
            }
            assertEquals(List.of(100L, 200L, 300L), gaps);

            assertEquals(List.of(start), siblingCalls, "sibling ran immediately, unaffected by retries");
            HandlerOutcome failed = outcomes.stream().filter(o -> !o.succeeded()).findFirst().orElseThrow();
            assertEquals(4, assertInstanceOf(HandlerExhaustedException.class, failed.error()).getAttempts());
            assertEquals(4, failed.attempts());
            assertEquals(1, outcomes.stream().filter(HandlerOutcome::succeeded).count());
        }

        @Test
        void handlerSucceedingOnSecondAttempt_reportsSuccess() {
            AtomicInteger calls = new AtomicInteger();
            bus.subscribe("test:flaky", event -> calls.incrementAndGet() == 1
                ? Mono.error(new IllegalStateException("first call fails"))
                : Mono.just(HandlerResult.proceed()));

            List<HandlerOutcome> outcomes = publishAndSettle("test:flaky", null, Duration.ofSeconds(1));

            assertTrue(outcomes.get(0).succeeded());
            assertEquals(2, outcomes.get(0).attempts());
        }

        @Test
        void hangingHandler_timesOut() {
            bus.subscribe("test:hang", event -> Mono.never(),
                SubscriptionOptions.defaults().withTimeout(Duration.ofMillis(50)).withRetries(0));

            List<HandlerOutcome> outcomes = publishAndSettle("test:hang", null, Duration.ofSeconds(1));

            HandlerOutcome outcome = outcomes.get(0);
            assertFalse(outcome.succeeded());
            assertInstanceOf(HandlerExhaustedException.class, outcome.error());
            assertInstanceOf(HandlerTimeoutException.class, outcome.error().getCause());
        }

        @Test
        void handlerThrowingSynchronously_isTreatedAsFailure() {
            bus.subscribe("test:throw", event -> {
                throw new IllegalArgumentException("bad input");
            }, SubscriptionOptions.defaults().withRetries(0));

            List<HandlerOutcome> outcomes = publishAndSettle("test:throw", null, Duration.ofMillis(10));

            assertFalse(outcomes.get(0).succeeded());
            assertEquals("bad input", outcomes.get(0).error().getCause().getMessage());
        }
    }

    @Nested
    @DisplayName("Priority tiers")
    class PriorityTiers {

        @Test
        void higherPriorityTierRunsFirst() {
            List<String> order = new CopyOnWriteArrayList<>();
            bus.subscribe("test:tiers", event -> {
                order.add("low");
                return Mono.just(HandlerResult.proceed());
            }, SubscriptionOptions.priority(0));
            bus.subscribe("test:tiers", event -> Mono.delay(Duration.ofMillis(50), clock)
                .doOnNext(tick -> order.add("high"))
                .thenReturn(HandlerResult.proceed()), SubscriptionOptions.priority(10));

            publishAndSettle("test:tiers", null, Duration.ofSeconds(1));

            assertEquals(List.of("high", "low"), order, "low tier waits for the slow high tier");
        }

        @Test
        void stopPropagation_skipsLowerTiers() {
            AtomicInteger lowCalls = new AtomicInteger();
            bus.subscribe("test:stop", event -> {
                lowCalls.incrementAndGet();
                return Mono.just(HandlerResult.proceed());
            }, SubscriptionOptions.priority(1));
            bus.subscribe("test:stop", event -> Mono.just(HandlerResult.stop()),
                SubscriptionOptions.priority(5));

            List<HandlerOutcome> outcomes = publishAndSettle("test:stop", null, Duration.ofMillis(10));

            assertEquals(0, lowCalls.get());
            assertEquals(1, outcomes.size());
            assertTrue(outcomes.get(0).stopsPropagation());
        }

        @Test
        void failedHighTier_doesNotBlockLowerTier() {
            AtomicInteger lowCalls = new AtomicInteger();
            bus.subscribe("test:fail-high", event -> Mono.error(new IllegalStateException("x")),
                SubscriptionOptions.priority(9).withRetries(0));
            bus.subscribe("test:fail-high", event -> {
                lowCalls.incrementAndGet();
                return Mono.just(HandlerResult.proceed());
            });

            publishAndSettle("test:fail-high", null, Duration.ofMillis(10));

            assertEquals(1, lowCalls.get());
        }
    }

    @Nested
    @DisplayName("Dispatch ordering")
    class DispatchOrdering {

        @Test
        void sameTypeAwaitableDispatches_areQueued() {
            List<Long> starts = new CopyOnWriteArrayList<>();
            bus.subscribe("test:serial", event -> {
                starts.add(now());
                return Mono.delay(Duration.ofMillis(100), clock).thenReturn(HandlerResult.proceed());
            });

            long start = now();
            bus.publishAwaitable("test:serial", 1);
            bus.publishAwaitable("test:serial", 2);
            clock.advanceTimeBy(Duration.ofSeconds(1));

            assertEquals(List.of(start, start + 100), starts);
        }

        @Test
        void fireAndForgetPublish_isNotQueuedBehindAwaitableDispatch() {
            List<Object> payloads = new CopyOnWriteArrayList<>();
            bus.subscribe("test:serial", event -> {
                payloads.add(event.payload());
                return Mono.delay(Duration.ofSeconds(1), clock).thenReturn(HandlerResult.proceed());
            });

            bus.publishAwaitable("test:serial", 1);
            bus.publish("test:serial", 2);

            assertEquals(List.of(1, 2), payloads, "both handler calls entered before any time passed");
        }

        @Test
        void otherTypes_areNotQueuedBehindABusyType() {
            List<String> seen = new CopyOnWriteArrayList<>();
            bus.subscribe("test:slow", event -> Mono.delay(Duration.ofMillis(500), clock)
                .thenReturn(HandlerResult.proceed()));
            bus.subscribe("test:fast", event -> {
                seen.add("fast");
                return Mono.just(HandlerResult.proceed());
            });

            bus.publish("test:slow", null);
            bus.publish("test:fast", null);

            assertEquals(List.of("fast"), seen, "fast handler entered synchronously");
        }

        @Test
        void idleType_entersHandlerOnPublishingThread() {
            AtomicReference<Thread> handlerThread = new AtomicReference<>();
            bus.subscribe("test:sync", event -> {
                handlerThread.set(Thread.currentThread());
                return Mono.just(HandlerResult.proceed());
            });

            bus.publish("test:sync", null);

            assertSame(Thread.currentThread(), handlerThread.get());
        }
    }

    @Nested
    @DisplayName("Subscriptions")
    class Subscriptions {

        @Test
        void onceHandler_runsOnlyOnce() {
            AtomicInteger calls = new AtomicInteger();
            bus.subscribe("test:once", event -> {
                calls.incrementAndGet();
                return Mono.just(HandlerResult.proceed());
            }, SubscriptionOptions.defaults().withOnce());

            bus.publish("test:once", null);
            bus.publish("test:once", null);
            clock.advanceTimeBy(Duration.ofMillis(10));

            assertEquals(1, calls.get());
            assertEquals(0, bus.subscriberCount("test:once"));
        }

        @Test
        void disposedHandler_isNoLongerCalled() {
            AtomicInteger calls = new AtomicInteger();
            Disposable subscription = bus.subscribe("test:dispose", event -> {
                calls.incrementAndGet();
                return Mono.just(HandlerResult.proceed());
            });
            subscription.dispose();

            List<HandlerOutcome> outcomes = publishAndSettle("test:dispose", null, Duration.ofMillis(10));

            assertEquals(0, calls.get());
            assertTrue(outcomes.isEmpty());
        }

        @Test
        void publishedEvents_areJournaledAndObserved() {
            List<String> observed = new ArrayList<>();
            String observerId = bus.observe(event -> observed.add(event.type()));

            bus.publish("test:a", "one");
            bus.publish("test:b", "two");
            bus.stopObserving(observerId);
            bus.publish("test:a", "three");

            assertEquals(List.of("test:a", "test:b"), observed);
            assertEquals(2, bus.query(Optional.of("test:a"), 10).size());
            assertEquals(3, bus.latestSequence());
            assertEquals(3, bus.metrics().eventsEmitted());
        }
    }
}
