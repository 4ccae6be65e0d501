package com.proposalbus.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe hub.
 *
 * <p>Handlers of one event type are grouped into tiers by priority (highest first). A tier's
 * handlers are started together and awaited together before the next tier starts, unless one
 * of them asks to stop propagation. Each handler runs under its own timeout and linear-backoff
 * retry loop; a handler that never succeeds is reported as a failed {@link HandlerOutcome}
 * and does not affect its siblings.
 *
 * <p>{@link #publish} fans out at once on the publishing thread. Awaitable dispatches of the
 * same event type are queued behind each other; handler bodies of an idle type are entered
 * on the publishing thread. Continuations resume on the loop {@link Scheduler}.
 */
@Service
public class EventBusService {

    private static final Logger log = LoggerFactory.getLogger(EventBusService.class);

    private final EventBusProperties properties;
    private final EventJournal journal;
    private final Scheduler loop;
    private final BusMetrics metrics = new BusMetrics();
    private final AtomicLong subscriptionCounter = new AtomicLong();
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Subscription>> handlers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Consumer<BusEvent>> observers = new ConcurrentHashMap<>();
    // guarded by itself
    private final Map<String, Mono<List<HandlerOutcome>>> lanes = new HashMap<>();

    public EventBusService(EventBusProperties properties, EventJournal journal, Scheduler loop) {
        this.properties = properties;
        this.journal = journal;
        this.loop = loop;
    }

    public Disposable subscribe(String type, EventHandler handler) {
        return subscribe(type, handler, SubscriptionOptions.defaults());
    }

    /**
     * Registers a handler for one event type.
     *
     * @return a handle whose {@code dispose()} removes the handler
     */
    public Disposable subscribe(String type, EventHandler handler, SubscriptionOptions options) {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(handler, "handler is required");
        Objects.requireNonNull(options, "options are required");
        Subscription subscription = new Subscription(
            type + "#" + subscriptionCounter.incrementAndGet(), type, handler, options);
        handlers.computeIfAbsent(type, key -> new CopyOnWriteArrayList<>()).add(subscription);
        log.debug("Subscribed {} (priority={}, once={})", subscription.id(), options.priority(), options.once());
        return () -> unsubscribe(subscription);
    }

    public int subscriberCount(String type) {
        List<Subscription> current = handlers.get(type);
        return current == null ? 0 : current.size();
    }

    /**
     * Fire-and-forget publish. Every handler is entered before this method returns, even while
     * an awaitable dispatch of the same type is still running.
     */
    public void publish(String type, Object payload) {
        BusEvent event = record(type, payload);
        dispatch(event).subscribe(
            outcomes -> log.trace("Dispatched {} to {} handlers", event.id(), outcomes.size()),
            ex -> log.error("Dispatch of {} ({}) failed", event.id(), type, ex));
    }

    /**
     * Publishes an event and exposes the completion of its dispatch. The dispatch is started
     * eagerly, so callers may ignore the result. Never awaits a dispatch of the same type from
     * inside one of that type's handlers: it is queued behind the running one.
     *
     * @return all handler outcomes in tier order; never signals an error
     */
    public Mono<List<HandlerOutcome>> publishAwaitable(String type, Object payload) {
        BusEvent event = record(type, payload);
        Mono<List<HandlerOutcome>> tail;
        synchronized (lanes) {
            Mono<List<HandlerOutcome>> previous = lanes.get(type);
            Mono<List<HandlerOutcome>> run = Mono.defer(() -> dispatch(event));
            tail = (previous == null ? run : previous.onErrorResume(ex -> Mono.empty()).then(run)).cache();
            lanes.put(type, tail);
        }
        Mono<List<HandlerOutcome>> started = tail;
        started
            .doFinally(signal -> retireLane(type, started))
            .subscribe(
                outcomes -> log.trace("Dispatched {} to {} handlers", event.id(), outcomes.size()),
                ex -> log.error("Dispatch of {} ({}) failed", event.id(), type, ex));
        return started;
    }

    public List<JournalEntry> query(Optional<String> type, int limit) {
        return journal.query(type, limit);
    }

    public List<JournalEntry> queryAfter(long sequenceExclusive, int limit) {
        return journal.queryAfter(sequenceExclusive, limit);
    }

    public long latestSequence() {
        return journal.getLatestSequence();
    }

    public BusMetrics.Snapshot metrics() {
        return metrics.snapshot();
    }

    /**
     * Passive listener for every published event, used by streaming observers. Observers are
     * called synchronously and cannot influence dispatch.
     */
    public String observe(Consumer<BusEvent> observer) {
        String id = UUID.randomUUID().toString();
        observers.put(id, observer);
        return id;
    }

    public void stopObserving(String id) {
        observers.remove(id);
    }

    private BusEvent record(String type, Object payload) {
        Objects.requireNonNull(type, "type is required");
        BusEvent event = BusEvent.of(type, payload);
        journal.append(event);
        metrics.eventEmitted();
        notifyObservers(event);
        return event;
    }

    private void notifyObservers(BusEvent event) {
        observers.values().forEach(observer -> {
            try {
                observer.accept(event);
            } catch (Exception ex) {
                log.warn("Observer notification failed for event={}: {}", event.id(), ex.getMessage());
            }
        });
    }

    private void retireLane(String type, Mono<List<HandlerOutcome>> tail) {
        synchronized (lanes) {
            if (lanes.get(type) == tail) {
                lanes.remove(type);
            }
        }
    }

    private void unsubscribe(Subscription subscription) {
        handlers.computeIfPresent(subscription.type(), (key, current) -> {
            current.remove(subscription);
            return current.isEmpty() ? null : current;
        });
    }

    private Mono<List<HandlerOutcome>> dispatch(BusEvent event) {
        List<Subscription> current = handlers.get(event.type());
        if (current == null || current.isEmpty()) {
            metrics.dispatchCompleted(0, 0);
            return Mono.just(List.of());
        }
        List<Subscription> snapshot = List.copyOf(current);
        snapshot.stream().filter(s -> s.options().once()).forEach(this::unsubscribe);

        TreeMap<Integer, List<Subscription>> byPriority = new TreeMap<>(Comparator.reverseOrder());
        for (Subscription subscription : snapshot) {
            byPriority.computeIfAbsent(subscription.options().priority(), key -> new ArrayList<>()).add(subscription);
        }
        List<List<Subscription>> tiers = new ArrayList<>(byPriority.values());
        long startedAt = System.nanoTime();

        return runTiers(event, tiers, 0, new ArrayList<>())
            .doOnNext(outcomes -> {
                long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
                metrics.dispatchCompleted(Duration.ofNanos(System.nanoTime() - startedAt).toMillis(), failed);
                if (failed > 0) {
                    log.warn("Event {} ({}): {} of {} handlers failed", event.id(), event.type(), failed, outcomes.size());
                }
            });
    }

    private Mono<List<HandlerOutcome>> runTiers(BusEvent event,
                                                List<List<Subscription>> tiers,
                                                int index,
                                                List<HandlerOutcome> collected) {
        if (index >= tiers.size()) {
            return Mono.just(List.copyOf(collected));
        }
        return Flux.fromIterable(tiers.get(index))
            .flatMapSequential(subscription -> invoke(subscription, event))
            .collectList()
            .flatMap(outcomes -> {
                collected.addAll(outcomes);
                if (outcomes.stream().anyMatch(HandlerOutcome::stopsPropagation)) {
                    log.debug("Propagation of {} stopped at priority {}", event.type(),
                        outcomes.get(0).priority());
                    return Mono.just(List.copyOf(collected));
                }
                return runTiers(event, tiers, index + 1, collected);
            });
    }

    private Mono<HandlerOutcome> invoke(Subscription subscription, BusEvent event) {
        SubscriptionOptions options = subscription.options();
        Duration timeout = options.timeout() != null ? options.timeout() : properties.getDefaultTimeout();
        int retries = options.retries() != null ? options.retries() : properties.getDefaultRetries();
        LinearBackoff backoff = new LinearBackoff(properties.getRetryDelay());
        AtomicInteger attempts = new AtomicInteger();

        return Mono.defer(() -> {
                attempts.incrementAndGet();
                return subscription.handler().handle(event);
            })
            .timeout(timeout, loop)
            .onErrorMap(TimeoutException.class,
                ex -> new HandlerTimeoutException(event.type(), subscription.id(), timeout))
            .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                long retriesSoFar = signal.totalRetries();
                Throwable failure = signal.failure();
                if (retriesSoFar >= retries) {
                    return Mono.<Long>error(new HandlerExhaustedException(
                        event.type(), subscription.id(), attempts.get(), failure));
                }
                Duration delay = backoff.delayFor(retriesSoFar + 1);
                log.debug("Handler {} failed attempt {} ({}), retrying in {}ms",
                    subscription.id(), attempts.get(), failure.getMessage(), delay.toMillis());
                return Mono.delay(delay, loop);
            })))
            .defaultIfEmpty(HandlerResult.proceed())
            .publishOn(loop)
            .map(result -> HandlerOutcome.success(subscription.id(), options.priority(), result, attempts.get()))
            .onErrorResume(ex -> {
                log.warn("Handler {} for event {} gave up: {}", subscription.id(), event.id(), ex.getMessage());
                return Mono.just(HandlerOutcome.failure(subscription.id(), options.priority(), ex, attempts.get()));
            });
    }

    private record Subscription(String id, String type, EventHandler handler, SubscriptionOptions options) {}
}
