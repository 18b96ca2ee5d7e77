package io.agentmesh.bus;

import io.agentmesh.error.ErrorKind;
import io.agentmesh.error.MeshException;
import io.agentmesh.util.Ids;
import io.agentmesh.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * In-process publish/subscribe bus with prioritized listeners, one-shot subscriptions,
 * bounded history and delayed or retried emission.
 *
 * <p>Listeners for an event run in descending priority, ties in subscription order. A failing
 * listener is reported to the error hook and never stops the remaining listeners.
 */
public final class EventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);
    private static final Comparator<Listener> DISPATCH_ORDER = Comparator
            .comparingInt(Listener::priority).reversed()
            .thenComparingLong(Listener::sequence);

    private final Object lock = new Object();
    private final Map<String, LinkedHashMap<String, Listener>> listeners = new HashMap<>();
    private final Deque<EventRecord> history = new ArrayDeque<>();
    private final int maxHistory;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final AtomicLong sequence = new AtomicLong(0L);
    private final AtomicLong totalEvents = new AtomicLong(0L);
    private final AtomicLong totalErrors = new AtomicLong(0L);
    private final AtomicInteger pendingScheduled = new AtomicInteger(0);
    private final Map<String, Long> eventCounts = new TreeMap<>();
    private volatile Instant lastEventAt;
    private volatile EventErrorHook errorHook;

    public EventBus(int maxHistory) {
        this(maxHistory, Clock.systemUTC());
    }

    public EventBus(int maxHistory, Clock clock) {
        this.maxHistory = Math.max(1, maxHistory);
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("agentmesh-bus"));
        this.errorHook = (error, eventName, listenerId) -> log.error(
                "Listener {} failed for event {}", listenerId, eventName, error);
    }

    public String subscribe(String eventName, EventHandler handler) {
        return subscribe(eventName, handler, SubscribeOptions.defaults());
    }

    public String subscribe(String eventName, EventHandler handler, SubscribeOptions options) {
        Objects.requireNonNull(handler, "handler");
        return subscribeAsync(eventName, event -> {
            handler.handle(event);
            return null;
        }, options);
    }

    public String subscribeAsync(String eventName, AsyncEventHandler handler, SubscribeOptions options) {
        requireName(eventName);
        Objects.requireNonNull(handler, "handler");
        SubscribeOptions opts = options == null ? SubscribeOptions.defaults() : options;
        String listenerId = opts.listenerId() == null || opts.listenerId().isBlank()
                ? Ids.newId("lsn")
                : opts.listenerId();
        Listener listener = new Listener(
                listenerId,
                opts.priority(),
                opts.once(),
                opts.filter(),
                handler,
                sequence.incrementAndGet()
        );
        synchronized (lock) {
            listeners.computeIfAbsent(eventName, k -> new LinkedHashMap<>()).put(listenerId, listener);
        }
        log.debug("Subscribed listener {} to {}", listenerId, eventName);
        return listenerId;
    }

    public String once(String eventName, EventHandler handler) {
        return subscribe(eventName, handler, SubscribeOptions.defaults().once(true));
    }

    public String once(String eventName, EventHandler handler, SubscribeOptions options) {
        SubscribeOptions opts = options == null ? SubscribeOptions.defaults() : options;
        return subscribe(eventName, handler, opts.once(true));
    }

    public boolean unsubscribe(String eventName, String listenerId) {
        synchronized (lock) {
            LinkedHashMap<String, Listener> byId = listeners.get(eventName);
            if (byId == null) {
                return false;
            }
            boolean removed = byId.remove(listenerId) != null;
            if (byId.isEmpty()) {
                listeners.remove(eventName);
            }
            return removed;
        }
    }

    public int unsubscribeAll(String eventName) {
        synchronized (lock) {
            LinkedHashMap<String, Listener> removed = listeners.remove(eventName);
            return removed == null ? 0 : removed.size();
        }
    }

    /**
     * Dispatches an event, waiting for async listeners in order. With a delay the dispatch is
     * scheduled and the returned future completes once it has run. Retries triggered by
     * listener failures happen in the background after the future completes.
     */
    public CompletableFuture<EventRecord> emit(String eventName, Object payload) {
        return emit(eventName, payload, EmitOptions.defaults());
    }

    public CompletableFuture<EventRecord> emit(String eventName, Object payload, EmitOptions options) {
        requireName(eventName);
        EmitOptions opts = options == null ? EmitOptions.defaults() : options;
        Event event = newEvent(eventName, payload, opts);
        if (opts.delayMs() > 0L) {
            CompletableFuture<EventRecord> future = new CompletableFuture<>();
            schedule(() -> {
                try {
                    future.complete(dispatchWithRetry(event, opts.retry()));
                } catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            }, opts.delayMs());
            return future;
        }
        return CompletableFuture.completedFuture(dispatchWithRetry(event, opts.retry()));
    }

    /**
     * Dispatches without waiting on async listeners; their later failures are only logged.
     * Retry policies are ignored.
     */
    public void emitSync(String eventName, Object payload) {
        emitSync(eventName, payload, EmitOptions.defaults());
    }

    public void emitSync(String eventName, Object payload, EmitOptions options) {
        requireName(eventName);
        EmitOptions opts = options == null ? EmitOptions.defaults() : options;
        Event event = newEvent(eventName, payload, opts);
        if (opts.delayMs() > 0L) {
            schedule(() -> dispatch(event, false), opts.delayMs());
            return;
        }
        dispatch(event, false);
    }

    /**
     * Completes with the next event named {@code eventName} that passes {@code filter}, or
     * fails with {@link ErrorKind#TIMEOUT} once {@code timeoutMs} elapses. A non-positive
     * timeout waits indefinitely.
     */
    public CompletableFuture<Event> waitFor(String eventName, long timeoutMs, Predicate<Event> filter) {
        CompletableFuture<Event> result = new CompletableFuture<>();
        String listenerId = subscribe(
                eventName,
                result::complete,
                SubscribeOptions.defaults().once(true).filter(filter)
        );
        if (timeoutMs > 0L) {
            ScheduledFuture<?> timer = scheduler.schedule(() -> {
                if (unsubscribe(eventName, listenerId)) {
                    result.completeExceptionally(MeshException.timeout(
                            "Timeout waiting for event: " + eventName,
                            Map.of("event", eventName, "timeout_ms", timeoutMs)
                    ));
                }
            }, timeoutMs, TimeUnit.MILLISECONDS);
            result.whenComplete((event, error) -> timer.cancel(false));
        }
        return result;
    }

    public CompletableFuture<Event> waitFor(String eventName, long timeoutMs) {
        return waitFor(eventName, timeoutMs, null);
    }

    public NamespacedEventBus namespace(String prefix) {
        return new NamespacedEventBus(this, prefix);
    }

    public void setErrorHook(EventErrorHook hook) {
        this.errorHook = Objects.requireNonNull(hook, "hook");
    }

    public List<String> eventNames() {
        synchronized (lock) {
            return List.copyOf(listeners.keySet());
        }
    }

    public int listenerCount(String eventName) {
        synchronized (lock) {
            LinkedHashMap<String, Listener> byId = listeners.get(eventName);
            return byId == null ? 0 : byId.size();
        }
    }

    public int totalListenerCount() {
        synchronized (lock) {
            return listeners.values().stream().mapToInt(Map::size).sum();
        }
    }

    public boolean hasListeners(String eventName) {
        return listenerCount(eventName) > 0;
    }

    /**
     * Most recent dispatches, oldest first. A null name means all events; a non-positive
     * limit means the whole retained history.
     */
    public List<EventRecord> history(String eventName, int limit) {
        List<EventRecord> matching = new ArrayList<>();
        synchronized (history) {
            for (EventRecord record : history) {
                if (eventName == null || eventName.equals(record.event().name())) {
                    matching.add(record);
                }
            }
        }
        if (limit > 0 && matching.size() > limit) {
            return List.copyOf(matching.subList(matching.size() - limit, matching.size()));
        }
        return List.copyOf(matching);
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
    }

    public int pendingScheduled() {
        return pendingScheduled.get();
    }

    public BusMetrics metrics() {
        int listenerTotal;
        int names;
        synchronized (lock) {
            listenerTotal = listeners.values().stream().mapToInt(Map::size).sum();
            names = listeners.size();
        }
        Map<String, Long> counts;
        synchronized (eventCounts) {
            counts = Map.copyOf(eventCounts);
        }
        long events = totalEvents.get();
        long errors = totalErrors.get();
        return new BusMetrics(
                events,
                errors,
                listenerTotal,
                names,
                names == 0 ? 0.0d : (double) listenerTotal / names,
                events == 0L ? 0.0d : (errors * 100.0d) / events,
                pendingScheduled.get(),
                counts,
                lastEventAt
        );
    }

    public void clear() {
        synchronized (lock) {
            listeners.clear();
        }
        clearHistory();
        log.info("Event bus cleared");
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }

    private EventRecord dispatchWithRetry(Event event, EmitOptions.RetryPolicy retry) {
        EventRecord record = dispatch(event, true);
        if (record.failed() && retry != null && event.retryCount() < retry.attempts()) {
            Event next = event.nextRetry();
            long delay = retry.delayForRetry(next.retryCount());
            log.warn("Retrying event {} in {}ms (attempt {}/{})",
                    event.name(), delay, next.retryCount(), retry.attempts());
            schedule(() -> dispatchWithRetry(next, retry), delay);
        }
        return record;
    }

    private EventRecord dispatch(Event event, boolean awaitAsync) {
        List<Listener> ordered;
        synchronized (lock) {
            LinkedHashMap<String, Listener> byId = listeners.get(event.name());
            ordered = byId == null ? new ArrayList<>() : new ArrayList<>(byId.values());
        }
        ordered.sort(DISPATCH_ORDER);

        int notified = 0;
        List<EventRecord.ListenerError> errors = new ArrayList<>();
        for (Listener listener : ordered) {
            try {
                if (listener.filter() != null && !listener.filter().test(event)) {
                    continue;
                }
                if (listener.once()) {
                    if (!listener.spent().compareAndSet(false, true)) {
                        continue;
                    }
                    unsubscribe(event.name(), listener.id());
                }
                CompletionStage<?> stage = listener.handler().handle(event);
                if (stage != null) {
                    if (awaitAsync) {
                        stage.toCompletableFuture().join();
                    } else {
                        stage.whenComplete((ignored, asyncError) -> {
                            if (asyncError != null) {
                                totalErrors.incrementAndGet();
                                reportError(MeshException.unwrap(asyncError), event.name(), listener.id());
                            }
                        });
                    }
                }
                notified++;
            } catch (Exception e) {
                Throwable cause = MeshException.unwrap(e);
                errors.add(new EventRecord.ListenerError(
                        listener.id(),
                        cause.getClass().getSimpleName(),
                        cause.getMessage()
                ));
                reportError(cause, event.name(), listener.id());
            }
        }

        totalEvents.incrementAndGet();
        totalErrors.addAndGet(errors.size());
        synchronized (eventCounts) {
            eventCounts.merge(event.name(), 1L, Long::sum);
        }
        lastEventAt = event.timestamp();

        EventRecord record = new EventRecord(event, notified, errors);
        synchronized (history) {
            history.addLast(record);
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
        }
        log.debug("Event {} dispatched ({} listeners notified, {} errors)", event.name(), notified, errors.size());
        return record;
    }

    private void reportError(Throwable error, String eventName, String listenerId) {
        try {
            errorHook.onListenerError(error, eventName, listenerId);
        } catch (RuntimeException hookError) {
            log.error("Error hook failed while reporting listener {} on {}", listenerId, eventName, hookError);
        }
    }

    private void schedule(Runnable task, long delayMs) {
        pendingScheduled.incrementAndGet();
        scheduler.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduled event dispatch failed", e);
            } finally {
                pendingScheduled.decrementAndGet();
            }
        }, Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
    }

    private Event newEvent(String eventName, Object payload, EmitOptions opts) {
        String correlationId = opts.correlationId() == null || opts.correlationId().isBlank()
                ? Ids.newId("evt")
                : opts.correlationId();
        return new Event(eventName, payload, clock.instant(), opts.source(), correlationId, 0);
    }

    private static void requireName(String eventName) {
        if (eventName == null || eventName.isBlank()) {
            throw MeshException.validation("Event name cannot be empty");
        }
    }

    private record Listener(
            String id,
            int priority,
            boolean once,
            Predicate<Event> filter,
            AsyncEventHandler handler,
            long sequence,
            AtomicBoolean spent
    ) {
        Listener(String id, int priority, boolean once, Predicate<Event> filter, AsyncEventHandler handler, long sequence) {
            this(id, priority, once, filter, handler, sequence, new AtomicBoolean(false));
        }
    }
}
