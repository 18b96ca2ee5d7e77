package io.agentmesh.bus;

import io.agentmesh.error.ErrorKind;
import io.agentmesh.error.MeshException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

final class EventBusTest {
    private final EventBus bus = new EventBus(100);

    @AfterEach
    void closeBus() {
        bus.close();
    }

    @Test
    void listenersRunByDescendingPriorityThenSubscriptionOrder() {
        List<String> calls = new ArrayList<>();
        bus.subscribe("task:done", e -> calls.add("low"), SubscribeOptions.withPriority(0));
        bus.subscribe("task:done", e -> calls.add("high-1"), SubscribeOptions.withPriority(10));
        bus.subscribe("task:done", e -> calls.add("high-2"), SubscribeOptions.withPriority(10));
        bus.subscribe("task:done", e -> calls.add("mid"), SubscribeOptions.withPriority(5));

        EventRecord record = bus.emit("task:done", "x").join();

        Assertions.assertEquals(List.of("high-1", "high-2", "mid", "low"), calls);
        Assertions.assertEquals(4, record.listenersNotified());
        Assertions.assertFalse(record.failed());
    }

    @Test
    void onceListenerFiresExactlyOnceAndIsRemoved() {
        AtomicInteger calls = new AtomicInteger();
        bus.once("ping", e -> calls.incrementAndGet());

        bus.emit("ping", 1).join();
        bus.emit("ping", 2).join();

        Assertions.assertEquals(1, calls.get());
        Assertions.assertEquals(0, bus.listenerCount("ping"));
        Assertions.assertFalse(bus.hasListeners("ping"));
    }

    @Test
    void filteredOutEventsDoNotConsumeOnceListener() {
        List<Object> seen = new ArrayList<>();
        bus.once("order", e -> seen.add(e.payload()), SubscribeOptions.defaults().filter(e -> "b".equals(e.payload())));

        bus.emit("order", "a").join();
        bus.emit("order", "b").join();
        bus.emit("order", "b").join();

        Assertions.assertEquals(List.of("b"), seen);
    }

    @Test
    void failingListenerIsReportedAndDoesNotStopDispatch() {
        List<String> hookCalls = Collections.synchronizedList(new ArrayList<>());
        bus.setErrorHook((error, eventName, listenerId) -> hookCalls.add(eventName + "/" + listenerId + "/" + error.getMessage()));
        AtomicInteger after = new AtomicInteger();
        bus.subscribe("boom", e -> {
            throw new IllegalStateException("listener broke");
        }, SubscribeOptions.withPriority(10).listenerId("breaker"));
        bus.subscribe("boom", e -> after.incrementAndGet());

        EventRecord record = bus.emit("boom", null).join();

        Assertions.assertEquals(1, after.get());
        Assertions.assertTrue(record.failed());
        Assertions.assertEquals("breaker", record.errors().get(0).listenerId());
        Assertions.assertEquals("IllegalStateException", record.errors().get(0).errorType());
        Assertions.assertEquals(List.of("boom/breaker/listener broke"), hookCalls);
        Assertions.assertEquals(1L, bus.metrics().totalErrors());
    }

    @Test
    void retryPolicyReemitsWithGrowingDelaysAndIncrementedRetryCount() throws Exception {
        bus.setErrorHook((error, eventName, listenerId) -> {
        });
        List<Integer> retryCounts = Collections.synchronizedList(new ArrayList<>());
        List<Long> invokedAtNanos = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch threeCalls = new CountDownLatch(3);
        bus.subscribe("flaky", e -> {
            retryCounts.add(e.retryCount());
            invokedAtNanos.add(System.nanoTime());
            threeCalls.countDown();
            throw new IllegalStateException("still failing");
        });

        bus.emit("flaky", "payload", EmitOptions.defaults().retry(2, 50L)).join();

        Assertions.assertTrue(threeCalls.await(5, TimeUnit.SECONDS));
        Thread.sleep(300L);
        Assertions.assertEquals(List.of(0, 1, 2), retryCounts);
        long firstGapMs = TimeUnit.NANOSECONDS.toMillis(invokedAtNanos.get(1) - invokedAtNanos.get(0));
        long secondGapMs = TimeUnit.NANOSECONDS.toMillis(invokedAtNanos.get(2) - invokedAtNanos.get(1));
        Assertions.assertTrue(firstGapMs >= 50L, "first retry after " + firstGapMs + "ms");
        Assertions.assertTrue(secondGapMs >= 100L, "second retry after " + secondGapMs + "ms");
    }

    @Test
    void successfulDispatchIsNotRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        bus.subscribe("steady", e -> calls.incrementAndGet());

        bus.emit("steady", 1, EmitOptions.defaults().retry(3, 10L)).join();
        Thread.sleep(100L);

        Assertions.assertEquals(1, calls.get());
        Assertions.assertEquals(0, bus.pendingScheduled());
    }

    @Test
    void waitForResolvesWithNextMatchingEvent() {
        CompletableFuture<Event> waiting = bus.waitFor("agent:ready", 2_000L, e -> "b".equals(e.payload()));

        bus.emit("agent:ready", "a").join();
        Assertions.assertFalse(waiting.isDone());
        bus.emit("agent:ready", "b").join();

        Assertions.assertEquals("b", waiting.join().payload());
        Assertions.assertEquals(0, bus.listenerCount("agent:ready"));
    }

    @Test
    void waitForFailsWithTimeoutAndUnsubscribes() {
        CompletableFuture<Event> waiting = bus.waitFor("never", 50L);

        CompletionException error = Assertions.assertThrows(CompletionException.class, waiting::join);
        MeshException cause = Assertions.assertInstanceOf(MeshException.class, error.getCause());
        Assertions.assertEquals(ErrorKind.TIMEOUT, cause.kind());
        Assertions.assertEquals(0, bus.listenerCount("never"));
    }

    @Test
    void delayedEmitDispatchesLaterAndTracksPendingCount() {
        AtomicInteger calls = new AtomicInteger();
        bus.subscribe("later", e -> calls.incrementAndGet());

        CompletableFuture<EventRecord> future = bus.emit("later", null, EmitOptions.defaults().delayMs(100L));

        Assertions.assertEquals(0, calls.get());
        Assertions.assertEquals(1, bus.pendingScheduled());
        Assertions.assertEquals(1, future.join().listenersNotified());
        Assertions.assertEquals(1, calls.get());
    }

    @Test
    void emitAwaitsAsyncListenersInPriorityOrder() {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        bus.subscribeAsync("job", e -> CompletableFuture.runAsync(() -> {
            sleepQuietly(50L);
            calls.add("slow-first");
        }), SubscribeOptions.withPriority(1));
        bus.subscribe("job", e -> calls.add("second"));

        bus.emit("job", null).join();

        Assertions.assertEquals(List.of("slow-first", "second"), calls);
    }

    @Test
    void historyIsCappedAndFilterable() {
        EventBus small = new EventBus(3);
        try {
            for (int i = 0; i < 5; i++) {
                small.emitSync(i % 2 == 0 ? "even" : "odd", i);
            }
            List<EventRecord> all = small.history(null, 0);
            Assertions.assertEquals(3, all.size());
            Assertions.assertEquals(2, all.get(0).event().payload());
            Assertions.assertEquals(4, all.get(2).event().payload());
            Assertions.assertEquals(2, small.history("even", 0).size());
            Assertions.assertEquals(1, small.history("even", 1).size());
            Assertions.assertEquals(4, small.history("even", 1).get(0).event().payload());

            small.clearHistory();
            Assertions.assertTrue(small.history(null, 0).isEmpty());
            Assertions.assertEquals(5L, small.metrics().totalEvents());
        } finally {
            small.close();
        }
    }

    @Test
    void namespacePrefixesEventNamesAndStampsSource() {
        NamespacedEventBus research = bus.namespace("research");
        List<Event> seen = new ArrayList<>();
        bus.subscribe("research:done", seen::add);

        research.emit("done", "report").join();
        research.emit("done", "other", EmitOptions.fromSource("agent-7")).join();

        Assertions.assertEquals(2, seen.size());
        Assertions.assertEquals("research", seen.get(0).source());
        Assertions.assertEquals("agent-7", seen.get(1).source());
        Assertions.assertEquals("research:done", research.qualify("done"));
    }

    @Test
    void unsubscribeAllAndMetricsReflectListenerTable() {
        bus.subscribe("a", e -> {
        });
        bus.subscribe("a", e -> {
        });
        String id = bus.subscribe("b", e -> {
        });

        Assertions.assertEquals(3, bus.totalListenerCount());
        Assertions.assertTrue(bus.unsubscribe("b", id));
        Assertions.assertFalse(bus.unsubscribe("b", id));
        Assertions.assertEquals(2, bus.unsubscribeAll("a"));
        Assertions.assertTrue(bus.eventNames().isEmpty());

        bus.emit("a", null).join();
        BusMetrics metrics = bus.metrics();
        Assertions.assertEquals(1L, metrics.totalEvents());
        Assertions.assertEquals(1L, metrics.eventCounts().get("a"));
        Assertions.assertNotNull(metrics.lastEventAt());
    }

    @Test
    void emitWithoutListenersIsStillRecorded() {
        EventRecord record = bus.emit("nobody:listens", "x").join();
        bus.emitSync("nobody:listens", "y");

        Assertions.assertEquals(0, record.listenersNotified());
        Assertions.assertFalse(record.failed());
        Assertions.assertEquals(2, bus.history("nobody:listens", 0).size());
        Assertions.assertEquals(2L, bus.metrics().totalEvents());
        Assertions.assertEquals(2L, bus.metrics().eventCounts().get("nobody:listens"));
    }

    @Test
    void blankEventNameIsRejected() {
        MeshException error = Assertions.assertThrows(MeshException.class, () -> bus.emit(" ", null));
        Assertions.assertEquals(ErrorKind.VALIDATION, error.kind());
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
