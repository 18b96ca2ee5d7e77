package io.agentmesh.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.agentmesh.agent.AgentDescriptor;
import io.agentmesh.agent.AgentRegistry;
import io.agentmesh.agent.AgentView;
import io.agentmesh.agent.MethodHandler;
import io.agentmesh.bus.EmitOptions;
import io.agentmesh.bus.EventBus;
import io.agentmesh.bus.MeshEvents;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.error.ErrorKind;
import io.agentmesh.error.MeshException;
import io.agentmesh.model.AgentStatus;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.resilience.CircuitBreaker;
import io.agentmesh.resilience.RateLimiter;
import io.agentmesh.resilience.Retry;
import io.agentmesh.util.Ids;
import io.agentmesh.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Registers agents and routes messages to them through a priority queue.
 *
 * <p>A single dispatcher thread drains the queue (urgent, high, normal, low; FIFO within a
 * tier) and hands each message to the worker pool. While a message is in flight the target's
 * load is raised and its status is {@link AgentStatus#BUSY}. Results of idempotent methods are
 * cached. A timed-out caller gets {@link ErrorKind#TIMEOUT}; the handler keeps running and the
 * agent's load is released exactly once.
 */
public final class AgentRouter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentRouter.class);
    private static final String EVENT_SOURCE = "router";

    private final MeshSettings settings;
    private final EventBus bus;
    private final RateLimiter rateLimiter;
    private final AuditLogger audit;
    private final Clock clock;
    private final AgentRegistry registry = new AgentRegistry();
    private final PriorityMessageQueue<Pending> queue = new PriorityMessageQueue<>();
    private final ResponseCache cache;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Set<String> exemptSenders = ConcurrentHashMap.newKeySet();
    private final Retry retry;
    private final ExecutorService workers;
    private final ScheduledExecutorService timers;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong messagesRouted = new AtomicLong(0L);
    private final AtomicLong messagesDelivered = new AtomicLong(0L);
    private final AtomicLong messagesFailed = new AtomicLong(0L);
    private final AtomicLong deliveredMillis = new AtomicLong(0L);
    private final AtomicLong timeouts = new AtomicLong(0L);
    private final AtomicLong rejected = new AtomicLong(0L);
    private volatile Thread dispatcher;

    public AgentRouter(MeshSettings settings, EventBus bus, RateLimiter rateLimiter, AuditLogger audit) {
        this(settings, bus, rateLimiter, audit, Clock.systemUTC(), new Retry());
    }

    public AgentRouter(
            MeshSettings settings,
            EventBus bus,
            RateLimiter rateLimiter,
            AuditLogger audit,
            Clock clock,
            Retry retry
    ) {
        this.settings = settings;
        this.bus = bus;
        this.rateLimiter = rateLimiter;
        this.audit = audit;
        this.clock = clock;
        this.retry = retry;
        this.cache = new ResponseCache(settings.cacheTtlMs(), settings.cacheMaxEntries());
        this.workers = Executors.newFixedThreadPool(settings.workerThreads(), new NamedThreadFactory("agentmesh-worker"));
        this.timers = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("agentmesh-router-timer"));
    }

    /**
     * Starts the dispatcher and the heartbeat sweep. Messages sent before start stay queued.
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Router is closed");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        Thread thread = new Thread(this::dispatchLoop, "agentmesh-router-dispatcher");
        thread.setDaemon(true);
        dispatcher = thread;
        thread.start();
        long interval = settings.heartbeatSweepIntervalMs();
        timers.scheduleAtFixedRate(() -> {
            try {
                sweepHeartbeats();
            } catch (RuntimeException e) {
                log.error("Heartbeat sweep failed", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Router started with {} workers", settings.workerThreads());
    }

    /**
     * Lets {@code senderId} skip per-sender rate limiting. Used for internal senders whose work
     * is admitted as a whole before it reaches the router.
     */
    public void exemptSender(String senderId) {
        if (senderId == null || senderId.isBlank()) {
            throw MeshException.validation("Exempt sender id is required");
        }
        exemptSenders.add(senderId);
    }

    public String register(AgentDescriptor descriptor) {
        if (descriptor != null && descriptor.id() != null && rateLimiter.isBlocked(descriptor.id().trim())) {
            audit.log(AuditLogger.AuditEvent.of("agent.register", descriptor.id(), "agent", "blocked", Map.of()));
            throw new MeshException(
                    ErrorKind.BLOCKED,
                    "Agent id is blocked: " + descriptor.id(),
                    Map.of("agent", descriptor.id())
            );
        }
        AgentView view = registry.register(descriptor, clock.instant());
        breakers.put(view.id(), new CircuitBreaker(
                "agent:" + view.id(),
                settings.breakerFailureThreshold(),
                settings.breakerRecoveryTimeoutMs(),
                clock
        ));
        audit.log(AuditLogger.AuditEvent.of(
                "agent.register",
                view.id(),
                "agent",
                "ok",
                Map.of("name", view.name(), "capabilities", List.copyOf(view.capabilities()))
        ));
        log.info("Registered agent {} ({}) with capabilities {}", view.id(), view.name(), view.capabilities());
        bus.emitSync(MeshEvents.AGENT_REGISTERED, view, EmitOptions.fromSource(EVENT_SOURCE));
        return view.id();
    }

    public boolean unregister(String agentId) {
        Optional<AgentView> removed = registry.unregister(agentId);
        if (removed.isEmpty()) {
            return false;
        }
        breakers.remove(agentId);
        cache.invalidateAgent(agentId);
        audit.log(AuditLogger.AuditEvent.of("agent.unregister", agentId, "agent", "ok", Map.of()));
        log.info("Unregistered agent {}", agentId);
        bus.emitSync(MeshEvents.AGENT_UNREGISTERED, removed.get(), EmitOptions.fromSource(EVENT_SOURCE));
        return true;
    }

    /**
     * Routes a message and blocks until the result, a failure or the timeout.
     */
    public JsonNode sendMessage(String from, String to, String method, JsonNode args) {
        return sendMessage(from, to, method, args, SendOptions.defaults());
    }

    public JsonNode sendMessage(String from, String to, String method, JsonNode args, SendOptions options) {
        try {
            return sendMessageAsync(from, to, method, args, options).join();
        } catch (CompletionException e) {
            throw MeshException.from(e);
        }
    }

    /**
     * Validates and enqueues a message. Rejections that happen before enqueue (validation,
     * unknown or unavailable agent, unsupported method, rate limit) are thrown directly;
     * everything after is reported through the returned future.
     */
    public CompletableFuture<JsonNode> sendMessageAsync(
            String from,
            String to,
            String method,
            JsonNode args,
            SendOptions options
    ) {
        SendOptions opts = options == null ? SendOptions.defaults() : options;
        if (from == null || from.isBlank()) {
            throw MeshException.validation("Message sender is required");
        }
        if (method == null || method.isBlank()) {
            throw MeshException.validation("Message method is required");
        }
        if (closed.get()) {
            throw new MeshException(ErrorKind.AGENT_UNAVAILABLE, "Router is closed");
        }
        checkSender(from);

        AgentDescriptor descriptor = registry.descriptor(to).orElseThrow(() -> MeshException.agentNotFound(to));
        AgentView target = registry.find(to).orElseThrow(() -> MeshException.agentNotFound(to));
        if (!target.status().routable()) {
            throw new MeshException(
                    ErrorKind.AGENT_UNAVAILABLE,
                    "Agent " + to + " is " + target.status(),
                    Map.of("agent", to, "status", target.status().name())
            );
        }
        if (!descriptor.supports(method)) {
            throw new MeshException(
                    ErrorKind.UNSUPPORTED_METHOD,
                    "Agent " + to + " does not support method " + method,
                    Map.of("agent", to, "method", method)
            );
        }

        JsonNode normalizedArgs = args == null ? NullNode.getInstance() : args;
        if (opts.cacheable() && isIdempotent(method)) {
            Optional<JsonNode> cached = cache.get(ResponseCache.key(to, method, normalizedArgs), clock.millis());
            if (cached.isPresent()) {
                log.debug("Cache hit for {} on {}", method, to);
                return CompletableFuture.completedFuture(cached.get());
            }
        }

        long timeoutMs = opts.timeoutMs() > 0L ? opts.timeoutMs() : settings.defaultMessageTimeoutMs();
        RoutedMessage message = new RoutedMessage(
                Ids.newId("msg"),
                from,
                to,
                method,
                normalizedArgs,
                opts.priority(),
                timeoutMs,
                opts.retryAttempts(),
                opts.cacheable(),
                clock.instant()
        );
        Pending pending = new Pending(message, descriptor.methods().get(method));
        if (!queue.offer(pending, message.priority())) {
            throw new MeshException(ErrorKind.AGENT_UNAVAILABLE, "Router is closed");
        }
        messagesRouted.incrementAndGet();
        ScheduledFuture<?> timer = timers.schedule(() -> onTimeout(pending), timeoutMs, TimeUnit.MILLISECONDS);
        pending.result.whenComplete((value, error) -> timer.cancel(false));
        log.debug("Queued message {} {} -> {} ({}, {})", message.id(), from, to, method, message.priority().label());
        return pending.result;
    }

    /**
     * Sends {@code method} to every routable agent that declares it, except the sender. Agents
     * rejected by {@code filter} are skipped. Each agent's failure is captured in its outcome.
     */
    public Map<String, MessageOutcome> broadcast(String from, String method, JsonNode args, Predicate<AgentView> filter) {
        Map<String, CompletableFuture<JsonNode>> inFlight = new LinkedHashMap<>();
        Map<String, MessageOutcome> outcomes = new LinkedHashMap<>();
        for (AgentView agent : registry.list()) {
            if (agent.id().equals(from) || !agent.status().routable() || !agent.methods().contains(method)) {
                continue;
            }
            if (filter != null && !filter.test(agent)) {
                continue;
            }
            try {
                inFlight.put(agent.id(), sendMessageAsync(from, agent.id(), method, args, SendOptions.defaults()));
            } catch (MeshException e) {
                outcomes.put(agent.id(), MessageOutcome.failure(agent.id(), e));
            }
        }
        for (Map.Entry<String, CompletableFuture<JsonNode>> e : inFlight.entrySet()) {
            try {
                outcomes.put(e.getKey(), MessageOutcome.success(e.getKey(), e.getValue().join()));
            } catch (CompletionException ex) {
                outcomes.put(e.getKey(), MessageOutcome.failure(e.getKey(), MeshException.from(ex)));
            }
        }
        return outcomes;
    }

    public Optional<String> findOptimalAgent(Set<String> requiredCapabilities, Set<String> exclude) {
        return registry.findOptimal(requiredCapabilities, exclude);
    }

    public Optional<String> findOptimalAgent(Set<String> requiredCapabilities) {
        return registry.findOptimal(requiredCapabilities, Set.of());
    }

    public Optional<AgentView> getAgentStatus(String agentId) {
        return registry.find(agentId);
    }

    public List<AgentView> listAgents() {
        return registry.list();
    }

    public void heartbeat(String agentId) {
        AgentStatus previous = registry.heartbeat(agentId, clock.instant());
        if (!previous.routable()) {
            log.info("Agent {} recovered from {}", agentId, previous);
            bus.emitSync(
                    MeshEvents.AGENT_RECOVERED,
                    Map.of("agentId", agentId, "previousStatus", previous.name()),
                    EmitOptions.fromSource(EVENT_SOURCE)
            );
        }
    }

    public AgentView updateAgentStatus(String agentId, AgentStatus status, Integer load) {
        AgentView view = registry.updateStatus(agentId, status, load, clock.instant());
        log.debug("Agent {} status set to {} (load {})", agentId, view.status(), view.loadScore());
        return view;
    }

    /**
     * Marks agents with a stale heartbeat inactive and announces each one. Expired cache entries
     * and rate limit windows are dropped on the same pass.
     */
    public List<AgentView> sweepHeartbeats() {
        Instant cutoff = clock.instant().minusMillis(settings.heartbeatTimeoutMs());
        List<AgentView> stale = registry.markStale(cutoff);
        for (AgentView agent : stale) {
            log.warn("Agent {} missed its heartbeat (last seen {})", agent.id(), agent.lastHeartbeat());
            bus.emitSync(MeshEvents.AGENT_TIMEOUT, agent, EmitOptions.fromSource(EVENT_SOURCE));
        }
        int expired = cache.purgeExpired(clock.millis());
        int windows = rateLimiter.purgeExpired();
        if (expired > 0 || windows > 0) {
            log.debug("Sweep purged {} cache entries and {} rate limit windows", expired, windows);
        }
        return stale;
    }

    public Optional<CircuitBreaker.Snapshot> breakerSnapshot(String agentId) {
        CircuitBreaker breaker = agentId == null ? null : breakers.get(agentId);
        return breaker == null ? Optional.empty() : Optional.of(breaker.snapshot());
    }

    public boolean isIdempotent(String method) {
        return settings.idempotentMethods().contains(method);
    }

    public int queueDepth() {
        return queue.size();
    }

    public RouterMetrics metrics() {
        List<AgentView> agents = registry.list();
        int active = 0;
        int busy = 0;
        int inactive = 0;
        int error = 0;
        long load = 0L;
        for (AgentView agent : agents) {
            switch (agent.status()) {
                case ACTIVE -> active++;
                case BUSY -> busy++;
                case INACTIVE -> inactive++;
                case ERROR -> error++;
            }
            load += agent.loadScore();
        }
        long delivered = messagesDelivered.get();
        return new RouterMetrics(
                agents.size(),
                active,
                busy,
                inactive,
                error,
                agents.isEmpty() ? 0.0d : (double) load / agents.size(),
                queue.size(),
                messagesRouted.get(),
                delivered,
                messagesFailed.get(),
                timeouts.get(),
                delivered == 0L ? 0.0d : (double) deliveredMillis.get() / delivered,
                cache.hits(),
                cache.misses(),
                cache.size(),
                rejected.get()
        );
    }

    /**
     * Stops dispatching. Queued messages fail with {@link ErrorKind#AGENT_UNAVAILABLE}; handlers
     * already running are left to finish.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<Pending> drained = queue.close();
        for (Pending pending : drained) {
            pending.result.completeExceptionally(new MeshException(
                    ErrorKind.AGENT_UNAVAILABLE,
                    "Router closed before message " + pending.message.id() + " was dispatched",
                    Map.of("message", pending.message.id(), "agent", pending.message.to())
            ));
        }
        Thread thread = dispatcher;
        if (thread != null) {
            thread.interrupt();
        }
        timers.shutdownNow();
        workers.shutdown();
        cache.clear();
        log.info("Router closed ({} queued messages failed)", drained.size());
    }

    private void checkSender(String from) {
        if (exemptSenders.contains(from)) {
            return;
        }
        try {
            rateLimiter.acquire(from, RateLimiter.LimitClass.PER_AGENT);
        } catch (MeshException e) {
            rejected.incrementAndGet();
            audit.log(AuditLogger.AuditEvent.of(
                    "message.send",
                    from,
                    "router",
                    e.kind().name().toLowerCase(),
                    Map.of("reason", e.getMessage())
            ));
            throw e;
        }
    }

    private void dispatchLoop() {
        while (true) {
            Pending pending;
            try {
                pending = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (pending == null) {
                return;
            }
            dispatch(pending);
        }
    }

    private void dispatch(Pending pending) {
        if (pending.result.isDone()) {
            return;
        }
        RoutedMessage message = pending.message;
        Optional<AgentView> target = registry.find(message.to());
        if (target.isEmpty()) {
            fail(pending, MeshException.agentNotFound(message.to()));
            return;
        }
        if (!target.get().status().routable()) {
            fail(pending, new MeshException(
                    ErrorKind.AGENT_UNAVAILABLE,
                    "Agent " + message.to() + " became " + target.get().status() + " before dispatch",
                    Map.of("agent", message.to())
            ));
            return;
        }
        registry.acquireLoad(message.to());
        pending.dispatched.set(true);
        try {
            workers.execute(() -> execute(pending));
        } catch (RejectedExecutionException e) {
            release(pending);
            fail(pending, new MeshException(ErrorKind.AGENT_UNAVAILABLE, "Router is shutting down"));
        }
    }

    private void execute(Pending pending) {
        RoutedMessage message = pending.message;
        long startedAt = clock.millis();
        JsonNode result;
        try {
            result = retry.withRetry(
                    () -> invoke(pending),
                    message.retryAttempts(),
                    Retry.exponentialDelays(settings.routerRetryBaseDelayMs(), message.retryAttempts())
            );
        } catch (MeshException e) {
            release(pending);
            fail(pending, e);
            return;
        }
        JsonNode value = result == null ? NullNode.getInstance() : result;
        if (message.cacheable() && isIdempotent(message.method())) {
            cache.put(ResponseCache.key(message.to(), message.method(), message.args()), value, clock.millis());
        }
        release(pending);
        if (pending.result.complete(value)) {
            long durationMs = clock.millis() - startedAt;
            deliveredMillis.addAndGet(durationMs);
            messagesDelivered.incrementAndGet();
            log.debug("Delivered message {} to {} in {}ms", message.id(), message.to(), durationMs);
            bus.emitSync(MeshEvents.MESSAGE_DELIVERED, Map.of(
                    "messageId", message.id(),
                    "from", message.from(),
                    "to", message.to(),
                    "method", message.method(),
                    "durationMs", durationMs
            ), EmitOptions.fromSource(EVENT_SOURCE));
        }
    }

    private JsonNode invoke(Pending pending) throws Exception {
        RoutedMessage message = pending.message;
        if (pending.result.isDone()) {
            throw new MeshException(
                    ErrorKind.TIMEOUT,
                    "Message " + message.id() + " already settled",
                    Map.of("message", message.id()),
                    false,
                    null,
                    null
            );
        }
        CircuitBreaker breaker = breakers.get(message.to());
        MethodHandler handler = pending.handler;
        try {
            return breaker == null
                    ? handler.handle(message.args())
                    : breaker.execute(() -> handler.handle(message.args()));
        } catch (Exception e) {
            throw MeshException.execution(message.to(), e);
        }
    }

    private void onTimeout(Pending pending) {
        RoutedMessage message = pending.message;
        MeshException timeout = MeshException.timeout(
                "Message " + message.id() + " to " + message.to() + " timed out after " + message.timeoutMs() + "ms",
                Map.of("message", message.id(), "agent", message.to(), "method", message.method(), "timeout_ms", message.timeoutMs())
        );
        if (pending.result.completeExceptionally(timeout)) {
            timeouts.incrementAndGet();
            messagesFailed.incrementAndGet();
            release(pending);
            log.warn("Message {} to {} timed out after {}ms", message.id(), message.to(), message.timeoutMs());
            emitFailure(message, timeout);
        }
    }

    private void fail(Pending pending, MeshException error) {
        if (pending.result.completeExceptionally(error)) {
            messagesFailed.incrementAndGet();
            log.warn("Message {} to {} failed: {}", pending.message.id(), pending.message.to(), error.getMessage());
            emitFailure(pending.message, error);
        }
    }

    private void emitFailure(RoutedMessage message, MeshException error) {
        bus.emitSync(MeshEvents.MESSAGE_FAILED, Map.of(
                "messageId", message.id(),
                "from", message.from(),
                "to", message.to(),
                "method", message.method(),
                "kind", error.kind().name(),
                "error", String.valueOf(error.getMessage())
        ), EmitOptions.fromSource(EVENT_SOURCE));
    }

    private void release(Pending pending) {
        if (pending.dispatched.get() && pending.released.compareAndSet(false, true)) {
            registry.releaseLoad(pending.message.to(), clock.instant());
        }
    }

    private static final class Pending {
        private final RoutedMessage message;
        private final MethodHandler handler;
        private final CompletableFuture<JsonNode> result = new CompletableFuture<>();
        private final AtomicBoolean dispatched = new AtomicBoolean(false);
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Pending(RoutedMessage message, MethodHandler handler) {
            this.message = message;
            this.handler = handler;
        }
    }
}
