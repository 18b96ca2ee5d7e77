package io.agentmesh.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.bus.EmitOptions;
import io.agentmesh.bus.EventBus;
import io.agentmesh.bus.MeshEvents;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.error.ErrorKind;
import io.agentmesh.error.MeshException;
import io.agentmesh.model.Priority;
import io.agentmesh.model.StepStatus;
import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.resilience.RateLimiter;
import io.agentmesh.routing.AgentRouter;
import io.agentmesh.routing.SendOptions;
import io.agentmesh.util.Ids;
import io.agentmesh.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs workflows as waves of ready steps.
 *
 * <p>A step is ready once every dependency has completed. All ready steps of a wave are sent
 * to the router concurrently and the wave settles when each of them has completed or failed.
 * A failed step fails the workflow after its wave settles; steps that were never dispatched
 * stay {@link StepStatus#PENDING}.
 */
public final class WorkflowCoordinator implements AutoCloseable {
    public static final String SENDER_ID = "workflow-coordinator";
    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    private final AgentRouter router;
    private final EventBus bus;
    private final RateLimiter rateLimiter;
    private final AuditLogger audit;
    private final MeshSettings settings;
    private final Clock clock;
    private final ExecutorService executor;
    private final Map<String, Run> runs = new ConcurrentHashMap<>();

    public WorkflowCoordinator(
            AgentRouter router,
            EventBus bus,
            RateLimiter rateLimiter,
            AuditLogger audit,
            MeshSettings settings
    ) {
        this(router, bus, rateLimiter, audit, settings, Clock.systemUTC());
    }

    /**
     * Step sends are exempt from the router's per-sender limit; each workflow is admitted as a
     * whole against the {@link RateLimiter.LimitClass#GLOBAL} window when it is submitted.
     */
    public WorkflowCoordinator(
            AgentRouter router,
            EventBus bus,
            RateLimiter rateLimiter,
            AuditLogger audit,
            MeshSettings settings,
            Clock clock
    ) {
        this.router = router;
        this.bus = bus;
        this.rateLimiter = rateLimiter;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(settings.workflowThreads(), new NamedThreadFactory("agentmesh-workflow"));
        router.exemptSender(SENDER_ID);
    }

    /**
     * Validates the definition and starts it in the background.
     *
     * @throws MeshException with {@link ErrorKind#VALIDATION} for an empty, duplicated, dangling
     *                       or cyclic step graph, or a step bound to an unknown agent, and with
     *                       {@link ErrorKind#RATE_LIMITED} when its steps do not fit into the
     *                       current admission window
     */
    public String submit(WorkflowDefinition definition) {
        validate(definition);
        admit(definition);
        Run run = new Run(Ids.newId("wf"), definition, clock.instant());
        runs.put(run.id, run);
        audit.log(AuditLogger.AuditEvent.of(
                "workflow.submit",
                SENDER_ID,
                run.id,
                "accepted",
                Map.of("name", run.name, "steps", definition.steps().size())
        ));
        try {
            executor.execute(() -> drive(run));
        } catch (RejectedExecutionException e) {
            runs.remove(run.id);
            throw new MeshException(ErrorKind.CONFIGURATION, "Workflow coordinator is closed");
        }
        return run.id;
    }

    public Optional<WorkflowView> getStatus(String workflowId) {
        Run run = workflowId == null ? null : runs.get(workflowId);
        return run == null ? Optional.empty() : Optional.of(run.view());
    }

    /**
     * Completes with the terminal snapshot of the workflow. Failed workflows complete normally
     * with status {@link WorkflowStatus#FAILED}.
     */
    public CompletableFuture<WorkflowView> completion(String workflowId) {
        Run run = workflowId == null ? null : runs.get(workflowId);
        if (run == null) {
            return CompletableFuture.failedFuture(new MeshException(
                    ErrorKind.VALIDATION,
                    "Unknown workflow: " + workflowId,
                    Map.of("workflow", String.valueOf(workflowId))
            ));
        }
        return run.done.copy();
    }

    public List<WorkflowView> listWorkflows() {
        List<WorkflowView> views = new ArrayList<>();
        for (Run run : runs.values()) {
            views.add(run.view());
        }
        views.sort((a, b) -> a.createdAt().compareTo(b.createdAt()));
        return views;
    }

    public int activeWorkflowCount() {
        int active = 0;
        for (Run run : runs.values()) {
            if (!run.status().terminal()) {
                active++;
            }
        }
        return active;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private void drive(Run run) {
        run.start();
        log.info("Workflow {} ({}) started with {} steps", run.id, run.name, run.steps.size());
        bus.emitSync(MeshEvents.WORKFLOW_STARTED, run.view(), EmitOptions.fromSource(SENDER_ID));
        try {
            while (run.hasPendingSteps()) {
                List<StepState> wave = run.readySteps();
                if (wave.isEmpty()) {
                    throw new MeshException(
                            ErrorKind.CONFIGURATION,
                            "Workflow " + run.id + " has pending steps but none are ready",
                            Map.of("workflow", run.id)
                    );
                }
                List<CompletableFuture<Void>> settled = new ArrayList<>(wave.size());
                for (StepState step : wave) {
                    settled.add(dispatch(run, step));
                }
                CompletableFuture.allOf(settled.toArray(new CompletableFuture[0])).join();
                Optional<StepState> failed = run.firstFailed(wave);
                if (failed.isPresent()) {
                    finish(run, WorkflowStatus.FAILED,
                            "Step " + failed.get().definition.id() + " failed: " + failed.get().error);
                    return;
                }
            }
            finish(run, WorkflowStatus.COMPLETED, null);
        } catch (MeshException e) {
            finish(run, WorkflowStatus.FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Workflow {} aborted", run.id, e);
            finish(run, WorkflowStatus.FAILED, MeshException.from(e).getMessage());
        }
    }

    private CompletableFuture<Void> dispatch(Run run, StepState step) {
        StepDefinition def = step.definition;
        CompletableFuture<JsonNode> result;
        String agentId = null;
        try {
            agentId = resolveAgent(def);
            run.markRunning(step, agentId, clock.instant());
            long timeoutMs = def.timeoutMs() > 0L ? def.timeoutMs() : settings.defaultStepTimeoutMs();
            SendOptions options = SendOptions.defaults()
                    .priority(Priority.HIGH)
                    .timeoutMs(timeoutMs)
                    .retryAttempts(def.retryCount());
            result = router.sendMessageAsync(SENDER_ID, agentId, def.operation(), def.input(), options);
        } catch (MeshException e) {
            run.markRunning(step, agentId, clock.instant());
            result = CompletableFuture.failedFuture(e);
        }
        return result.handle((value, error) -> {
            if (error == null) {
                run.settle(step, StepStatus.COMPLETED, value, null, clock.instant());
                log.debug("Workflow {} step {} completed", run.id, def.id());
                bus.emitSync(MeshEvents.WORKFLOW_STEP_COMPLETED, stepEvent(run, step), EmitOptions.fromSource(SENDER_ID));
            } else {
                MeshException failure = MeshException.from(error);
                run.settle(step, StepStatus.FAILED, null, failure, clock.instant());
                log.warn("Workflow {} step {} failed: {}", run.id, def.id(), failure.getMessage());
                bus.emitSync(MeshEvents.WORKFLOW_STEP_FAILED, stepEvent(run, step), EmitOptions.fromSource(SENDER_ID));
            }
            return null;
        });
    }

    private String resolveAgent(StepDefinition def) {
        if (def.hasFixedAgent()) {
            return def.agentId();
        }
        return router.findOptimalAgent(def.requiredCapabilities()).orElseThrow(() -> new MeshException(
                ErrorKind.AGENT_UNAVAILABLE,
                "No available agent with capabilities " + def.requiredCapabilities(),
                Map.of("step", def.id(), "capabilities", List.copyOf(def.requiredCapabilities()))
        ));
    }

    private void finish(Run run, WorkflowStatus status, String error) {
        run.finish(status, error, clock.instant());
        WorkflowView view = run.view();
        audit.log(AuditLogger.AuditEvent.of(
                "workflow.finish",
                SENDER_ID,
                run.id,
                status.name().toLowerCase(),
                error == null ? Map.of("duration_ms", view.durationMs()) : Map.of("duration_ms", view.durationMs(), "error", error)
        ));
        if (status == WorkflowStatus.COMPLETED) {
            log.info("Workflow {} completed in {}ms", run.id, view.durationMs());
            bus.emitSync(MeshEvents.WORKFLOW_COMPLETED, view, EmitOptions.fromSource(SENDER_ID));
        } else {
            log.warn("Workflow {} failed after {}ms: {}", run.id, view.durationMs(), error);
            bus.emitSync(MeshEvents.WORKFLOW_FAILED, view, EmitOptions.fromSource(SENDER_ID));
        }
        run.done.complete(view);
    }

    private static Map<String, Object> stepEvent(Run run, StepState step) {
        StepView view = run.stepView(step);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflowId", run.id);
        payload.put("stepId", view.id());
        payload.put("agentId", view.agentId());
        payload.put("status", view.status().name());
        if (view.error() != null) {
            payload.put("error", view.error());
        }
        return payload;
    }

    private void admit(WorkflowDefinition definition) {
        try {
            rateLimiter.admit(SENDER_ID, RateLimiter.LimitClass.GLOBAL, definition.steps().size());
        } catch (MeshException e) {
            audit.log(AuditLogger.AuditEvent.of(
                    "workflow.submit",
                    SENDER_ID,
                    definition.name(),
                    "rate_limited",
                    Map.of("steps", definition.steps().size(), "reason", e.getMessage())
            ));
            log.warn("Workflow {} rejected at admission: {}", definition.name(), e.getMessage());
            throw e;
        }
    }

    private void validate(WorkflowDefinition definition) {
        if (definition == null || definition.steps().isEmpty()) {
            throw MeshException.validation("Workflow must contain at least one step");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (StepDefinition step : definition.steps()) {
            if (step.id() == null || step.id().isBlank()) {
                throw MeshException.validation("Workflow step id cannot be empty");
            }
            if (!ids.add(step.id())) {
                throw MeshException.validation("Duplicate workflow step id: " + step.id(), Map.of("step", step.id()));
            }
            if (step.operation() == null || step.operation().isBlank()) {
                throw MeshException.validation("Workflow step " + step.id() + " has no operation", Map.of("step", step.id()));
            }
            if (step.hasFixedAgent()) {
                if (router.getAgentStatus(step.agentId()).isEmpty()) {
                    throw MeshException.validation(
                            "Workflow step " + step.id() + " targets unknown agent " + step.agentId(),
                            Map.of("step", step.id(), "agent", step.agentId())
                    );
                }
            } else if (step.requiredCapabilities().isEmpty()) {
                throw MeshException.validation(
                        "Workflow step " + step.id() + " needs an agentId or requiredCapabilities",
                        Map.of("step", step.id())
                );
            }
        }
        Map<String, List<String>> graph = new HashMap<>();
        for (StepDefinition step : definition.steps()) {
            for (String dep : step.dependencies()) {
                if (!ids.contains(dep)) {
                    throw MeshException.validation(
                            "Unknown dependency " + dep + " in step " + step.id(),
                            Map.of("step", step.id(), "dependency", String.valueOf(dep))
                    );
                }
            }
            graph.put(step.id(), step.dependencies());
        }
        Set<String> visiting = new HashSet<>();
        Set<String> visited = new HashSet<>();
        for (String id : ids) {
            dfsCycleCheck(id, graph, visiting, visited);
        }
    }

    private static void dfsCycleCheck(String id, Map<String, List<String>> graph, Set<String> visiting, Set<String> visited) {
        if (visited.contains(id)) return;
        if (!visiting.add(id)) {
            throw MeshException.validation("Workflow contains cycle at step: " + id, Map.of("step", id));
        }
        for (String dep : graph.getOrDefault(id, List.of())) {
            dfsCycleCheck(dep, graph, visiting, visited);
        }
        visiting.remove(id);
        visited.add(id);
    }

    private static final class StepState {
        private final StepDefinition definition;
        private StepStatus status = StepStatus.PENDING;
        private String agentId;
        private JsonNode result;
        private String error;
        private String errorKind;
        private Instant startedAt;
        private Instant completedAt;

        private StepState(StepDefinition definition) {
            this.definition = definition;
            this.agentId = definition.hasFixedAgent() ? definition.agentId() : null;
        }
    }

    private static final class Run {
        private final String id;
        private final String name;
        private final Instant createdAt;
        private final Map<String, StepState> steps = new LinkedHashMap<>();
        private final CompletableFuture<WorkflowView> done = new CompletableFuture<>();
        private WorkflowStatus status = WorkflowStatus.PENDING;
        private Instant completedAt;
        private String error;

        private Run(String id, WorkflowDefinition definition, Instant createdAt) {
            this.id = id;
            this.name = definition.name();
            this.createdAt = createdAt;
            for (StepDefinition step : definition.steps()) {
                steps.put(step.id(), new StepState(step));
            }
        }

        private synchronized WorkflowStatus status() {
            return status;
        }

        private synchronized void start() {
            status = WorkflowStatus.RUNNING;
        }

        private synchronized boolean hasPendingSteps() {
            return steps.values().stream().anyMatch(s -> s.status == StepStatus.PENDING);
        }

        private synchronized List<StepState> readySteps() {
            List<StepState> ready = new ArrayList<>();
            for (StepState step : steps.values()) {
                if (step.status != StepStatus.PENDING) {
                    continue;
                }
                boolean depsDone = step.definition.dependencies().stream()
                        .allMatch(dep -> steps.get(dep).status == StepStatus.COMPLETED);
                if (depsDone) {
                    ready.add(step);
                }
            }
            return ready;
        }

        private synchronized void markRunning(StepState step, String agentId, Instant now) {
            step.status = StepStatus.RUNNING;
            step.agentId = agentId;
            step.startedAt = now;
        }

        private synchronized void settle(StepState step, StepStatus outcome, JsonNode result, MeshException failure, Instant now) {
            step.status = outcome;
            step.result = result;
            step.error = failure == null ? null : failure.getMessage();
            step.errorKind = failure == null ? null : failure.kind().name();
            step.completedAt = now;
        }

        private synchronized Optional<StepState> firstFailed(List<StepState> wave) {
            return wave.stream().filter(s -> s.status == StepStatus.FAILED).findFirst();
        }

        private synchronized void finish(WorkflowStatus terminal, String failure, Instant now) {
            status = terminal;
            error = failure;
            completedAt = now;
        }

        private synchronized StepView stepView(StepState step) {
            return new StepView(
                    step.definition.id(),
                    step.agentId,
                    step.definition.operation(),
                    step.definition.dependencies(),
                    step.status,
                    step.result,
                    step.error,
                    step.errorKind,
                    step.startedAt,
                    step.completedAt
            );
        }

        private synchronized WorkflowView view() {
            List<StepView> stepViews = new ArrayList<>(steps.size());
            for (StepState step : steps.values()) {
                stepViews.add(stepView(step));
            }
            Long durationMs = completedAt == null ? null : completedAt.toEpochMilli() - createdAt.toEpochMilli();
            return new WorkflowView(id, name, status, List.copyOf(stepViews), createdAt, completedAt, durationMs, error);
        }
    }
}
