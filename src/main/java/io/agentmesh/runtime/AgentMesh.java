package io.agentmesh.runtime;

import io.agentmesh.bus.EventBus;
import io.agentmesh.config.MeshConfig;
import io.agentmesh.config.MeshSettings;
import io.agentmesh.observability.AuditLogger;
import io.agentmesh.observability.PrometheusFormatter;
import io.agentmesh.resilience.RateLimiter;
import io.agentmesh.resilience.Retry;
import io.agentmesh.routing.AgentRouter;
import io.agentmesh.routing.RouterMetrics;
import io.agentmesh.workflow.WorkflowCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * One orchestration context: event bus, rate limiter, router, workflow coordinator and audit
 * trail wired from a single set of settings. Independent meshes share nothing.
 */
public final class AgentMesh implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AgentMesh.class);

    private final MeshConfig config;
    private final MeshSettings settings;
    private final Clock clock;
    private final EventBus bus;
    private final RateLimiter rateLimiter;
    private final AuditLogger audit;
    private final AgentRouter router;
    private final WorkflowCoordinator coordinator;

    public AgentMesh(MeshConfig config) {
        this(config, config.loadSettings(), Clock.systemUTC(), new Retry());
    }

    public AgentMesh(MeshConfig config, MeshSettings settings) {
        this(config, settings, Clock.systemUTC(), new Retry());
    }

    public AgentMesh(MeshConfig config, MeshSettings settings, Clock clock, Retry retry) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.bus = new EventBus(settings.eventHistoryMax(), clock);
        this.rateLimiter = new RateLimiter(settings, clock);
        this.audit = new AuditLogger(config.namespace(), clock);
        this.router = new AgentRouter(settings, bus, rateLimiter, audit, clock, retry);
        this.coordinator = new WorkflowCoordinator(router, bus, rateLimiter, audit, settings, clock);
    }

    public static AgentMesh withDefaults() {
        return new AgentMesh(MeshConfig.defaults(), MeshSettings.defaults());
    }

    public AgentMesh start() {
        router.start();
        log.info("Agent mesh {} started", config.namespace());
        return this;
    }

    public MeshConfig config() {
        return config;
    }

    public MeshSettings settings() {
        return settings;
    }

    public EventBus bus() {
        return bus;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    public AuditLogger audit() {
        return audit;
    }

    public AgentRouter router() {
        return router;
    }

    public WorkflowCoordinator coordinator() {
        return coordinator;
    }

    public HealthSnapshot health() {
        RouterMetrics metrics = router.metrics();
        return new HealthSnapshot(
                clock.instant(),
                new HealthSnapshot.Agents(
                        metrics.totalAgents(),
                        metrics.activeAgents(),
                        metrics.busyAgents(),
                        metrics.inactiveAgents() + metrics.errorAgents()
                ),
                metrics.queueDepth() + bus.pendingScheduled(),
                coordinator.activeWorkflowCount(),
                metrics.averageLoad()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(
                router.metrics(),
                bus.metrics(),
                health(),
                rateLimiter.stats(),
                config.namespace()
        );
    }

    @Override
    public void close() {
        coordinator.close();
        router.close();
        bus.clear();
        bus.close();
        log.info("Agent mesh {} closed", config.namespace());
    }
}
