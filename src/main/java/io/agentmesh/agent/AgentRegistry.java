package io.agentmesh.agent;

import io.agentmesh.error.ErrorKind;
import io.agentmesh.error.MeshException;
import io.agentmesh.model.AgentStatus;
import io.agentmesh.util.Ids;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Registered agents with their live status, load and heartbeat.
 *
 * <p>Mutations of a single agent are serialized on its entry; the load score never drops
 * below zero.
 */
public final class AgentRegistry {
    private final Map<String, Entry> agents = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0L);

    public AgentView register(AgentDescriptor descriptor, Instant now) {
        AgentDescriptor normalized = validate(descriptor);
        Entry entry = new Entry(normalized, sequence.incrementAndGet(), now);
        if (agents.putIfAbsent(normalized.id(), entry) != null) {
            throw MeshException.validation(
                    "Agent already registered: " + normalized.id(),
                    Map.of("agent", normalized.id())
            );
        }
        return entry.view();
    }

    public Optional<AgentView> unregister(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        Entry removed = agents.remove(agentId);
        return removed == null ? Optional.empty() : Optional.of(removed.view());
    }

    public Optional<AgentView> find(String agentId) {
        Entry entry = agentId == null ? null : agents.get(agentId);
        return entry == null ? Optional.empty() : Optional.of(entry.view());
    }

    public Optional<AgentDescriptor> descriptor(String agentId) {
        Entry entry = agentId == null ? null : agents.get(agentId);
        return entry == null ? Optional.empty() : Optional.of(entry.descriptor);
    }

    public boolean contains(String agentId) {
        return agentId != null && agents.containsKey(agentId);
    }

    public int size() {
        return agents.size();
    }

    /**
     * Snapshots in registration order.
     */
    public List<AgentView> list() {
        return ordered().stream().map(Entry::view).toList();
    }

    /**
     * Routable agent carrying every required capability with the lowest load; ties go to the
     * agent registered first.
     */
    public Optional<String> findOptimal(Set<String> requiredCapabilities, Set<String> exclude) {
        Entry best = null;
        int bestLoad = Integer.MAX_VALUE;
        for (Entry entry : ordered()) {
            if (exclude != null && exclude.contains(entry.descriptor.id())) {
                continue;
            }
            if (!entry.descriptor.hasCapabilities(requiredCapabilities)) {
                continue;
            }
            AgentView view = entry.view();
            if (view.status() != AgentStatus.ACTIVE) {
                continue;
            }
            if (view.loadScore() < bestLoad) {
                best = entry;
                bestLoad = view.loadScore();
            }
        }
        return best == null ? Optional.empty() : Optional.of(best.descriptor.id());
    }

    /**
     * Marks the agent busy with one more in-flight message.
     */
    public AgentView acquireLoad(String agentId) {
        Entry entry = require(agentId);
        synchronized (entry) {
            entry.load++;
            if (entry.status == AgentStatus.ACTIVE) {
                entry.status = AgentStatus.BUSY;
            }
            return entry.view();
        }
    }

    /**
     * Releases one unit of load and refreshes the heartbeat. A busy agent with no remaining
     * load returns to active. Missing agents are ignored since they may have unregistered
     * while the message was in flight.
     */
    public Optional<AgentView> releaseLoad(String agentId, Instant now) {
        Entry entry = agentId == null ? null : agents.get(agentId);
        if (entry == null) {
            return Optional.empty();
        }
        synchronized (entry) {
            entry.load = Math.max(0, entry.load - 1);
            if (entry.status == AgentStatus.BUSY && entry.load == 0) {
                entry.status = AgentStatus.ACTIVE;
            }
            entry.lastHeartbeat = now;
            return Optional.of(entry.view());
        }
    }

    public AgentView updateStatus(String agentId, AgentStatus status, Integer load, Instant now) {
        if (status == null) {
            throw MeshException.validation("Agent status is required");
        }
        if (load != null && load < 0) {
            throw MeshException.validation("Agent load cannot be negative", Map.of("load", load));
        }
        Entry entry = require(agentId);
        synchronized (entry) {
            entry.status = status;
            if (load != null) {
                entry.load = load;
            }
            entry.lastHeartbeat = now;
            return entry.view();
        }
    }

    /**
     * Refreshes the heartbeat and returns the status held before it. Inactive and errored
     * agents come back as active.
     */
    public AgentStatus heartbeat(String agentId, Instant now) {
        Entry entry = require(agentId);
        synchronized (entry) {
            AgentStatus previous = entry.status;
            entry.lastHeartbeat = now;
            if (!previous.routable()) {
                entry.status = entry.load > 0 ? AgentStatus.BUSY : AgentStatus.ACTIVE;
            }
            return previous;
        }
    }

    /**
     * Flags every routable agent whose heartbeat is older than {@code cutoff} as inactive and
     * returns the agents that changed.
     */
    public List<AgentView> markStale(Instant cutoff) {
        List<AgentView> changed = new ArrayList<>();
        for (Entry entry : ordered()) {
            synchronized (entry) {
                if (entry.status.routable() && entry.lastHeartbeat.isBefore(cutoff)) {
                    entry.status = AgentStatus.INACTIVE;
                    changed.add(entry.view());
                }
            }
        }
        return changed;
    }

    private Entry require(String agentId) {
        Entry entry = agentId == null ? null : agents.get(agentId);
        if (entry == null) {
            throw MeshException.agentNotFound(agentId);
        }
        return entry;
    }

    private List<Entry> ordered() {
        List<Entry> entries = new ArrayList<>(agents.values());
        entries.sort(Comparator.comparingLong(e -> e.sequence));
        return entries;
    }

    private static AgentDescriptor validate(AgentDescriptor descriptor) {
        if (descriptor == null) {
            throw MeshException.validation("Agent descriptor is required");
        }
        if (descriptor.name() == null || descriptor.name().isBlank()) {
            throw MeshException.validation("Agent name is required");
        }
        if (descriptor.capabilities().isEmpty()
                || descriptor.capabilities().stream().anyMatch(c -> c == null || c.isBlank())) {
            throw new MeshException(
                    ErrorKind.VALIDATION,
                    "Agent " + descriptor.name() + " must declare at least one non-blank capability"
            );
        }
        if (descriptor.methods().isEmpty()) {
            throw MeshException.validation("Agent " + descriptor.name() + " must declare at least one method");
        }
        for (String method : descriptor.methods().keySet()) {
            if (method == null || method.isBlank()) {
                throw MeshException.validation("Agent " + descriptor.name() + " declares a blank method name");
            }
        }
        if (descriptor.id() == null || descriptor.id().isBlank()) {
            return descriptor.withId(slug(descriptor.name()) + "_" + Ids.shortId());
        }
        return descriptor.withId(descriptor.id().trim());
    }

    private static String slug(String name) {
        String normalized = name.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9') || ch == '-';
            sb.append(ok ? ch : '-');
        }
        return sb.toString();
    }

    private static final class Entry {
        private final AgentDescriptor descriptor;
        private final long sequence;
        private final Instant registeredAt;
        private AgentStatus status;
        private int load;
        private Instant lastHeartbeat;

        private Entry(AgentDescriptor descriptor, long sequence, Instant now) {
            this.descriptor = descriptor;
            this.sequence = sequence;
            this.registeredAt = now;
            this.status = AgentStatus.ACTIVE;
            this.load = 0;
            this.lastHeartbeat = now;
        }

        private synchronized AgentView view() {
            return new AgentView(
                    descriptor.id(),
                    descriptor.name(),
                    descriptor.capabilities(),
                    descriptor.methods().keySet(),
                    status,
                    load,
                    lastHeartbeat,
                    registeredAt
            );
        }
    }
}
