/**
 * Mesh wiring package.
 *
 * <p>{@link io.agentmesh.runtime.AgentMesh} owns the lifecycle of one mesh: it builds the bus,
 * rate limiter, router and workflow coordinator from shared settings and exposes the health
 * snapshot and metrics text used by the CLI.
 */
package io.agentmesh.runtime;
