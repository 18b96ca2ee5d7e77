/**
 * AgentMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.agentmesh.runtime.AgentMesh} wires one mesh from a set of settings.</li>
 *   <li>{@code io.agentmesh.routing.AgentRouter} registers agents and dispatches routed messages.</li>
 *   <li>{@code io.agentmesh.workflow.WorkflowCoordinator} runs dependency-ordered workflows.</li>
 *   <li>{@code io.agentmesh.bus.EventBus} carries lifecycle events between components.</li>
 * </ul>
 */
package io.agentmesh;
