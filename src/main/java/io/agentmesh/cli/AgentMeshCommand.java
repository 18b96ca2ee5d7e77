package io.agentmesh.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.agent.EchoAgent;
import io.agentmesh.agent.FailAgent;
import io.agentmesh.config.MeshConfig;
import io.agentmesh.model.Priority;
import io.agentmesh.model.WorkflowStatus;
import io.agentmesh.routing.SendOptions;
import io.agentmesh.runtime.AgentMesh;
import io.agentmesh.util.Jsons;
import io.agentmesh.workflow.StepDefinition;
import io.agentmesh.workflow.WorkflowDefinition;
import io.agentmesh.workflow.WorkflowView;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

@Command(
        name = "agentmesh",
        mixinStandardHelpOptions = true,
        description = "In-process agent orchestration mesh",
        subcommands = {
                AgentMeshCommand.RunWorkflowCommand.class,
                AgentMeshCommand.SendCommand.class,
                AgentMeshCommand.AgentsCommand.class,
                AgentMeshCommand.HealthCommand.class,
                AgentMeshCommand.MetricsCommand.class,
                AgentMeshCommand.SettingsCommand.class
        }
)
public final class AgentMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Directory holding " + MeshConfig.SETTINGS_FILE_NAME, defaultValue = ".")
    String root;

    @Option(names = {"--namespace"}, description = "Mesh namespace used in audit rows and metrics", defaultValue = "default")
    String namespace;

    @Override
    public void run() {
        System.out.println("Use subcommands: run-workflow | send | agents | health | metrics | settings");
    }

    /**
     * Mesh with the built-in echo and fail agents registered and the router started.
     */
    AgentMesh mesh() {
        AgentMesh mesh = new AgentMesh(MeshConfig.fromRoot(root, namespace));
        mesh.router().register(EchoAgent.descriptor());
        mesh.router().register(FailAgent.descriptor());
        return mesh.start();
    }

    @Command(name = "run-workflow", description = "Run a workflow JSON file against the built-in agents")
    static final class RunWorkflowCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Option(names = {"--file"}, required = true, description = "Workflow JSON file path")
        String file;

        @Option(names = {"--wait-ms"}, defaultValue = "60000", description = "Max time to wait for the workflow")
        long waitMs;

        @Override
        public Integer call() throws Exception {
            WorkflowFile wf = Jsons.mapper().readValue(Path.of(file).toFile(), WorkflowFile.class);
            try (AgentMesh mesh = parent.mesh()) {
                String workflowId = mesh.coordinator().submit(wf.toDefinition());
                WorkflowView view = mesh.coordinator().completion(workflowId).get(waitMs, TimeUnit.MILLISECONDS);
                System.out.println(Jsons.toJson(view));
                return view.status() == WorkflowStatus.COMPLETED ? 0 : 1;
            }
        }
    }

    @Command(name = "send", description = "Send one message to a built-in agent and print the result")
    static final class SendCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Option(names = {"--agent"}, defaultValue = EchoAgent.ID, description = "Target agent id")
        String agent;

        @Option(names = {"--method"}, defaultValue = "echo", description = "Method to call")
        String method;

        @Option(names = {"--args"}, defaultValue = "{}", description = "JSON arguments")
        String args;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "Priority: urgent|high|normal|low")
        String priority;

        @Override
        public Integer call() {
            try (AgentMesh mesh = parent.mesh()) {
                JsonNode result = mesh.router().sendMessage(
                        "cli",
                        agent,
                        method,
                        Jsons.readTree(args),
                        SendOptions.defaults().priority(Priority.fromString(priority))
                );
                System.out.println(Jsons.toJson(result));
                return 0;
            }
        }
    }

    @Command(name = "agents", description = "List the built-in agents")
    static final class AgentsCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() {
            try (AgentMesh mesh = parent.mesh()) {
                System.out.println(Jsons.toJson(mesh.router().listAgents()));
                return 0;
            }
        }
    }

    @Command(name = "health", description = "Print a health snapshot")
    static final class HealthCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() {
            try (AgentMesh mesh = parent.mesh()) {
                System.out.println(Jsons.toJson(mesh.health()));
                return 0;
            }
        }
    }

    @Command(name = "metrics", description = "Print metrics in Prometheus text format")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() {
            try (AgentMesh mesh = parent.mesh()) {
                System.out.print(mesh.metricsText());
                return 0;
            }
        }
    }

    @Command(name = "settings", description = "Print effective settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        AgentMeshCommand parent;

        @Override
        public Integer call() {
            MeshConfig config = MeshConfig.fromRoot(parent.root, parent.namespace);
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("namespace", config.namespace());
            out.put("settingsFile", String.valueOf(config.settingsFile()));
            out.put("settings", config.loadSettings());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WorkflowFile(String name, List<WorkflowStepFile> steps) {
        WorkflowDefinition toDefinition() {
            List<StepDefinition> defs = steps == null ? List.of() : steps.stream()
                    .map(WorkflowStepFile::toDefinition)
                    .toList();
            return new WorkflowDefinition(name, defs);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record WorkflowStepFile(
            String id,
            String agent,
            Set<String> capabilities,
            String operation,
            JsonNode input,
            List<String> dependsOn,
            Long timeoutMs,
            Integer retries
    ) {
        StepDefinition toDefinition() {
            return new StepDefinition(
                    id,
                    agent,
                    capabilities,
                    operation,
                    input,
                    dependsOn,
                    timeoutMs == null ? 0L : timeoutMs,
                    retries == null ? 0 : retries
            );
        }
    }
}
