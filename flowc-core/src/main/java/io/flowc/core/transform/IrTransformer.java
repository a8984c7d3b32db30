package io.flowc.core.transform;

import io.flowc.core.FlowcConfig;
import io.flowc.core.exception.CompilationException;
import io.flowc.core.exception.ContextVariableConflictException;
import io.flowc.core.exception.ContextVariableConflictException.Conflict;
import io.flowc.core.graph.EdgeSemantics;
import io.flowc.core.graph.GraphNode;
import io.flowc.core.graph.NodeKind;
import io.flowc.core.graph.NodePayload;
import io.flowc.core.graph.TeleporterPair;
import io.flowc.core.graph.WorkflowGraph;
import io.flowc.core.hierarchy.Hierarchy;
import io.flowc.core.hierarchy.HierarchyNode;
import io.flowc.core.ir.AgentIR;
import io.flowc.core.ir.AgentKind;
import io.flowc.core.ir.TeleporterIR;
import io.flowc.core.ir.UserInputIR;
import io.flowc.core.ir.WorkflowIR;
import io.flowc.core.ir.WorkflowMetadata;
import io.flowc.core.project.ProjectSnapshot;
import io.flowc.core.project.RegionFlow;
import io.flowc.core.registry.CapabilityRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Maps a hierarchy onto the immutable {@link WorkflowIR}.
///
/// Leaves become `LLM` agents whose configuration is gathered by {@link Resolvers}; sequences,
/// parallel groups and loops become composites with deterministic ids:
///
/// ```
/// construct   id                     name
/// —————————   ————————————————————   ——————————————————
/// leaf        agent node id          agent name
/// sequence    seq_<first anchor>     id
/// parallel    par_<fork or region>   id
/// loop        loop_<marker id>       marker name
/// ```
///
/// Context-variable conflicts are collected over the whole workflow and raised together once
/// every agent has been built.
///
/// @implNote Stateless and thread-safe; per-call state lives in a {@link Run}.
public final class IrTransformer {

    private static final Logger logger = Logger.getLogger(IrTransformer.class.getName());

    static final String SEQUENCE_PREFIX = "seq_";
    static final String PARALLEL_PREFIX = "par_";
    static final String LOOP_PREFIX = "loop_";

    private final FlowcConfig config;
    private final CapabilityRegistry registry;

    /// @param config defaults for model, temperature and loop iterations, not null
    /// @param registry capability lookup used to describe registry schemas, not null
    public IrTransformer(FlowcConfig config, CapabilityRegistry registry) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Builds the workflow IR.
    ///
    /// @param project source snapshot, not null
    /// @param graph frozen graph, not null
    /// @param hierarchy hierarchy of `graph`, not null
    /// @param callerVariables global values supplied by the caller, not null
    /// @return new workflow, never null
    /// @throws io.flowc.core.exception.PromptLoadException if a prompt source is missing
    /// @throws io.flowc.core.exception.ToolLoadException if a tool source cannot be resolved
    /// @throws ContextVariableConflictException if sources disagree on a context variable
    /// @throws CompilationException for any other unresolvable configuration
    public WorkflowIR transform(
            ProjectSnapshot project,
            WorkflowGraph graph,
            Hierarchy hierarchy,
            Map<String, String> callerVariables)
            throws CompilationException {
        Objects.requireNonNull(callerVariables, "callerVariables must not be null");
        Run run = new Run(graph, new Resolvers(graph, project, registry));

        Map<String, AgentIR> roots = new LinkedHashMap<>();
        for (Map.Entry<String, HierarchyNode> entry : hierarchy.roots().entrySet()) {
            roots.put(entry.getKey(), run.agent(entry.getValue()));
        }
        if (!run.conflicts.isEmpty()) {
            throw new ContextVariableConflictException(run.conflicts);
        }

        Map<String, AgentIR> allAgents = new LinkedHashMap<>();
        roots.values().forEach(root -> root.flatten().forEach(a -> allAgents.put(a.getId(), a)));

        WorkflowIR workflow =
                WorkflowIR.builder()
                        .roots(roots)
                        .allAgents(allAgents)
                        .globalVariables(globalVariables(graph, callerVariables))
                        .metadata(new WorkflowMetadata(project.getName(), project.getVersion()))
                        .projectPath(
                                project.getPath() != null ? project.getPath().toString() : null)
                        .tabIds(project.getRegions().stream().map(RegionFlow::id).toList())
                        .hasStartNode(
                                graph.entryNodes().stream()
                                        .anyMatch(n -> n.kind() == NodeKind.START))
                        .hasEndNode(endReachable(graph))
                        .teleporters(teleporters(graph))
                        .userInputs(userInputs(graph))
                        .build();

        logger.info(
                "Transformed project '"
                        + project.getName()
                        + "': "
                        + roots.size()
                        + " roots, "
                        + allAgents.size()
                        + " agents, "
                        + workflow.getGlobalVariables().size()
                        + " global variables");
        return workflow;
    }

    /// Unconnected variable nodes in parse order, overridden by the caller's values.
    static Map<String, String> globalVariables(
            WorkflowGraph graph, Map<String, String> callerVariables) {
        Map<String, String> globals = new LinkedHashMap<>();
        for (GraphNode node : graph.nodesOfKind(NodeKind.VARIABLE)) {
            if (node.outgoing().isEmpty()) {
                NodePayload.Variable variable = (NodePayload.Variable) node.payload();
                globals.put(variable.name(), variable.value());
            }
        }
        globals.putAll(callerVariables);
        return globals;
    }

    private static boolean endReachable(WorkflowGraph graph) {
        Set<String> seen = new HashSet<>();
        Deque<GraphNode> queue = new ArrayDeque<>(graph.entryNodes());
        graph.entryNodes().forEach(n -> seen.add(n.id()));
        while (!queue.isEmpty()) {
            GraphNode node = queue.poll();
            if (node.kind() == NodeKind.END) {
                return true;
            }
            for (GraphNode next : graph.controlSuccessors(node.id())) {
                if (seen.add(next.id())) {
                    queue.add(next);
                }
            }
        }
        return false;
    }

    private static List<TeleporterIR> teleporters(WorkflowGraph graph) {
        List<TeleporterIR> result = new ArrayList<>();
        for (TeleporterPair pair : graph.teleporterPairs()) {
            result.add(
                    new TeleporterIR(
                            pair.channel(),
                            pair.outNodeId(),
                            pair.inNodeId(),
                            graph.get(pair.outNodeId()).regionId(),
                            graph.get(pair.inNodeId()).regionId()));
        }
        return result;
    }

    private static List<UserInputIR> userInputs(WorkflowGraph graph) {
        List<UserInputIR> result = new ArrayList<>();
        for (GraphNode node : graph.nodesOfKind(NodeKind.USER_INPUT)) {
            NodePayload.UserInput input = (NodePayload.UserInput) node.payload();
            result.add(new UserInputIR(node.id(), input.name(), input.trigger(), node.regionId()));
        }
        return result;
    }

    /// State of one transform call.
    private final class Run {

        private final WorkflowGraph graph;
        private final Resolvers resolvers;
        private final List<Conflict> conflicts = new ArrayList<>();

        Run(WorkflowGraph graph, Resolvers resolvers) {
            this.graph = graph;
            this.resolvers = resolvers;
        }

        AgentIR agent(HierarchyNode node) throws CompilationException {
            if (node instanceof HierarchyNode.Leaf leaf) {
                return leaf(leaf);
            }
            if (node instanceof HierarchyNode.Sequence sequence) {
                return composite(
                                SEQUENCE_PREFIX + sequence.anchorId(),
                                AgentKind.SEQUENTIAL,
                                sequence.children(),
                                sequence.anchorId())
                        .condition(sequence.condition())
                        .build();
            }
            if (node instanceof HierarchyNode.Parallel parallel) {
                return composite(
                                PARALLEL_PREFIX + parallel.anchorId(),
                                AgentKind.PARALLEL,
                                parallel.branches(),
                                graph.find(parallel.anchorId()).isPresent()
                                        ? parallel.anchorId()
                                        : null)
                        .condition(parallel.condition())
                        .build();
            }
            HierarchyNode.Loop loop = (HierarchyNode.Loop) node;
            GraphNode marker = graph.get(loop.markerId());
            NodePayload.Loop payload = (NodePayload.Loop) marker.payload();
            return composite(
                            LOOP_PREFIX + loop.markerId(),
                            AgentKind.LOOP,
                            loop.body(),
                            loop.markerId())
                    .name(marker.displayName())
                    .maxIterations(
                            payload.maxIterations() != null
                                    ? payload.maxIterations()
                                    : config.getDefaultMaxIterations())
                    .condition(loop.condition())
                    .build();
        }

        private AgentIR.Builder composite(
                String id, AgentKind kind, List<HierarchyNode> children, String sourceNodeId)
                throws CompilationException {
            List<AgentIR> subagents = new ArrayList<>();
            for (HierarchyNode child : children) {
                subagents.add(agent(child));
            }
            return AgentIR.builder()
                    .id(id)
                    .kind(kind)
                    .subagents(subagents)
                    .sourceNodeId(sourceNodeId);
        }

        private AgentIR leaf(HierarchyNode.Leaf leaf) throws CompilationException {
            GraphNode node = graph.get(leaf.nodeId());
            NodePayload.Agent payload = (NodePayload.Agent) node.payload();
            long dataInputs =
                    node.incoming().stream()
                            .filter(e -> e.semantics() == EdgeSemantics.DATA)
                            .count();
            logger.fine(
                    () ->
                            "Resolving agent '"
                                    + node.id()
                                    + "' with "
                                    + dataInputs
                                    + " connected sources");

            return AgentIR.builder()
                    .id(node.id())
                    .name(payload.name())
                    .kind(AgentKind.LLM)
                    .instruction(resolvers.resolveInstruction(node))
                    .tools(resolvers.resolveTools(node))
                    .callbacks(resolvers.resolveCallbacks(node))
                    .inputSchema(resolvers.resolveInputSchema(node))
                    .outputSchema(resolvers.resolveOutputSchema(node))
                    .contextVariables(resolvers.resolveContextVariables(node, conflicts))
                    .model(payload.model() != null ? payload.model() : config.getDefaultModel())
                    .temperature(
                            payload.temperature() != null
                                    ? payload.temperature()
                                    : config.getDefaultTemperature())
                    .outputKey(payload.outputKey())
                    .description(payload.description())
                    .settings(payload.settings())
                    .sourceNodeId(node.id())
                    .condition(leaf.condition())
                    .build();
        }
    }
}
