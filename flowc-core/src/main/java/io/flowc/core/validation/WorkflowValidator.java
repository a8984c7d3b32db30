package io.flowc.core.validation;

import io.flowc.core.FlowcConfig;
import io.flowc.core.exception.ErrorLocation;
import io.flowc.core.exception.WorkflowValidationException;
import io.flowc.core.graph.ConfigUnit;
import io.flowc.core.graph.EdgeSemantics;
import io.flowc.core.graph.GraphEdge;
import io.flowc.core.graph.GraphNode;
import io.flowc.core.graph.LoopBody;
import io.flowc.core.graph.NodeKind;
import io.flowc.core.graph.NodePayload;
import io.flowc.core.graph.ParsedNode;
import io.flowc.core.graph.WorkflowGraph;
import io.flowc.core.hierarchy.Hierarchy;
import io.flowc.core.hierarchy.StructuralIssue;
import io.flowc.core.ir.CallbackPhase;
import io.flowc.core.project.ProjectSnapshot;
import io.flowc.core.registry.CapabilityKind;
import io.flowc.core.registry.CapabilityRegistry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Checks a built graph and hierarchy before IR generation.
///
/// Every check runs to completion and adds to one {@link ValidationResult}, so a single pass
/// reports the whole problem set. Only then is the first error raised.
///
/// ### Errors
/// - `cycle` - a control cycle not contained in the body of one loop
/// - `ambiguous-merge`, `loop-body` - structural issues of the hierarchy
/// - `missing-reference` - tool, callback, schema, prompt or tool file that does not resolve
/// - `duplicate-name` - two agents with the same name
/// - `multiple-start` - more than one start node in a region
///
/// ### Warnings
/// - `unreachable-agent` - agent with no control path from any entry node
/// - `temperature-range` - agent temperature outside `[0, 2]`
/// - `empty-loop` - loop body without an agent
/// - `orphan-node` - configuration or teleporter node without any edge
/// - `missing-output-key` - agent feeding another agent without an `output_key`
///
/// @implNote Thread-safe: holds only the read-only registry and configuration.
public final class WorkflowValidator {

    private static final Logger logger = Logger.getLogger(WorkflowValidator.class.getName());

    private final CapabilityRegistry registry;
    private final FlowcConfig config;

    /// @param registry capability lookup for reference checks, not null
    /// @param config compiler options, not null
    public WorkflowValidator(CapabilityRegistry registry, FlowcConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Validates the graph and hierarchy.
    ///
    /// @param graph frozen graph, not null
    /// @param hierarchy hierarchy built from `graph`, not null
    /// @param project snapshot the graph was built from, not null
    /// @return result holding the warnings, never null
    /// @throws WorkflowValidationException if any error was found, carrying the full result
    public ValidationResult validate(
            WorkflowGraph graph, Hierarchy hierarchy, ProjectSnapshot project)
            throws WorkflowValidationException {
        ValidationResult result = new ValidationResult();

        checkCycles(graph, hierarchy, result);
        checkStructure(hierarchy, result);
        checkReferences(graph, project, result);
        checkDuplicateNames(graph, result);
        checkStartNodes(graph, result);
        checkReachability(graph, result);
        checkAgentSettings(graph, result);
        checkLoops(graph, result);
        checkOrphans(graph, result);

        if (config.isFailOnWarnings() && !result.warnings().isEmpty()) {
            result = result.promoteWarnings();
        }
        if (!result.isValid()) {
            List<ValidationIssue> errors = result.errors();
            logger.fine(() -> "Validation failed with " + errors.size() + " errors: " + errors);
            throw new WorkflowValidationException(result);
        }
        result.warnings().forEach(w -> logger.warning(w.toString()));
        return result;
    }

    // === Cycles ===

    private void checkCycles(WorkflowGraph graph, Hierarchy hierarchy, ValidationResult result) {
        for (Set<String> component : new Tarjan(graph).components()) {
            if (!isCycle(graph, component) || isLegalLoop(hierarchy, component)) {
                continue;
            }
            List<String> order = traversalOrder(graph, component);
            GraphNode first = graph.get(order.get(0));
            result.addError(
                    "cycle",
                    "Cycle outside of a loop body: "
                            + order.stream()
                                    .map(id -> graph.get(id).displayName())
                                    .collect(Collectors.joining(" -> "))
                            + " -> "
                            + first.displayName(),
                    ErrorLocation.node(first.regionId(), first.id()));
        }
    }

    private static boolean isCycle(WorkflowGraph graph, Set<String> component) {
        if (component.size() > 1) {
            return true;
        }
        String id = component.iterator().next();
        return graph.get(id).outgoing().stream()
                .anyMatch(e -> e.isControl() && e.targetId().equals(id));
    }

    private static boolean isLegalLoop(Hierarchy hierarchy, Set<String> component) {
        for (Map.Entry<String, Set<String>> loop : hierarchy.loopBodies().entrySet()) {
            if (!component.contains(loop.getKey())) {
                continue;
            }
            Set<String> allowed = new HashSet<>(loop.getValue());
            allowed.add(loop.getKey());
            if (allowed.containsAll(component)) {
                return true;
            }
        }
        return false;
    }

    /// Depth-first preorder inside the component, from its first node in layout order.
    private static List<String> traversalOrder(WorkflowGraph graph, Set<String> component) {
        String first =
                component.stream()
                        .map(graph::get)
                        .min(Comparator.comparing(GraphNode::parsed, ParsedNode.LAYOUT_ORDER))
                        .map(GraphNode::id)
                        .orElseThrow();
        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(first);
        while (!stack.isEmpty()) {
            String id = stack.pop();
            if (!visited.add(id)) {
                continue;
            }
            order.add(id);
            List<GraphNode> next = graph.controlSuccessors(id);
            for (int i = next.size() - 1; i >= 0; i--) {
                String target = next.get(i).id();
                if (component.contains(target) && !visited.contains(target)) {
                    stack.push(target);
                }
            }
        }
        return order;
    }

    /// Tarjan's strongly connected components over all control edges.
    ///
    /// Depth-first search runs on an explicit stack of frames, so chain length is not bounded
    /// by the thread stack.
    private static final class Tarjan {
        private final WorkflowGraph graph;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<Set<String>> components = new ArrayList<>();
        private int counter;

        /// A node being visited and the successors it has not looked at yet.
        private record Frame(String id, Iterator<GraphNode> successors) {}

        Tarjan(WorkflowGraph graph) {
            this.graph = graph;
        }

        List<Set<String>> components() {
            for (GraphNode node : graph.nodes()) {
                if (!index.containsKey(node.id())) {
                    connect(node.id());
                }
            }
            return components;
        }

        private void connect(String rootId) {
            Deque<Frame> frames = new ArrayDeque<>();
            enter(rootId, frames);
            while (!frames.isEmpty()) {
                Frame frame = frames.peek();
                if (frame.successors().hasNext()) {
                    String target = frame.successors().next().id();
                    if (!index.containsKey(target)) {
                        enter(target, frames);
                    } else if (onStack.contains(target)) {
                        lowLink.merge(frame.id(), index.get(target), Math::min);
                    }
                    continue;
                }

                frames.pop();
                String id = frame.id();
                if (!frames.isEmpty()) {
                    lowLink.merge(frames.peek().id(), lowLink.get(id), Math::min);
                }
                if (lowLink.get(id).equals(index.get(id))) {
                    Set<String> component = new LinkedHashSet<>();
                    String member;
                    do {
                        member = stack.pop();
                        onStack.remove(member);
                        component.add(member);
                    } while (!member.equals(id));
                    components.add(component);
                }
            }
        }

        private void enter(String id, Deque<Frame> frames) {
            index.put(id, counter);
            lowLink.put(id, counter);
            counter++;
            stack.push(id);
            onStack.add(id);
            frames.push(new Frame(id, graph.controlSuccessors(id).iterator()));
        }
    }

    // === Hierarchy ===

    private static void checkStructure(Hierarchy hierarchy, ValidationResult result) {
        for (StructuralIssue issue : hierarchy.issues()) {
            result.addError(
                    issue.code(),
                    issue.message(),
                    ErrorLocation.node(issue.regionId(), issue.nodeId()));
        }
    }

    // === References ===

    private void checkReferences(
            WorkflowGraph graph, ProjectSnapshot project, ValidationResult result) {
        for (GraphNode node : graph.nodes()) {
            if (node.payload() instanceof NodePayload.Agent agent) {
                agent.tools().forEach(t -> requireCapability(CapabilityKind.TOOL, t, node, result));
                for (CallbackPhase phase : CallbackPhase.values()) {
                    String ref = agent.callbacks().get(phase);
                    if (ref != null) {
                        requireCapability(CapabilityKind.CALLBACK, ref, node, result);
                    }
                }
                if (agent.inputSchema() != null) {
                    requireCapability(CapabilityKind.SCHEMA, agent.inputSchema(), node, result);
                }
                if (agent.outputSchema() != null) {
                    requireCapability(CapabilityKind.SCHEMA, agent.outputSchema(), node, result);
                }
            } else if (node.payload() instanceof NodePayload.Custom custom) {
                checkCustomReference(custom, node, project, result);
            }
        }
    }

    private void checkCustomReference(
            NodePayload.Custom custom,
            GraphNode node,
            ProjectSnapshot project,
            ValidationResult result) {
        ConfigUnit unit = custom.unit();
        if (unit == ConfigUnit.PROMPT || unit == ConfigUnit.CONTEXT) {
            custom.text("file")
                    .filter(file -> project.prompt(file).isEmpty())
                    .ifPresent(file -> missing(unit.wireName(), file, node, file, result));
        } else if (unit == ConfigUnit.TOOL && custom.text("file").isPresent()) {
            custom.text("file")
                    .filter(file -> project.tool(file).isEmpty())
                    .ifPresent(file -> missing("tool file", file, node, file, result));
        } else {
            CapabilityKind kind = capabilityKind(unit);
            if (kind != null && custom.text("code").isEmpty()) {
                custom.text("ref").ifPresent(ref -> requireCapability(kind, ref, node, result));
            }
        }
    }

    private static CapabilityKind capabilityKind(ConfigUnit unit) {
        return switch (unit) {
            case TOOL -> CapabilityKind.TOOL;
            case CALLBACK -> CapabilityKind.CALLBACK;
            case SCHEMA -> CapabilityKind.SCHEMA;
            case PROMPT, CONTEXT, AGGREGATOR -> null;
        };
    }

    private void requireCapability(
            CapabilityKind kind, String id, GraphNode node, ValidationResult result) {
        if (!registry.contains(kind, id)) {
            missing(kind.label(), id, node, null, result);
        }
    }

    private static void missing(
            String referenceKind,
            String name,
            GraphNode node,
            String file,
            ValidationResult result) {
        result.addError(
                "missing-reference",
                "Missing " + referenceKind + " reference '" + name + "' in '"
                        + node.displayName() + "'",
                ErrorLocation.node(node.regionId(), node.id()).withFile(file));
    }

    // === Other checks ===

    private static void checkDuplicateNames(WorkflowGraph graph, ValidationResult result) {
        Map<String, GraphNode> byName = new HashMap<>();
        for (GraphNode node : graph.nodesOfKind(NodeKind.AGENT)) {
            String name = node.payload().name();
            GraphNode previous = byName.putIfAbsent(name, node);
            if (previous != null) {
                result.addError(
                        "duplicate-name",
                        "Agent name '" + name + "' is used by '" + previous.id() + "' and '"
                                + node.id() + "'",
                        ErrorLocation.node(node.regionId(), node.id()));
            }
        }
    }

    private static void checkStartNodes(WorkflowGraph graph, ValidationResult result) {
        Map<String, List<GraphNode>> byRegion = new LinkedHashMap<>();
        for (GraphNode node : graph.nodesOfKind(NodeKind.START)) {
            byRegion.computeIfAbsent(node.regionId(), k -> new ArrayList<>()).add(node);
        }
        byRegion.forEach(
                (regionId, starts) -> {
                    if (starts.size() > 1) {
                        result.addError(
                                "multiple-start",
                                "Region '" + regionId + "' has " + starts.size()
                                        + " start nodes, only one is allowed",
                                ErrorLocation.node(regionId, starts.get(1).id()));
                    }
                });
    }

    private static void checkReachability(WorkflowGraph graph, ValidationResult result) {
        Set<String> reached = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (GraphNode entry : graph.entryNodes()) {
            if (reached.add(entry.id())) {
                queue.add(entry.id());
            }
        }
        while (!queue.isEmpty()) {
            for (GraphNode next : graph.controlSuccessors(queue.poll())) {
                if (reached.add(next.id())) {
                    queue.add(next.id());
                }
            }
        }
        for (GraphNode agent : graph.nodesOfKind(NodeKind.AGENT)) {
            if (!reached.contains(agent.id())) {
                result.addWarning(
                        "unreachable-agent",
                        "Agent '" + agent.displayName() + "' is not reachable from any entry node",
                        ErrorLocation.node(agent.regionId(), agent.id()));
            }
        }
    }

    private static void checkAgentSettings(WorkflowGraph graph, ValidationResult result) {
        for (GraphNode node : graph.nodesOfKind(NodeKind.AGENT)) {
            NodePayload.Agent agent = (NodePayload.Agent) node.payload();
            ErrorLocation location = ErrorLocation.node(node.regionId(), node.id());
            Double temperature = agent.temperature();
            if (temperature != null && (temperature < 0 || temperature > 2)) {
                result.addWarning(
                        "temperature-range",
                        "Agent '" + agent.name() + "' has temperature " + temperature
                                + " outside [0, 2]",
                        location);
            }
            if (agent.outputKey() == null && feedsAgent(graph, node)) {
                result.addWarning(
                        "missing-output-key",
                        "Agent '" + agent.name()
                                + "' feeds another agent but has no output_key",
                        location);
            }
        }
    }

    private static boolean feedsAgent(WorkflowGraph graph, GraphNode node) {
        for (GraphEdge edge : node.outgoing()) {
            if (edge.semantics() == EdgeSemantics.SEQUENTIAL
                    && graph.get(edge.targetId()).kind() == NodeKind.AGENT) {
                return true;
            }
        }
        return false;
    }

    private static void checkLoops(WorkflowGraph graph, ValidationResult result) {
        for (LoopBody body : graph.loopBodies().values()) {
            if (body.bodyEdges().isEmpty()) {
                continue;
            }
            boolean hasAgent =
                    body.members().stream()
                            .anyMatch(id -> graph.get(id).kind() == NodeKind.AGENT);
            if (!hasAgent) {
                GraphNode marker = graph.get(body.markerId());
                result.addWarning(
                        "empty-loop",
                        "Loop '" + marker.displayName() + "' has no agent in its body",
                        ErrorLocation.node(marker.regionId(), marker.id()));
            }
        }
    }

    /// Configuration nodes that feed nothing and teleporters that carry no flow.
    private static void checkOrphans(WorkflowGraph graph, ValidationResult result) {
        for (GraphNode node : graph.nodes()) {
            boolean orphan =
                    switch (node.kind()) {
                        case CUSTOM -> node.isIsolated();
                        case TELEPORTER_OUT -> node.incoming().isEmpty();
                        case TELEPORTER_IN -> node.outgoing().isEmpty();
                        case START,
                                END,
                                AGENT,
                                LOOP,
                                PARALLEL_JOIN,
                                VARIABLE,
                                USER_INPUT -> false;
                    };
            if (orphan) {
                result.addWarning(
                        "orphan-node",
                        node.kind().wireName() + " node '" + node.displayName()
                                + "' is not connected",
                        ErrorLocation.node(node.regionId(), node.id()));
            }
        }
    }
}
