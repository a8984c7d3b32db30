package io.flowc.core.transform;

import io.flowc.core.exception.CompilationException;
import io.flowc.core.exception.ContextVariableConflictException.Conflict;
import io.flowc.core.exception.ErrorLocation;
import io.flowc.core.exception.PromptLoadException;
import io.flowc.core.exception.ToolLoadException;
import io.flowc.core.graph.ConfigUnit;
import io.flowc.core.graph.EdgeSemantics;
import io.flowc.core.graph.GraphEdge;
import io.flowc.core.graph.GraphNode;
import io.flowc.core.graph.NodePayload;
import io.flowc.core.graph.Ports;
import io.flowc.core.graph.WorkflowGraph;
import io.flowc.core.ir.CallbackIR;
import io.flowc.core.ir.CallbackPhase;
import io.flowc.core.ir.SchemaIR;
import io.flowc.core.ir.ToolIR;
import io.flowc.core.project.ProjectFile;
import io.flowc.core.project.ProjectSnapshot;
import io.flowc.core.registry.CapabilityDefinition;
import io.flowc.core.registry.CapabilityKind;
import io.flowc.core.registry.CapabilityRegistry;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Resolves the configuration attached to an agent node through its incoming `DATA` edges.
///
/// Sources are visited in edge order and routed by their kind:
///
/// ```
/// source              target port               result
/// ——————————————————  ————————————————————————  ————————————————————————————————————
/// prompt unit         instruction               instruction part (file or content)
/// context unit        instruction | context     instruction part "## Context\n<text>"
/// variable            instruction               instruction part "{name}: value"
/// variable            other                     context variable
/// aggregator unit     context                   context variables
/// tool unit           tools                     tool (FILE, INLINE or REGISTRY)
/// callback unit       any                       callback; phase from the port or `phase`
/// schema unit         input_schema              input schema
/// schema unit         output_schema             output schema
/// ```
///
/// An edge without a target port is routed by the source kind alone (a schema unit then
/// becomes the output schema). An edge naming a configuration port that its source cannot
/// feed, such as a prompt drawn into `tools`, fails resolution.
///
/// Connected sources take precedence over the agent's own text fields for callbacks and
/// schemas; the agent's inline instruction comes before connected prompt text and its own
/// registry tools come after connected tools.
///
/// @implNote Stateless apart from the read-only graph, snapshot and registry; one instance per
/// compile call.
public final class Resolvers {

    private static final Logger logger = Logger.getLogger(Resolvers.class.getName());

    private static final List<String> PROMPT_PORTS = List.of(Ports.INSTRUCTION);
    private static final List<String> CONTEXT_PORTS = List.of(Ports.INSTRUCTION, Ports.CONTEXT);
    private static final List<String> AGGREGATOR_PORTS = List.of(Ports.CONTEXT);
    private static final List<String> TOOL_PORTS = List.of(Ports.TOOLS);
    private static final List<String> SCHEMA_PORTS =
            List.of(Ports.INPUT_SCHEMA, Ports.OUTPUT_SCHEMA);

    static final String CONTEXT_HEADING = "## Context\n";
    static final String PART_SEPARATOR = "\n\n";

    private final WorkflowGraph graph;
    private final ProjectSnapshot project;
    private final CapabilityRegistry registry;

    /// @param graph frozen graph, not null
    /// @param project project snapshot holding prompt and tool files, not null
    /// @param registry capability lookup for schema descriptors, not null
    public Resolvers(WorkflowGraph graph, ProjectSnapshot project, CapabilityRegistry registry) {
        this.graph = Objects.requireNonNull(graph, "graph must not be null");
        this.project = Objects.requireNonNull(project, "project must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /// Builds the instruction text of an agent.
    ///
    /// @param agent agent node, not null
    /// @return parts joined by a blank line, null if there are none
    /// @throws PromptLoadException if a connected prompt or context file is not in the snapshot
    /// @throws CompilationException if a prompt or context node is wired to a foreign port
    public String resolveInstruction(GraphNode agent) throws CompilationException {
        List<String> parts = new ArrayList<>();
        String inline = agentPayload(agent).instruction();
        if (inline != null) {
            parts.add(inline);
        }
        for (GraphEdge edge : dataInputs(agent)) {
            GraphNode source = graph.get(edge.sourceId());
            if (source.payload() instanceof NodePayload.Custom custom) {
                if (custom.unit() == ConfigUnit.PROMPT) {
                    requirePort(edge, agent, custom, PROMPT_PORTS);
                    parts.add(text(custom, source));
                } else if (custom.unit() == ConfigUnit.CONTEXT) {
                    requirePort(edge, agent, custom, CONTEXT_PORTS);
                    parts.add(CONTEXT_HEADING + text(custom, source));
                }
            } else if (source.payload() instanceof NodePayload.Variable variable
                    && Ports.INSTRUCTION.equals(edge.targetPort())) {
                parts.add("{" + variable.name() + "}: " + variable.value());
            }
        }
        return parts.isEmpty() ? null : String.join(PART_SEPARATOR, parts);
    }

    /// Collects the tools of an agent: connected tool nodes, then the agent's registry tools.
    ///
    /// @param agent agent node, not null
    /// @return tools in resolution order, never null
    /// @throws ToolLoadException if a connected tool file is not in the snapshot
    /// @throws CompilationException if a tool node is wired to a foreign port
    public List<ToolIR> resolveTools(GraphNode agent) throws CompilationException {
        List<ToolIR> tools = new ArrayList<>();
        for (GraphEdge edge : dataInputs(agent)) {
            GraphNode source = graph.get(edge.sourceId());
            if (source.payload() instanceof NodePayload.Custom custom
                    && custom.unit() == ConfigUnit.TOOL) {
                requirePort(edge, agent, custom, TOOL_PORTS);
                tools.add(tool(custom, source));
            }
        }
        agentPayload(agent).tools().forEach(id -> tools.add(ToolIR.registry(id)));
        return tools;
    }

    private ToolIR tool(NodePayload.Custom custom, GraphNode source) throws ToolLoadException {
        ToolIR.ErrorBehavior behavior =
                ToolIR.ErrorBehavior.fromWireName(custom.text("error_behavior").orElse(null));
        String file = custom.text("file").orElse(null);
        if (file != null) {
            ProjectFile loaded =
                    project.tool(file)
                            .orElseThrow(
                                    () ->
                                            new ToolLoadException(
                                                    "Tool file '" + file + "' was not loaded",
                                                    location(source).withFile(file)));
            String name = custom.name() != null ? custom.name() : loaded.name();
            return new ToolIR(name, ToolIR.Source.FILE, file, loaded.content(), behavior);
        }
        String code = custom.text("code").orElse(null);
        if (code != null) {
            return new ToolIR(source.displayName(), ToolIR.Source.INLINE, null, code, behavior);
        }
        String ref =
                custom.text("ref")
                        .orElseThrow(
                                () ->
                                        new ToolLoadException(
                                                "Tool node '" + source.displayName()
                                                        + "' has no file, code or ref",
                                                location(source)));
        return new ToolIR(ref, ToolIR.Source.REGISTRY, null, null, behavior);
    }

    /// Resolves callbacks: agent text fields first, overridden per phase by connected nodes.
    ///
    /// @param agent agent node, not null
    /// @return at most one callback per phase, in phase order, never null
    /// @throws CompilationException if a connected callback node has no phase
    public List<CallbackIR> resolveCallbacks(GraphNode agent) throws CompilationException {
        Map<CallbackPhase, CallbackIR> byPhase = new EnumMap<>(CallbackPhase.class);
        agentPayload(agent)
                .callbacks()
                .forEach((phase, ref) -> byPhase.put(phase, CallbackIR.reference(phase, ref)));

        for (GraphEdge edge : callbackEdges(agent)) {
            boolean fromAgent = edge.sourceId().equals(agent.id());
            GraphNode source = graph.get(fromAgent ? edge.targetId() : edge.sourceId());
            if (source.payload() instanceof NodePayload.Custom custom
                    && custom.unit() == ConfigUnit.CALLBACK) {
                CallbackPhase phase = phase(edge, custom, source);
                String code = custom.text("code").orElse(null);
                String ref = code == null ? custom.text("ref").orElse(null) : null;
                CallbackIR previous =
                        byPhase.put(
                                phase,
                                new CallbackIR(
                                        phase, source.displayName(), code, ref, source.id()));
                if (previous != null) {
                    logger.fine(
                            () ->
                                    "Callback node '"
                                            + source.id()
                                            + "' overrides "
                                            + phase.portName()
                                            + " of agent '"
                                            + agent.id()
                                            + "'");
                }
            }
        }
        return List.copyOf(byPhase.values());
    }

    private static CallbackPhase phase(
            GraphEdge edge, NodePayload.Custom custom, GraphNode source)
            throws CompilationException {
        return CallbackPhase.fromPortName(edge.sourcePort())
                .or(() -> CallbackPhase.fromPortName(edge.targetPort()))
                .or(() -> custom.text("phase").flatMap(p -> CallbackPhase.fromPortName(p + "_callback")))
                .orElseThrow(
                        () ->
                                new CompilationException(
                                        "Callback node '"
                                                + source.displayName()
                                                + "' is connected without a lifecycle phase",
                                        location(source)));
    }

    /// Resolves the input schema of an agent.
    ///
    /// @param agent agent node, not null
    /// @return schema, null if none is set or connected
    /// @throws CompilationException if a schema node is wired to a foreign port
    public SchemaIR resolveInputSchema(GraphNode agent) throws CompilationException {
        return schema(agent, agentPayload(agent).inputSchema(), true);
    }

    /// Resolves the output schema of an agent.
    ///
    /// @param agent agent node, not null
    /// @return schema, null if none is set or connected
    /// @throws CompilationException if a schema node is wired to a foreign port
    public SchemaIR resolveOutputSchema(GraphNode agent) throws CompilationException {
        return schema(agent, agentPayload(agent).outputSchema(), false);
    }

    private SchemaIR schema(GraphNode agent, String ref, boolean input)
            throws CompilationException {
        SchemaIR result = ref != null ? referencedSchema(ref) : null;
        for (GraphEdge edge : dataInputs(agent)) {
            GraphNode source = graph.get(edge.sourceId());
            boolean inputPort = Ports.INPUT_SCHEMA.equals(edge.targetPort());
            if (!(source.payload() instanceof NodePayload.Custom custom)
                    || custom.unit() != ConfigUnit.SCHEMA) {
                continue;
            }
            requirePort(edge, agent, custom, SCHEMA_PORTS);
            if (inputPort == input) {
                String code = custom.text("code").orElse(null);
                String nodeRef = code == null ? custom.text("ref").orElse(null) : null;
                String className =
                        custom.text("class_name")
                                .orElseGet(
                                        () ->
                                                nodeRef != null
                                                        ? referencedSchema(nodeRef).className()
                                                        : null);
                result =
                        new SchemaIR(source.displayName(), code, className, nodeRef, source.id());
            }
        }
        return result;
    }

    private SchemaIR referencedSchema(String ref) {
        String className =
                registry.find(CapabilityKind.SCHEMA, ref)
                        .map(CapabilityDefinition::attributes)
                        .map(a -> a.get(CapabilityDefinition.CLASS_NAME))
                        .orElse(null);
        return new SchemaIR(ref, null, className, ref, null);
    }

    /// Gathers the context variables of an agent from variable and aggregator sources.
    ///
    /// A name supplied with different values by several sources is added to `conflicts`
    /// (listing every source) and keeps its first value.
    ///
    /// @param agent agent node, not null
    /// @param conflicts receives detected conflicts, not null
    /// @return variables by name in source order, never null
    /// @throws CompilationException if an aggregator node is wired to a foreign port
    public Map<String, String> resolveContextVariables(GraphNode agent, List<Conflict> conflicts)
            throws CompilationException {
        Map<String, Map<String, String>> sourcesByName = new LinkedHashMap<>();
        for (GraphEdge edge : dataInputs(agent)) {
            GraphNode source = graph.get(edge.sourceId());
            if (source.payload() instanceof NodePayload.Variable variable
                    && !Ports.INSTRUCTION.equals(edge.targetPort())) {
                sourcesByName
                        .computeIfAbsent(variable.name(), k -> new LinkedHashMap<>())
                        .put(source.id(), variable.value());
            } else if (source.payload() instanceof NodePayload.Custom custom
                    && custom.unit() == ConfigUnit.AGGREGATOR) {
                requirePort(edge, agent, custom, AGGREGATOR_PORTS);
                Object variables = custom.attributes().get("variables");
                if (variables instanceof Map<?, ?> map) {
                    map.forEach(
                            (name, value) ->
                                    sourcesByName
                                            .computeIfAbsent(
                                                    String.valueOf(name),
                                                    k -> new LinkedHashMap<>())
                                            .put(source.id(), String.valueOf(value)));
                }
            }
        }

        Map<String, String> variables = new LinkedHashMap<>();
        sourcesByName.forEach(
                (name, valuesBySource) -> {
                    if (valuesBySource.values().stream().distinct().count() > 1) {
                        conflicts.add(new Conflict(agent.id(), name, valuesBySource));
                    }
                    variables.put(name, valuesBySource.values().iterator().next());
                });
        return variables;
    }

    /// Rejects an edge whose target port is a configuration port the source unit cannot feed.
    private void requirePort(
            GraphEdge edge, GraphNode agent, NodePayload.Custom custom, List<String> accepted)
            throws CompilationException {
        String port = edge.targetPort();
        if (!Ports.isConfigurationInput(port) || accepted.contains(port)) {
            return;
        }
        GraphNode source = graph.get(edge.sourceId());
        throw new CompilationException(
                custom.unit().wireName()
                        + " node '"
                        + source.displayName()
                        + "' is connected to port '"
                        + port
                        + "' of agent '"
                        + agent.displayName()
                        + "', expected "
                        + String.join(" or ", accepted),
                location(source));
    }

    private String text(NodePayload.Custom custom, GraphNode source) throws PromptLoadException {
        String file = custom.text("file").orElse(null);
        if (file == null) {
            return custom.text("content").orElse("");
        }
        return project.prompt(file)
                .map(ProjectFile::content)
                .orElseThrow(
                        () ->
                                new PromptLoadException(
                                        custom.unit().wireName()
                                                + " file '"
                                                + file
                                                + "' was not loaded",
                                        location(source).withFile(file)));
    }

    /// Data edges between the agent and callback candidates: edges leaving one of the agent's
    /// callback ports, then incoming data edges.
    private static List<GraphEdge> callbackEdges(GraphNode agent) {
        List<GraphEdge> edges = new ArrayList<>();
        for (GraphEdge edge : agent.outgoing()) {
            if (edge.semantics() == EdgeSemantics.DATA
                    && CallbackPhase.fromPortName(edge.sourcePort()).isPresent()) {
                edges.add(edge);
            }
        }
        edges.addAll(dataInputs(agent));
        return edges;
    }

    private static List<GraphEdge> dataInputs(GraphNode agent) {
        return agent.incoming().stream()
                .filter(e -> e.semantics() == EdgeSemantics.DATA)
                .toList();
    }

    private static NodePayload.Agent agentPayload(GraphNode agent) {
        if (!(agent.payload() instanceof NodePayload.Agent payload)) {
            throw new IllegalArgumentException("Not an agent node: " + agent);
        }
        return payload;
    }

    private static ErrorLocation location(GraphNode node) {
        return ErrorLocation.node(node.regionId(), node.id());
    }
}
