package io.flowc.core.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable node of the compiled execution tree.
///
/// A leaf (`LLM`) carries the resolved configuration of one agent node. A composite
/// (`SEQUENTIAL`, `PARALLEL`, `LOOP`) owns its subagents exclusively: every agent has at most
/// one parent, so the tree never shares a node and never contains a cycle.
///
/// ### Ids
/// Leaves use the id of their agent node. Composites use deterministic ids derived from the
/// graph node that anchors them: `seq_<first anchor>`, `par_<fork id>`, `loop_<marker id>`.
///
/// ### Usage
/// {@snippet :
/// AgentIR writer = AgentIR.builder()
///     .id("a1")
///     .name("writer")
///     .kind(AgentKind.LLM)
///     .instruction("Write a haiku")
///     .build();
///
/// AgentIR reviewed = writer.toBuilder().temperature(0.2).build();
/// }
///
/// @implNote Immutable and thread-safe after construction.
public final class AgentIR {

    private final String id;
    private final String name;
    private final AgentKind kind;
    private final List<AgentIR> subagents;
    private final String instruction;
    private final List<ToolIR> tools;
    private final List<CallbackIR> callbacks;
    private final SchemaIR inputSchema;
    private final SchemaIR outputSchema;
    private final Map<String, String> contextVariables;
    private final String model;
    private final Double temperature;
    private final String outputKey;
    private final String description;
    private final Integer maxIterations;
    private final Map<String, Object> settings;
    private final String sourceNodeId;
    private final String condition;

    private AgentIR(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Agent id required");
        this.name = builder.name != null ? builder.name : builder.id;
        this.kind = Objects.requireNonNull(builder.kind, "Agent kind required");
        this.subagents = List.copyOf(builder.subagents);
        this.instruction = builder.instruction;
        this.tools = List.copyOf(builder.tools);
        this.callbacks = List.copyOf(builder.callbacks);
        this.inputSchema = builder.inputSchema;
        this.outputSchema = builder.outputSchema;
        this.contextVariables =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.contextVariables));
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.outputKey = builder.outputKey;
        this.description = builder.description;
        this.maxIterations = builder.maxIterations;
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.settings));
        this.sourceNodeId = builder.sourceNodeId;
        this.condition = builder.condition;

        if (!kind.isComposite() && !subagents.isEmpty()) {
            throw new IllegalStateException("Leaf agent '" + id + "' cannot own subagents");
        }
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public AgentKind getKind() {
        return kind;
    }

    /// @return owned subagents in execution order (branch order for parallel), never null
    public List<AgentIR> getSubagents() {
        return subagents;
    }

    /// @return resolved instruction text, may be null
    public String getInstruction() {
        return instruction;
    }

    public List<ToolIR> getTools() {
        return tools;
    }

    /// @return at most one callback per phase, in phase order, never null
    public List<CallbackIR> getCallbacks() {
        return callbacks;
    }

    public SchemaIR getInputSchema() {
        return inputSchema;
    }

    public SchemaIR getOutputSchema() {
        return outputSchema;
    }

    /// @return variables for session seeding, in source order, never null
    public Map<String, String> getContextVariables() {
        return contextVariables;
    }

    /// @return model id, null for composites
    public String getModel() {
        return model;
    }

    /// @return sampling temperature, null for composites
    public Double getTemperature() {
        return temperature;
    }

    public String getOutputKey() {
        return outputKey;
    }

    public String getDescription() {
        return description;
    }

    /// @return iteration bound of a loop, null for other kinds
    public Integer getMaxIterations() {
        return maxIterations;
    }

    /// @return free-form runtime settings, never null
    public Map<String, Object> getSettings() {
        return settings;
    }

    /// @return graph node this agent was compiled from, null for sequences and virtual forks
    public String getSourceNodeId() {
        return sourceNodeId;
    }

    /// @return label of the conditional edge leading into this agent, may be null
    public String getCondition() {
        return condition;
    }

    /// @return true for sequential, parallel and loop agents
    public boolean isComposite() {
        return kind.isComposite();
    }

    /// Returns this agent and all its descendants in depth-first preorder.
    ///
    /// @return flattened tree, never null
    public List<AgentIR> flatten() {
        List<AgentIR> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(AgentIR agent, List<AgentIR> result) {
        result.add(agent);
        agent.subagents.forEach(s -> collect(s, result));
    }

    /// Creates a builder pre-filled with this agent's values.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .kind(kind)
                .subagents(subagents)
                .instruction(instruction)
                .tools(tools)
                .callbacks(callbacks)
                .inputSchema(inputSchema)
                .outputSchema(outputSchema)
                .contextVariables(contextVariables)
                .model(model)
                .temperature(temperature)
                .outputKey(outputKey)
                .description(description)
                .maxIterations(maxIterations)
                .settings(settings)
                .sourceNodeId(sourceNodeId)
                .condition(condition);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        if (!isComposite()) {
            return name;
        }
        return kind.wireName() + subagents;
    }

    /// Builder for immutable {@link AgentIR} instances.
    ///
    /// Required fields: `id`, `kind`. Leaves must not be given subagents.
    public static final class Builder {
        private String id;
        private String name;
        private AgentKind kind;
        private List<AgentIR> subagents = List.of();
        private String instruction;
        private List<ToolIR> tools = List.of();
        private List<CallbackIR> callbacks = List.of();
        private SchemaIR inputSchema;
        private SchemaIR outputSchema;
        private Map<String, String> contextVariables = Map.of();
        private String model;
        private Double temperature;
        private String outputKey;
        private String description;
        private Integer maxIterations;
        private Map<String, Object> settings = Map.of();
        private String sourceNodeId;
        private String condition;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(AgentKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder subagents(List<AgentIR> subagents) {
            this.subagents = subagents != null ? subagents : List.of();
            return this;
        }

        public Builder instruction(String instruction) {
            this.instruction = instruction;
            return this;
        }

        public Builder tools(List<ToolIR> tools) {
            this.tools = tools != null ? tools : List.of();
            return this;
        }

        public Builder callbacks(List<CallbackIR> callbacks) {
            this.callbacks = callbacks != null ? callbacks : List.of();
            return this;
        }

        public Builder inputSchema(SchemaIR inputSchema) {
            this.inputSchema = inputSchema;
            return this;
        }

        public Builder outputSchema(SchemaIR outputSchema) {
            this.outputSchema = outputSchema;
            return this;
        }

        public Builder contextVariables(Map<String, String> contextVariables) {
            this.contextVariables = contextVariables != null ? contextVariables : Map.of();
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder outputKey(String outputKey) {
            this.outputKey = outputKey;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder maxIterations(Integer maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder settings(Map<String, Object> settings) {
            this.settings = settings != null ? settings : Map.of();
            return this;
        }

        public Builder sourceNodeId(String sourceNodeId) {
            this.sourceNodeId = sourceNodeId;
            return this;
        }

        public Builder condition(String condition) {
            this.condition = condition;
            return this;
        }

        /// Builds the immutable agent.
        ///
        /// @return new agent, never null
        /// @throws NullPointerException if `id` or `kind` is missing
        /// @throws IllegalStateException if a leaf was given subagents
        public AgentIR build() {
            return new AgentIR(this);
        }
    }
}
