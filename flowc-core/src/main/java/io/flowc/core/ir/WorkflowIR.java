package io.flowc.core.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// The compiled artifact of a project, handed to the agent runtime.
///
/// Holds one root {@link AgentIR} per region that has entry nodes, a flat index of every agent
/// in those trees, the global variables left for runtime resolution, and the resolved
/// teleporter and user-input nodes.
///
/// ### Structure
/// - **Roots**: region id to root agent, in region order
/// - **All agents**: agent id to agent, every leaf and composite of every root
/// - **Global variables**: unconnected variable nodes merged with caller-supplied values
/// - **Flags**: `hasStartNode` (a start node begins a region), `hasEndNode` (an end node is
///   reachable)
///
/// @implNote Immutable and thread-safe after construction.
public final class WorkflowIR {

    private final Map<String, AgentIR> roots;
    private final Map<String, AgentIR> allAgents;
    private final Map<String, String> globalVariables;
    private final WorkflowMetadata metadata;
    private final String projectPath;
    private final List<String> tabIds;
    private final boolean hasStartNode;
    private final boolean hasEndNode;
    private final List<TeleporterIR> teleporters;
    private final List<UserInputIR> userInputs;

    private WorkflowIR(Builder builder) {
        this.roots = Collections.unmodifiableMap(new LinkedHashMap<>(builder.roots));
        this.allAgents = Collections.unmodifiableMap(new LinkedHashMap<>(builder.allAgents));
        this.globalVariables =
                Collections.unmodifiableMap(new LinkedHashMap<>(builder.globalVariables));
        this.metadata = Objects.requireNonNull(builder.metadata, "Metadata required");
        this.projectPath = builder.projectPath;
        this.tabIds = List.copyOf(builder.tabIds);
        this.hasStartNode = builder.hasStartNode;
        this.hasEndNode = builder.hasEndNode;
        this.teleporters = List.copyOf(builder.teleporters);
        this.userInputs = List.copyOf(builder.userInputs);
    }

    /// @return root agent per region id in region order, never null
    public Map<String, AgentIR> getRoots() {
        return roots;
    }

    /// @return every agent of every root keyed by id, in tree order, never null
    public Map<String, AgentIR> getAllAgents() {
        return allAgents;
    }

    /// @return variables left for runtime resolution, never null
    public Map<String, String> getGlobalVariables() {
        return globalVariables;
    }

    public WorkflowMetadata getMetadata() {
        return metadata;
    }

    /// @return project directory as given to the loader, may be null
    public String getProjectPath() {
        return projectPath;
    }

    /// @return every region id of the project in region order, never null
    public List<String> getTabIds() {
        return tabIds;
    }

    /// @return true if some region starts at a start node
    public boolean hasStartNode() {
        return hasStartNode;
    }

    /// @return true if an end node is reachable from an entry node
    public boolean hasEndNode() {
        return hasEndNode;
    }

    /// @return resolved teleporter pairs ordered by channel, never null
    public List<TeleporterIR> getTeleporters() {
        return teleporters;
    }

    public List<UserInputIR> getUserInputs() {
        return userInputs;
    }

    /// Looks up an agent by id.
    ///
    /// @param agentId agent id, not null
    /// @return the agent, empty if unknown
    public Optional<AgentIR> agent(String agentId) {
        return Optional.ofNullable(allAgents.get(agentId));
    }

    /// Creates a builder pre-filled with this workflow's values.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .roots(roots)
                .allAgents(allAgents)
                .globalVariables(globalVariables)
                .metadata(metadata)
                .projectPath(projectPath)
                .tabIds(tabIds)
                .hasStartNode(hasStartNode)
                .hasEndNode(hasEndNode)
                .teleporters(teleporters)
                .userInputs(userInputs);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for immutable {@link WorkflowIR} instances.
    ///
    /// Required field: `metadata`.
    public static final class Builder {
        private Map<String, AgentIR> roots = Map.of();
        private Map<String, AgentIR> allAgents = Map.of();
        private Map<String, String> globalVariables = Map.of();
        private WorkflowMetadata metadata;
        private String projectPath;
        private List<String> tabIds = List.of();
        private boolean hasStartNode;
        private boolean hasEndNode;
        private List<TeleporterIR> teleporters = List.of();
        private List<UserInputIR> userInputs = List.of();

        private Builder() {}

        public Builder roots(Map<String, AgentIR> roots) {
            this.roots = roots != null ? roots : Map.of();
            return this;
        }

        public Builder allAgents(Map<String, AgentIR> allAgents) {
            this.allAgents = allAgents != null ? allAgents : Map.of();
            return this;
        }

        public Builder globalVariables(Map<String, String> globalVariables) {
            this.globalVariables = globalVariables != null ? globalVariables : Map.of();
            return this;
        }

        public Builder metadata(WorkflowMetadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder projectPath(String projectPath) {
            this.projectPath = projectPath;
            return this;
        }

        public Builder tabIds(List<String> tabIds) {
            this.tabIds = tabIds != null ? tabIds : List.of();
            return this;
        }

        public Builder hasStartNode(boolean hasStartNode) {
            this.hasStartNode = hasStartNode;
            return this;
        }

        public Builder hasEndNode(boolean hasEndNode) {
            this.hasEndNode = hasEndNode;
            return this;
        }

        public Builder teleporters(List<TeleporterIR> teleporters) {
            this.teleporters = teleporters != null ? teleporters : List.of();
            return this;
        }

        public Builder userInputs(List<UserInputIR> userInputs) {
            this.userInputs = userInputs != null ? userInputs : List.of();
            return this;
        }

        /// Builds the immutable workflow.
        ///
        /// @return new workflow, never null
        /// @throws NullPointerException if `metadata` is missing
        public WorkflowIR build() {
            return new WorkflowIR(this);
        }
    }
}
