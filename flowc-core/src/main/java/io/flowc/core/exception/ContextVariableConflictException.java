package io.flowc.core.exception;

import java.io.Serial;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/// Thrown when a context variable receives different values from several sources.
///
/// Conflicts are gathered for the whole workflow before this is raised, and every conflict
/// keeps every contributing source with its value, so the message can be acted on in one go:
///
/// ```
/// Context variable conflicts: agent 'writer' variable 'tone' <- [vars_a='formal', vars_b='casual']
/// ```
public class ContextVariableConflictException extends CompilationException {

    @Serial private static final long serialVersionUID = -4925073409542218093L;

    private final transient List<Conflict> conflicts;

    /// Creates exception for the given conflicts.
    ///
    /// @param conflicts detected conflicts, not null or empty
    public ContextVariableConflictException(List<Conflict> conflicts) {
        super(render(conflicts), ErrorLocation.node(null, conflicts.get(0).agentId()));
        this.conflicts = List.copyOf(conflicts);
    }

    /// Returns every detected conflict in detection order.
    ///
    /// @return unmodifiable list, never empty
    public List<Conflict> getConflicts() {
        return conflicts;
    }

    private static String render(List<Conflict> conflicts) {
        Objects.requireNonNull(conflicts, "conflicts must not be null");
        if (conflicts.isEmpty()) {
            throw new IllegalArgumentException("conflicts must not be empty");
        }
        return "Context variable conflicts: "
                + conflicts.stream().map(Conflict::describe).collect(Collectors.joining("; "));
    }

    /// One variable of one agent with more than one distinct value.
    ///
    /// @param agentId id of the agent receiving the variable, not null
    /// @param variable variable name, not null
    /// @param valuesBySource source node id to the value it supplies, in edge order, not null
    public record Conflict(String agentId, String variable, Map<String, String> valuesBySource) {

        public Conflict {
            Objects.requireNonNull(agentId, "agentId must not be null");
            Objects.requireNonNull(variable, "variable must not be null");
            Objects.requireNonNull(valuesBySource, "valuesBySource must not be null");
        }

        /// Renders the conflict as `agent 'a' variable 'v' <- [s1='x', s2='y']`.
        ///
        /// @return description, never null
        public String describe() {
            return "agent '"
                    + agentId
                    + "' variable '"
                    + variable
                    + "' <- "
                    + valuesBySource.entrySet().stream()
                            .map(e -> e.getKey() + "='" + e.getValue() + "'")
                            .collect(Collectors.joining(", ", "[", "]"));
        }
    }
}
