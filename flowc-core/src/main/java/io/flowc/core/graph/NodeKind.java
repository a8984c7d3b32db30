package io.flowc.core.graph;

import java.util.Optional;

/// Closed set of node kinds a flow document may contain.
///
/// Every stage of the compiler switches exhaustively over this enum; there is no fallback
/// kind, so an unknown wire name is rejected by {@link FlowParser}.
public enum NodeKind {
    START("start"),
    END("end"),
    AGENT("agent"),
    LOOP("loop"),
    PARALLEL_JOIN("parallel-join"),
    TELEPORTER_OUT("teleporter-out"),
    TELEPORTER_IN("teleporter-in"),
    VARIABLE("variable"),
    USER_INPUT("user-input"),
    CUSTOM("custom");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the name used in flow documents.
    ///
    /// @return wire name, never null
    public String wireName() {
        return wireName;
    }

    /// Looks up a kind by its wire name.
    ///
    /// @param wireName name from a flow document, may be null
    /// @return matching kind, empty if unknown
    public static Optional<NodeKind> fromWireName(String wireName) {
        for (NodeKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
