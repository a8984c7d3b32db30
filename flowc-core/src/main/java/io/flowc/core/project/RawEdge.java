package io.flowc.core.project;

import java.util.Objects;

/// Edge record exactly as authored in a flow document.
///
/// @param id edge id, not null
/// @param source source node id, not null
/// @param target target node id, not null
/// @param sourceHandle port on the source node, may be null
/// @param targetHandle port on the target node, may be null
public record RawEdge(
        String id, String source, String target, String sourceHandle, String targetHandle) {

    public RawEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
    }

    /// Creates an edge without ports.
    ///
    /// @param id edge id, not null
    /// @param source source node id, not null
    /// @param target target node id, not null
    /// @return new edge, never null
    public static RawEdge of(String id, String source, String target) {
        return new RawEdge(id, source, target, null, null);
    }
}
