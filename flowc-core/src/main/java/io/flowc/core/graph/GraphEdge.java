package io.flowc.core.graph;

import java.util.Objects;

/// A classified edge of a {@link WorkflowGraph}.
///
/// @param id edge id (synthesized teleport edges use `teleport:<channel>`), not null
/// @param sourceId source node id, not null
/// @param targetId target node id, not null
/// @param sourcePort source port, may be null
/// @param targetPort target port, may be null
/// @param semantics classified meaning, not null
/// @param condition label of a conditional edge, null otherwise
/// @param loopBody whether the edge leaves a loop marker's body port
/// @param backEdge whether the edge returns from a loop body into its marker
public record GraphEdge(
        String id,
        String sourceId,
        String targetId,
        String sourcePort,
        String targetPort,
        EdgeSemantics semantics,
        String condition,
        boolean loopBody,
        boolean backEdge) {

    public GraphEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(semantics, "semantics must not be null");
    }

    /// @return true if the edge carries control flow
    public boolean isControl() {
        return semantics.isControl();
    }

    /// Forward control edges exclude loop back edges; they form the acyclic skeleton used for
    /// hierarchy building when every cycle is a legal loop.
    ///
    /// @return true for control edges that are not back edges
    public boolean isForwardControl() {
        return semantics.isControl() && !backEdge;
    }

    GraphEdge asBackEdge() {
        return new GraphEdge(
                id, sourceId, targetId, sourcePort, targetPort, semantics, condition, loopBody,
                true);
    }
}
