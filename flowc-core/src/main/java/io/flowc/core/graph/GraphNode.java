package io.flowc.core.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// A parsed node plus its incident edges.
///
/// Edge lists are mutable while the {@link GraphBuilder} classifies edges and resolves
/// teleporters; once the owning graph is frozen they become read-only.
public final class GraphNode {

    private final ParsedNode node;
    private List<GraphEdge> incoming = new ArrayList<>();
    private List<GraphEdge> outgoing = new ArrayList<>();
    private boolean frozen;

    GraphNode(ParsedNode node) {
        this.node = Objects.requireNonNull(node, "node must not be null");
    }

    public ParsedNode parsed() {
        return node;
    }

    public String id() {
        return node.id();
    }

    public NodeKind kind() {
        return node.kind();
    }

    public NodePayload payload() {
        return node.payload();
    }

    public String regionId() {
        return node.regionId();
    }

    public Position position() {
        return node.position();
    }

    /// @return name from the payload, or the id
    public String displayName() {
        return node.displayName();
    }

    /// @return incoming edges in insertion order, never null
    public List<GraphEdge> incoming() {
        return Collections.unmodifiableList(incoming);
    }

    /// @return outgoing edges in insertion order, never null
    public List<GraphEdge> outgoing() {
        return Collections.unmodifiableList(outgoing);
    }

    /// @return true if the node has neither incoming nor outgoing edges
    public boolean isIsolated() {
        return incoming.isEmpty() && outgoing.isEmpty();
    }

    void addIncoming(GraphEdge edge) {
        checkMutable();
        incoming.add(edge);
    }

    void addOutgoing(GraphEdge edge) {
        checkMutable();
        outgoing.add(edge);
    }

    void replaceEdge(GraphEdge previous, GraphEdge replacement) {
        checkMutable();
        incoming.replaceAll(e -> e == previous ? replacement : e);
        outgoing.replaceAll(e -> e == previous ? replacement : e);
    }

    void freeze() {
        if (!frozen) {
            incoming = List.copyOf(incoming);
            outgoing = List.copyOf(outgoing);
            frozen = true;
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Graph is frozen; node '" + id() + "' is read-only");
        }
    }

    @Override
    public String toString() {
        return kind().wireName() + ":" + id();
    }
}
