package io.flowc.core.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/// Flat, classified project graph produced by {@link GraphBuilder}.
///
/// Holds every node of every region keyed by its project-wide unique id, the classified edges
/// (including synthesized teleport edges), the teleporter pairs, the entry nodes and the body
/// analysis of each loop marker.
///
/// ### Lifecycle
/// Built once per compile call. The builder mutates it only while classifying edges and
/// resolving teleporters and then calls {@link #freeze()}; every later stage only reads.
///
/// ### Ordering
/// Successor lists are sorted by {@link ParsedNode#LAYOUT_ORDER}, so traversal never depends
/// on declaration order.
public final class WorkflowGraph {

    private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final List<TeleporterPair> teleporterPairs = new ArrayList<>();
    private final List<GraphNode> entryNodes = new ArrayList<>();
    private final Map<String, LoopBody> loopBodies = new LinkedHashMap<>();
    private boolean frozen;

    WorkflowGraph() {}

    /// @return all nodes in parse order, never null
    public Collection<GraphNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /// @param id node id, not null
    /// @return the node, empty if unknown
    public Optional<GraphNode> find(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /// @param id node id of a node known to exist, not null
    /// @return the node, never null
    /// @throws IllegalArgumentException if no node has this id
    public GraphNode get(String id) {
        GraphNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node id: " + id);
        }
        return node;
    }

    /// @return every edge, including synthesized teleport edges, never null
    public List<GraphEdge> edges() {
        return Collections.unmodifiableList(edges);
    }

    /// @return teleporter pairs ordered by channel, never null
    public List<TeleporterPair> teleporterPairs() {
        return Collections.unmodifiableList(teleporterPairs);
    }

    /// @return entry nodes in region order, then layout order, never null
    public List<GraphNode> entryNodes() {
        return Collections.unmodifiableList(entryNodes);
    }

    /// @return entry nodes of one region in layout order, never null
    public List<GraphNode> entryNodes(String regionId) {
        return entryNodes.stream().filter(n -> n.regionId().equals(regionId)).toList();
    }

    /// @return loop body analysis keyed by marker id, never null
    public Map<String, LoopBody> loopBodies() {
        return Collections.unmodifiableMap(loopBodies);
    }

    /// @param markerId loop marker id, not null
    /// @return body analysis, empty if `markerId` is not a loop marker
    public Optional<LoopBody> loopBody(String markerId) {
        return Optional.ofNullable(loopBodies.get(markerId));
    }

    /// @param kind node kind, not null
    /// @return nodes of the kind in parse order, never null
    public List<GraphNode> nodesOfKind(NodeKind kind) {
        return nodes.values().stream().filter(n -> n.kind() == kind).toList();
    }

    /// Returns distinct forward control successors (back edges excluded) in layout order.
    ///
    /// @param id node id, not null
    /// @return successors, never null
    public List<GraphNode> forwardSuccessors(String id) {
        return successors(id, GraphEdge::isForwardControl);
    }

    /// Returns the successors that continue the flow after a node: forward control edges other
    /// than a loop marker's body edge, in layout order.
    ///
    /// @param id node id, not null
    /// @return successors, never null
    public List<GraphNode> flowSuccessors(String id) {
        return successors(id, e -> e.isForwardControl() && !e.loopBody());
    }

    /// Returns distinct control successors including loop back edges, in layout order.
    ///
    /// @param id node id, not null
    /// @return successors, never null
    public List<GraphNode> controlSuccessors(String id) {
        return successors(id, GraphEdge::isControl);
    }

    /// Returns distinct sources of incoming forward control edges.
    ///
    /// @param id node id, not null
    /// @return predecessor ids in insertion order, never null
    public Set<String> forwardPredecessors(String id) {
        Set<String> result = new LinkedHashSet<>();
        for (GraphEdge edge : get(id).incoming()) {
            if (edge.isForwardControl()) {
                result.add(edge.sourceId());
            }
        }
        return result;
    }

    /// Returns the forward control edge between two nodes, if any.
    ///
    /// @param sourceId source node id, not null
    /// @param targetId target node id, not null
    /// @return first matching edge, empty if none
    public Optional<GraphEdge> forwardEdge(String sourceId, String targetId) {
        return get(sourceId).outgoing().stream()
                .filter(e -> e.isForwardControl() && e.targetId().equals(targetId))
                .findFirst();
    }

    /// @return true once the builder has finished
    public boolean isFrozen() {
        return frozen;
    }

    private List<GraphNode> successors(String id, Predicate<GraphEdge> filter) {
        Set<String> seen = new LinkedHashSet<>();
        List<GraphNode> result = new ArrayList<>();
        for (GraphEdge edge : get(id).outgoing()) {
            if (filter.test(edge) && seen.add(edge.targetId())) {
                result.add(get(edge.targetId()));
            }
        }
        result.sort((a, b) -> ParsedNode.LAYOUT_ORDER.compare(a.parsed(), b.parsed()));
        return result;
    }

    void addNode(GraphNode node) {
        checkMutable();
        nodes.put(node.id(), node);
    }

    void addEdge(GraphEdge edge) {
        checkMutable();
        edges.add(edge);
        nodes.get(edge.sourceId()).addOutgoing(edge);
        nodes.get(edge.targetId()).addIncoming(edge);
    }

    void replaceEdge(GraphEdge previous, GraphEdge replacement) {
        checkMutable();
        edges.replaceAll(e -> e == previous ? replacement : e);
        nodes.get(previous.sourceId()).replaceEdge(previous, replacement);
        nodes.get(previous.targetId()).replaceEdge(previous, replacement);
    }

    void addTeleporterPair(TeleporterPair pair) {
        checkMutable();
        teleporterPairs.add(pair);
    }

    void addEntryNode(GraphNode node) {
        checkMutable();
        entryNodes.add(node);
    }

    void putLoopBody(LoopBody body) {
        checkMutable();
        loopBodies.put(body.markerId(), body);
    }

    void freeze() {
        nodes.values().forEach(GraphNode::freeze);
        frozen = true;
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("WorkflowGraph is frozen");
        }
    }
}
