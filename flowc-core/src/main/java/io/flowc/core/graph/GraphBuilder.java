package io.flowc.core.graph;

import io.flowc.core.exception.CompilationException;
import io.flowc.core.exception.ErrorLocation;
import io.flowc.core.exception.TeleporterException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Assembles a frozen {@link WorkflowGraph} from parsed nodes and edges.
///
/// ### Steps
/// 1. Index nodes; reject edges with a dangling endpoint.
/// 2. Classify every edge through the {@link EdgeClassifier} table.
/// 3. Pair teleporters by channel across the whole project and add one `TELEPORT` edge per
///    pair unless one was drawn.
/// 4. Analyse every loop marker's body and mark the edges returning into the marker as back
///    edges.
/// 5. Collect entry nodes: agent, start, loop and triggering user-input nodes with no incoming
///    forward control edge.
/// 6. Freeze.
///
/// @implNote Stateless and thread-safe; every call builds a new graph.
public final class GraphBuilder {

    private static final Logger logger = Logger.getLogger(GraphBuilder.class.getName());

    private final EdgeClassifier classifier;

    public GraphBuilder() {
        this(new EdgeClassifier());
    }

    public GraphBuilder(EdgeClassifier classifier) {
        this.classifier = classifier;
    }

    /// Builds the graph.
    ///
    /// @param parsed parsed nodes and edges, not null
    /// @return frozen graph, never null
    /// @throws CompilationException if an edge references an unknown node
    /// @throws TeleporterException if a channel does not pair exactly one out with one in node
    public WorkflowGraph build(ParsedProject parsed) throws CompilationException {
        WorkflowGraph graph = new WorkflowGraph();
        for (ParsedNode node : parsed.nodes()) {
            graph.addNode(new GraphNode(node));
        }

        classifyEdges(graph, parsed.edges());
        resolveTeleporters(graph);
        analyseLoops(graph);
        collectEntryNodes(graph, regionOrder(parsed));
        graph.freeze();

        logger.fine(
                () ->
                        "Built graph: "
                                + graph.nodes().size()
                                + " nodes, "
                                + graph.edges().size()
                                + " edges, "
                                + graph.teleporterPairs().size()
                                + " teleporter pairs, entries "
                                + graph.entryNodes().stream()
                                        .map(GraphNode::id)
                                        .collect(Collectors.toList()));
        return graph;
    }

    private void classifyEdges(WorkflowGraph graph, List<ParsedEdge> edges)
            throws CompilationException {
        List<EdgeClassifier.Role> roles = new ArrayList<>();
        Map<String, Integer> fanOut = new HashMap<>();

        for (ParsedEdge edge : edges) {
            GraphNode source = endpoint(graph, edge, edge.sourceId(), "source");
            GraphNode target = endpoint(graph, edge, edge.targetId(), "target");
            EdgeClassifier.Role role =
                    classifier.role(
                            new EdgeClassifier.EdgeKey(
                                    source.kind(),
                                    edge.sourcePort(),
                                    target.kind(),
                                    edge.targetPort()));
            if (role == EdgeClassifier.Role.TELEPORT) {
                checkDrawnTeleport(edge, source, target);
            }
            roles.add(role);
            if (role.countsForFanOut()) {
                fanOut.merge(edge.sourceId(), 1, Integer::sum);
            }
        }

        for (int i = 0; i < edges.size(); i++) {
            ParsedEdge edge = edges.get(i);
            EdgeClassifier.Role role = roles.get(i);
            EdgeSemantics semantics =
                    classifier.semantics(role, fanOut.getOrDefault(edge.sourceId(), 0));
            String condition =
                    semantics == EdgeSemantics.CONDITIONAL
                            ? Ports.conditionLabel(edge.sourcePort())
                            : null;
            graph.addEdge(
                    new GraphEdge(
                            edge.id(),
                            edge.sourceId(),
                            edge.targetId(),
                            edge.sourcePort(),
                            edge.targetPort(),
                            semantics,
                            condition,
                            role == EdgeClassifier.Role.LOOP_BODY,
                            false));
        }
    }

    private static GraphNode endpoint(
            WorkflowGraph graph, ParsedEdge edge, String nodeId, String side)
            throws CompilationException {
        return graph.find(nodeId)
                .orElseThrow(
                        () ->
                                new CompilationException(
                                        "Edge '"
                                                + edge.id()
                                                + "' references unknown "
                                                + side
                                                + " node '"
                                                + nodeId
                                                + "'",
                                        ErrorLocation.node(edge.regionId(), nodeId)));
    }

    private static void checkDrawnTeleport(ParsedEdge edge, GraphNode source, GraphNode target)
            throws TeleporterException {
        String out = channel(source);
        String in = channel(target);
        if (!out.equals(in)) {
            throw new TeleporterException(
                    "Edge '"
                            + edge.id()
                            + "' connects teleporter channel '"
                            + out
                            + "' to channel '"
                            + in
                            + "'",
                    out,
                    ErrorLocation.node(edge.regionId(), source.id()));
        }
    }

    private static void resolveTeleporters(WorkflowGraph graph) throws TeleporterException {
        Map<String, List<GraphNode>> outs = new TreeMap<>();
        Map<String, List<GraphNode>> ins = new TreeMap<>();
        for (GraphNode node : graph.nodes()) {
            if (node.kind() == NodeKind.TELEPORTER_OUT) {
                outs.computeIfAbsent(channel(node), k -> new ArrayList<>()).add(node);
            } else if (node.kind() == NodeKind.TELEPORTER_IN) {
                ins.computeIfAbsent(channel(node), k -> new ArrayList<>()).add(node);
            }
        }

        Set<String> channels = new TreeSet<>(outs.keySet());
        channels.addAll(ins.keySet());
        for (String channel : channels) {
            List<GraphNode> out = outs.getOrDefault(channel, List.of());
            List<GraphNode> in = ins.getOrDefault(channel, List.of());
            if (out.size() != 1 || in.size() != 1) {
                GraphNode first = !out.isEmpty() ? out.get(0) : in.get(0);
                throw new TeleporterException(
                        "Teleporter channel '"
                                + channel
                                + "' must pair exactly one teleporter-out with one teleporter-in,"
                                + " found "
                                + out.size()
                                + " out "
                                + ids(out)
                                + " and "
                                + in.size()
                                + " in "
                                + ids(in),
                        channel,
                        ErrorLocation.node(first.regionId(), first.id()));
            }

            GraphNode source = out.get(0);
            GraphNode target = in.get(0);
            graph.addTeleporterPair(new TeleporterPair(source.id(), target.id(), channel));
            boolean drawn =
                    source.outgoing().stream()
                            .anyMatch(
                                    e -> e.semantics() == EdgeSemantics.TELEPORT
                                            && e.targetId().equals(target.id()));
            if (!drawn) {
                graph.addEdge(
                        new GraphEdge(
                                "teleport:" + channel,
                                source.id(),
                                target.id(),
                                null,
                                null,
                                EdgeSemantics.TELEPORT,
                                null,
                                false,
                                false));
            }
        }
    }

    private static void analyseLoops(WorkflowGraph graph) {
        for (GraphNode marker : graph.nodesOfKind(NodeKind.LOOP)) {
            List<GraphEdge> bodyEdges =
                    marker.outgoing().stream().filter(GraphEdge::loopBody).toList();
            List<String> bodyEdgeIds = bodyEdges.stream().map(GraphEdge::id).toList();
            if (bodyEdges.size() != 1) {
                graph.putLoopBody(
                        new LoopBody(marker.id(), bodyEdgeIds, null, Set.of(), Set.of()));
                continue;
            }

            String startId = bodyEdges.get(0).targetId();
            Set<String> forward = reachableAvoiding(graph, startId, marker.id());
            Set<String> returning = reachingAvoiding(graph, marker.id());
            Set<String> members = new LinkedHashSet<>(forward);
            members.retainAll(returning);
            Set<String> escapes = new LinkedHashSet<>(forward);
            escapes.removeAll(members);
            graph.putLoopBody(new LoopBody(marker.id(), bodyEdgeIds, startId, members, escapes));

            for (GraphEdge edge : List.copyOf(marker.incoming())) {
                if (edge.isControl() && members.contains(edge.sourceId())) {
                    graph.replaceEdge(edge, edge.asBackEdge());
                }
            }
        }
    }

    /// Nodes reachable from `startId` over control edges without entering `avoidId`.
    private static Set<String> reachableAvoiding(
            WorkflowGraph graph, String startId, String avoidId) {
        Set<String> seen = new LinkedHashSet<>();
        if (startId.equals(avoidId)) {
            return seen;
        }
        Deque<String> queue = new ArrayDeque<>();
        queue.add(startId);
        seen.add(startId);
        while (!queue.isEmpty()) {
            for (GraphEdge edge : graph.get(queue.poll()).outgoing()) {
                String next = edge.targetId();
                if (edge.isControl() && !next.equals(avoidId) && seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return seen;
    }

    /// Nodes that reach `targetId` over control edges without passing through it.
    private static Set<String> reachingAvoiding(WorkflowGraph graph, String targetId) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(targetId);
        while (!queue.isEmpty()) {
            for (GraphEdge edge : graph.get(queue.poll()).incoming()) {
                String previous = edge.sourceId();
                if (edge.isControl() && !previous.equals(targetId) && seen.add(previous)) {
                    queue.add(previous);
                }
            }
        }
        return seen;
    }

    private static void collectEntryNodes(WorkflowGraph graph, List<String> regionOrder) {
        Map<String, List<GraphNode>> byRegion = new LinkedHashMap<>();
        regionOrder.forEach(r -> byRegion.put(r, new ArrayList<>()));
        for (GraphNode node : graph.nodes()) {
            if (isEntryKind(node) && graph.forwardPredecessors(node.id()).isEmpty()) {
                byRegion.get(node.regionId()).add(node);
            }
        }
        for (List<GraphNode> entries : byRegion.values()) {
            entries.sort((a, b) -> ParsedNode.LAYOUT_ORDER.compare(a.parsed(), b.parsed()));
            entries.forEach(graph::addEntryNode);
        }
    }

    private static boolean isEntryKind(GraphNode node) {
        return switch (node.kind()) {
            case AGENT, START, LOOP -> true;
            case USER_INPUT -> ((NodePayload.UserInput) node.payload()).trigger();
            case END,
                    PARALLEL_JOIN,
                    TELEPORTER_OUT,
                    TELEPORTER_IN,
                    VARIABLE,
                    CUSTOM -> false;
        };
    }

    private static List<String> regionOrder(ParsedProject parsed) {
        Set<String> order = new LinkedHashSet<>();
        parsed.nodes().forEach(n -> order.add(n.regionId()));
        return List.copyOf(order);
    }

    private static String channel(GraphNode node) {
        return ((NodePayload.Teleporter) node.payload()).channel();
    }

    private static String ids(List<GraphNode> nodes) {
        return nodes.stream().map(GraphNode::id).collect(Collectors.joining(", ", "[", "]"));
    }
}
