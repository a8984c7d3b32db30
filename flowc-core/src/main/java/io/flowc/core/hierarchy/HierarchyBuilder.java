package io.flowc.core.hierarchy;

import io.flowc.core.exception.CompilationException;
import io.flowc.core.exception.ErrorLocation;
import io.flowc.core.graph.GraphEdge;
import io.flowc.core.graph.GraphNode;
import io.flowc.core.graph.LoopBody;
import io.flowc.core.graph.NodeKind;
import io.flowc.core.graph.WorkflowGraph;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Partitions a frozen {@link WorkflowGraph} into nested execution constructs.
///
/// ### Walk
/// Each region is walked from its entry nodes along forward control edges (loop body edges
/// and back edges excluded). Agent nodes become {@link HierarchyNode.Leaf leaves} and loop
/// markers become {@link HierarchyNode.Loop loops}; every other kind is passed through.
/// Consecutive elements form a {@link HierarchyNode.Sequence sequence}.
///
/// ### Forks
/// A node with several flow successors is a fork. Its branches run up to a join when one is
/// found, and the walk resumes at the join:
/// - candidate joins are the nodes every branch start reaches
/// - the join is the only candidate that no other candidate reaches
/// - each branch start has the fork as its only predecessor
/// - the branch regions (nodes a start reaches before the join) are pairwise disjoint and
///   closed under predecessors
/// - the join's predecessors all lie in branch regions, at least one per branch
///
/// Otherwise the branches are independent continuations. A node that a second path reaches is
/// then recorded as an {@link StructuralIssue#AMBIGUOUS_MERGE ambiguous merge}, unless it is an
/// `end` node or the revisit closes a cycle (cycles are reported by the validator).
///
/// ### Ordering
/// Branches and entries follow layout order (y, then x, then id), never declaration order.
///
/// @implNote Stateless and thread-safe; every call walks with its own state.
public final class HierarchyBuilder {

    private static final Logger logger = Logger.getLogger(HierarchyBuilder.class.getName());

    /// Builds the hierarchy of every region that has entry nodes.
    ///
    /// @param graph frozen graph, not null
    /// @return roots, loop bodies and structural issues, never null
    /// @throws CompilationException if the project has agents but no entry node at all
    public Hierarchy build(WorkflowGraph graph) throws CompilationException {
        if (graph.entryNodes().isEmpty()) {
            List<GraphNode> agents = graph.nodesOfKind(NodeKind.AGENT);
            if (!agents.isEmpty()) {
                GraphNode first = agents.get(0);
                throw new CompilationException(
                        "No entry node found: every one of the "
                                + agents.size()
                                + " agent nodes has an incoming control edge",
                        ErrorLocation.node(first.regionId(), first.id()));
            }
        }

        Map<String, List<GraphNode>> entriesByRegion = new LinkedHashMap<>();
        for (GraphNode entry : graph.entryNodes()) {
            entriesByRegion.computeIfAbsent(entry.regionId(), k -> new ArrayList<>()).add(entry);
        }

        Walk walk = new Walk(graph);
        Map<String, HierarchyNode> roots = new LinkedHashMap<>();
        entriesByRegion.forEach(
                (regionId, entries) -> {
                    HierarchyNode root = walk.region(regionId, entries);
                    if (root != null) {
                        roots.put(regionId, root);
                    }
                });

        Hierarchy hierarchy = new Hierarchy(roots, walk.loopBodies, walk.issues);
        logger.fine(
                () ->
                        "Built hierarchy: "
                                + roots.size()
                                + " roots, "
                                + hierarchy.leafIds().size()
                                + " leaves, "
                                + walk.issues.size()
                                + " structural issues");
        return hierarchy;
    }

    /// Wraps elements: none gives null, one is returned as is, more form a sequence.
    static HierarchyNode wrap(List<HierarchyNode> elements) {
        if (elements.isEmpty()) {
            return null;
        }
        if (elements.size() == 1) {
            return elements.get(0);
        }
        return new HierarchyNode.Sequence(elements.get(0).anchorId(), elements, null);
    }

    private record Fork(List<HierarchyNode> elements, String joinId) {}

    /// Mutable state of one build call.
    private static final class Walk {
        private final WorkflowGraph graph;
        private final Set<String> consumed = new HashSet<>();
        private final Map<String, Set<String>> loopBodies = new LinkedHashMap<>();
        private final List<StructuralIssue> issues = new ArrayList<>();

        Walk(WorkflowGraph graph) {
            this.graph = graph;
        }

        HierarchyNode region(String regionId, List<GraphNode> entries) {
            if (entries.size() == 1) {
                return wrap(chain(entries.get(0).id(), null, null, null));
            }
            Fork fork = fork(null, regionId, entries, null);
            List<HierarchyNode> elements = new ArrayList<>(fork.elements());
            if (fork.joinId() != null) {
                elements.addAll(chain(fork.joinId(), null, null, null));
            }
            return wrap(elements);
        }

        /// Walks from `startId` until the flow ends, reaches `stopId`, or hits a claimed node.
        private List<HierarchyNode> chain(
                String startId, String stopId, String previousId, String condition) {
            List<HierarchyNode> elements = new ArrayList<>();
            String pending = condition;
            String current = startId;
            String previous = previousId;

            while (current != null && !current.equals(stopId) && claim(current, previous)) {
                GraphNode node = graph.get(current);
                HierarchyNode produced = null;
                if (node.kind() == NodeKind.AGENT) {
                    produced = HierarchyNode.Leaf.of(node.id());
                } else if (node.kind() == NodeKind.LOOP) {
                    produced = loop(node);
                }
                if (produced != null) {
                    if (pending != null) {
                        produced = produced.withCondition(pending);
                        pending = null;
                    }
                    elements.add(produced);
                }

                List<GraphNode> next = graph.flowSuccessors(current);
                if (next.isEmpty()) {
                    break;
                }
                if (next.size() == 1) {
                    String label = edgeCondition(current, next.get(0).id());
                    if (label != null) {
                        pending = label;
                    }
                    previous = current;
                    current = next.get(0).id();
                    continue;
                }

                Fork fork = fork(current, current, next, stopId);
                List<HierarchyNode> forked = new ArrayList<>(fork.elements());
                if (pending != null && !forked.isEmpty()) {
                    forked.set(0, forked.get(0).withCondition(pending));
                    pending = null;
                }
                elements.addAll(forked);
                previous = current;
                current = fork.joinId();
            }
            return elements;
        }

        /// Claims a node for the tree; false if another path already did.
        private boolean claim(String nodeId, String previousId) {
            if (consumed.add(nodeId)) {
                return true;
            }
            GraphNode node = graph.get(nodeId);
            if (node.kind() == NodeKind.END) {
                return false;
            }
            if (previousId != null && reach(nodeId, null).contains(previousId)) {
                return false;
            }
            issues.add(
                    new StructuralIssue(
                            StructuralIssue.AMBIGUOUS_MERGE,
                            "Node '"
                                    + node.displayName()
                                    + "' is reached by several paths that do not form a"
                                    + " fork/join pair"
                                    + (previousId != null ? " (again from '" + previousId + "')" : ""),
                            node.regionId(),
                            nodeId));
            return false;
        }

        private Fork fork(String forkId, String anchorId, List<GraphNode> starts, String stopId) {
            List<String> startIds = starts.stream().map(GraphNode::id).toList();
            String joinId = findJoin(forkId, startIds, stopId);
            String branchStop = joinId != null ? joinId : stopId;

            List<HierarchyNode> branches = new ArrayList<>();
            for (String startId : startIds) {
                String label = forkId != null ? edgeCondition(forkId, startId) : null;
                HierarchyNode branch = wrap(chain(startId, branchStop, forkId, null));
                if (branch != null) {
                    branches.add(label != null ? branch.withCondition(label) : branch);
                }
            }

            logger.fine(
                    () ->
                            "Fork at '"
                                    + anchorId
                                    + "' over "
                                    + startIds
                                    + (joinId != null ? " joins at '" + joinId + "'" : " has no join"));
            if (branches.size() < 2) {
                return new Fork(inline(branches), joinId);
            }
            return new Fork(
                    List.of(new HierarchyNode.Parallel(anchorId, branches, null)), joinId);
        }

        /// Unpacks a lone branch so its elements join the enclosing chain directly.
        private static List<HierarchyNode> inline(List<HierarchyNode> branches) {
            if (branches.isEmpty() || !(branches.get(0) instanceof HierarchyNode.Sequence seq)) {
                return branches;
            }
            List<HierarchyNode> children = new ArrayList<>(seq.children());
            if (seq.condition() != null) {
                children.set(0, children.get(0).withCondition(seq.condition()));
            }
            return children;
        }

        /// Returns the join of a fork, or null if the branches do not reconverge exclusively.
        private String findJoin(String forkId, List<String> startIds, String stopId) {
            List<Set<String>> reached = new ArrayList<>();
            for (String startId : startIds) {
                reached.add(reach(startId, stopId));
            }
            Set<String> candidates = new LinkedHashSet<>(reached.get(0));
            reached.forEach(candidates::retainAll);

            List<String> minimal = new ArrayList<>();
            for (String candidate : candidates) {
                boolean dominated = false;
                for (String other : candidates) {
                    if (!other.equals(candidate) && reach(other, stopId).contains(candidate)) {
                        dominated = true;
                        break;
                    }
                }
                if (!dominated) {
                    minimal.add(candidate);
                }
            }
            if (minimal.size() != 1) {
                return null;
            }
            String joinId = minimal.get(0);
            return isExclusiveJoin(forkId, startIds, joinId, stopId) ? joinId : null;
        }

        private boolean isExclusiveJoin(
                String forkId, List<String> startIds, String joinId, String stopId) {
            Set<String> expected = forkId != null ? Set.of(forkId) : Set.of();
            Set<String> union = new HashSet<>();
            List<Set<String>> regions = new ArrayList<>();

            for (String startId : startIds) {
                if (startId.equals(joinId) || !graph.forwardPredecessors(startId).equals(expected)) {
                    return false;
                }
                Set<String> region = reachAvoiding(startId, joinId, stopId);
                for (String member : region) {
                    if (!union.add(member)) {
                        return false;
                    }
                    if (!member.equals(startId)
                            && !region.containsAll(graph.forwardPredecessors(member))) {
                        return false;
                    }
                }
                regions.add(region);
            }

            Set<String> joinPredecessors = graph.forwardPredecessors(joinId);
            if (!union.containsAll(joinPredecessors)) {
                return false;
            }
            for (Set<String> region : regions) {
                if (region.stream().noneMatch(joinPredecessors::contains)) {
                    return false;
                }
            }
            return true;
        }

        private HierarchyNode loop(GraphNode marker) {
            LoopBody body =
                    graph.loopBody(marker.id())
                            .orElseThrow(
                                    () ->
                                            new IllegalStateException(
                                                    "Loop marker without body analysis: "
                                                            + marker.id()));
            String name = marker.displayName();
            if (body.bodyEdges().isEmpty()) {
                loopIssue(marker, "Loop '" + name + "' has no body edge");
            } else if (body.bodyEdges().size() > 1) {
                loopIssue(
                        marker,
                        "Loop '"
                                + name
                                + "' has "
                                + body.bodyEdges().size()
                                + " body edges "
                                + body.bodyEdges()
                                + ", expected one");
            } else {
                if (!body.members().contains(body.startId())) {
                    loopIssue(marker, "Body of loop '" + name + "' never returns to the marker");
                }
                if (!body.escapes().isEmpty()) {
                    loopIssue(
                            marker,
                            "Body of loop '"
                                    + name
                                    + "' leaves the loop through "
                                    + body.escapes().stream()
                                            .sorted()
                                            .collect(Collectors.joining(", ", "[", "]")));
                }
            }

            List<HierarchyNode> elements =
                    body.bodyEdges().size() == 1
                            ? chain(body.startId(), marker.id(), marker.id(), null)
                            : List.of();
            if (body.isWellFormed()) {
                loopBodies.put(marker.id(), body.members());
            }
            return new HierarchyNode.Loop(marker.id(), elements, null);
        }

        private void loopIssue(GraphNode marker, String message) {
            issues.add(
                    new StructuralIssue(
                            StructuralIssue.LOOP_BODY, message, marker.regionId(), marker.id()));
        }

        private String edgeCondition(String sourceId, String targetId) {
            return graph.forwardEdge(sourceId, targetId).map(GraphEdge::condition).orElse(null);
        }

        /// Nodes reachable from `startId` over flow edges; `barrierId` is included but not
        /// expanded.
        private Set<String> reach(String startId, String barrierId) {
            Set<String> seen = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            seen.add(startId);
            queue.add(startId);
            while (!queue.isEmpty()) {
                String id = queue.poll();
                if (id.equals(barrierId)) {
                    continue;
                }
                for (GraphNode next : graph.flowSuccessors(id)) {
                    if (seen.add(next.id())) {
                        queue.add(next.id());
                    }
                }
            }
            return seen;
        }

        /// Nodes reachable from `startId` without entering `joinId` or `stopId`.
        private Set<String> reachAvoiding(String startId, String joinId, String stopId) {
            Set<String> seen = new LinkedHashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            seen.add(startId);
            queue.add(startId);
            while (!queue.isEmpty()) {
                for (GraphNode next : graph.flowSuccessors(queue.poll())) {
                    String id = next.id();
                    if (!id.equals(joinId) && !id.equals(stopId) && seen.add(id)) {
                        queue.add(id);
                    }
                }
            }
            return seen;
        }
    }
}
