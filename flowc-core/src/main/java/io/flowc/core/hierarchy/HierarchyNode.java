package io.flowc.core.hierarchy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A node of the nested execution tree built by {@link HierarchyBuilder}.
///
/// Leaves reference agent nodes of the graph; composites own their children exclusively, so
/// the tree never shares a node between two parents.
///
/// ### Permitted Implementations
/// - {@link Leaf} - one agent node
/// - {@link Sequence} - children run in order
/// - {@link Parallel} - branches run concurrently, ordered by layout
/// - {@link Loop} - body elements repeat until the runtime stops the loop
public sealed interface HierarchyNode {

    /// Graph node that started this construct: the agent of a leaf, the first element of a
    /// sequence, the fork node (or region id for several entries) of a parallel group, the
    /// marker of a loop.
    ///
    /// @return anchor id, never null
    String anchorId();

    /// Label of the conditional edge this construct was entered through.
    ///
    /// @return label, null for unconditional flow
    String condition();

    /// @param label condition label, may be null
    /// @return copy carrying the label, never null
    HierarchyNode withCondition(String label);

    /// Collects the agent node ids of all leaves in depth-first order.
    ///
    /// @return leaf ids, never null
    default List<String> leafIds() {
        List<String> ids = new ArrayList<>();
        collectLeaves(this, ids);
        return ids;
    }

    private static void collectLeaves(HierarchyNode node, List<String> ids) {
        if (node instanceof Leaf leaf) {
            ids.add(leaf.nodeId());
        } else if (node instanceof Sequence sequence) {
            sequence.children().forEach(c -> collectLeaves(c, ids));
        } else if (node instanceof Parallel parallel) {
            parallel.branches().forEach(b -> collectLeaves(b, ids));
        } else if (node instanceof Loop loop) {
            loop.body().forEach(b -> collectLeaves(b, ids));
        }
    }

    /// An agent node.
    ///
    /// @param nodeId agent node id, not null
    /// @param condition entry condition label, may be null
    record Leaf(String nodeId, String condition) implements HierarchyNode {

        public Leaf {
            Objects.requireNonNull(nodeId, "nodeId must not be null");
        }

        public static Leaf of(String nodeId) {
            return new Leaf(nodeId, null);
        }

        @Override
        public String anchorId() {
            return nodeId;
        }

        @Override
        public Leaf withCondition(String label) {
            return new Leaf(nodeId, label);
        }
    }

    /// Ordered chain of at least two elements.
    ///
    /// @param anchorId anchor of the first element, not null
    /// @param children elements in execution order, not null
    /// @param condition entry condition label, may be null
    record Sequence(String anchorId, List<HierarchyNode> children, String condition)
            implements HierarchyNode {

        public Sequence {
            Objects.requireNonNull(anchorId, "anchorId must not be null");
            children = List.copyOf(children);
        }

        @Override
        public Sequence withCondition(String label) {
            return new Sequence(anchorId, children, label);
        }
    }

    /// Concurrent branches of a fork.
    ///
    /// @param anchorId fork node id, or the region id for a region with several entries
    /// @param branches branch constructs in layout order, not null
    /// @param condition entry condition label, may be null
    record Parallel(String anchorId, List<HierarchyNode> branches, String condition)
            implements HierarchyNode {

        public Parallel {
            Objects.requireNonNull(anchorId, "anchorId must not be null");
            branches = List.copyOf(branches);
        }

        @Override
        public Parallel withCondition(String label) {
            return new Parallel(anchorId, branches, label);
        }
    }

    /// A loop marker and its body.
    ///
    /// @param markerId loop marker node id, not null
    /// @param body body elements in execution order, not null (may be empty)
    /// @param condition entry condition label, may be null
    record Loop(String markerId, List<HierarchyNode> body, String condition)
            implements HierarchyNode {

        public Loop {
            Objects.requireNonNull(markerId, "markerId must not be null");
            body = List.copyOf(body);
        }

        @Override
        public String anchorId() {
            return markerId;
        }

        @Override
        public Loop withCondition(String label) {
            return new Loop(markerId, body, label);
        }
    }
}
