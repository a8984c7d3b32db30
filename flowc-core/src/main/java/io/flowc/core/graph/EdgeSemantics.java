package io.flowc.core.graph;

/// Meaning of a connection, derived by {@link EdgeClassifier}.
public enum EdgeSemantics {
    /// Ordered control flow from one node to the next.
    SEQUENTIAL,
    /// One of several control edges leaving the same node.
    PARALLEL_BRANCH,
    /// Control flow gated by a labelled condition.
    CONDITIONAL,
    /// Configuration flowing into or out of an agent; never control flow.
    DATA,
    /// Virtual control flow between a paired teleporter-out and teleporter-in.
    TELEPORT;

    /// @return true for every semantics except {@link #DATA}
    public boolean isControl() {
        return this != DATA;
    }
}
