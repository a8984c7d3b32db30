package io.flowc.core.graph;

import java.util.Comparator;

/// Layout position of a node. Carries no semantics; only used to order siblings.
///
/// @param x horizontal coordinate
/// @param y vertical coordinate
public record Position(double x, double y) {

    /// Orders by `y`, then `x`.
    public static final Comparator<Position> LAYOUT_ORDER =
            Comparator.comparingDouble(Position::y).thenComparingDouble(Position::x);
}
