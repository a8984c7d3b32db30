package io.flowc.core.graph;

import java.util.List;
import java.util.function.Predicate;

/// Fixed classification table for edges.
///
/// Rules are keyed on (source kind, source port, target kind, target port) and evaluated in
/// order; the first match wins:
///
/// ```
/// #  match                                                        role
/// —  ———————————————————————————————————————————————————————————  ——————————
/// 1  source loop, source port "body"                              LOOP_BODY
/// 2  source teleporter-out, target teleporter-in                  TELEPORT
/// 3  source variable|custom, or target variable|custom            DATA
/// 4  target port instruction|tools|input_schema|output_schema|context  DATA
/// 5  source port *_callback                                       DATA
/// 6  source port condition | condition:<label>                    CONDITIONAL
/// 7  anything else                                                FLOW
/// ```
///
/// `LOOP_BODY` edges become {@link EdgeSemantics#SEQUENTIAL}. `FLOW` edges become
/// {@link EdgeSemantics#PARALLEL_BRANCH} when their source has more than one outgoing
/// conditional or flow edge, {@link EdgeSemantics#SEQUENTIAL} otherwise.
///
/// @implNote Stateless and thread-safe.
public final class EdgeClassifier {

    /// Intermediate role of an edge before fan-out is known.
    public enum Role {
        LOOP_BODY,
        TELEPORT,
        DATA,
        CONDITIONAL,
        FLOW;

        /// @return true for roles counted when deciding between sequential and parallel flow
        boolean countsForFanOut() {
            return this == CONDITIONAL || this == FLOW;
        }
    }

    /// The lookup key of an edge.
    ///
    /// @param sourceKind kind of the source node, not null
    /// @param sourcePort source port, may be null
    /// @param targetKind kind of the target node, not null
    /// @param targetPort target port, may be null
    public record EdgeKey(
            NodeKind sourceKind, String sourcePort, NodeKind targetKind, String targetPort) {}

    private record Rule(Predicate<EdgeKey> matches, Role role) {}

    private static final List<Rule> RULES =
            List.of(
                    new Rule(
                            k -> k.sourceKind() == NodeKind.LOOP
                                    && Ports.BODY.equals(k.sourcePort()),
                            Role.LOOP_BODY),
                    new Rule(
                            k -> k.sourceKind() == NodeKind.TELEPORTER_OUT
                                    && k.targetKind() == NodeKind.TELEPORTER_IN,
                            Role.TELEPORT),
                    new Rule(
                            k -> isConfigurationKind(k.sourceKind())
                                    || isConfigurationKind(k.targetKind()),
                            Role.DATA),
                    new Rule(k -> Ports.isConfigurationInput(k.targetPort()), Role.DATA),
                    new Rule(k -> Ports.isCallbackOutput(k.sourcePort()), Role.DATA),
                    new Rule(k -> Ports.isCondition(k.sourcePort()), Role.CONDITIONAL),
                    new Rule(k -> true, Role.FLOW));

    /// Looks up the role of an edge.
    ///
    /// @param key the edge key, not null
    /// @return the role of the first matching rule, never null
    public Role role(EdgeKey key) {
        for (Rule rule : RULES) {
            if (rule.matches().test(key)) {
                return rule.role();
            }
        }
        throw new IllegalStateException("Classification table has no fallback rule");
    }

    /// Turns a role into final semantics.
    ///
    /// @param role the edge role, not null
    /// @param fanOut number of edges with a fan-out role leaving the same source
    /// @return edge semantics, never null
    public EdgeSemantics semantics(Role role, int fanOut) {
        return switch (role) {
            case LOOP_BODY -> EdgeSemantics.SEQUENTIAL;
            case TELEPORT -> EdgeSemantics.TELEPORT;
            case DATA -> EdgeSemantics.DATA;
            case CONDITIONAL -> EdgeSemantics.CONDITIONAL;
            case FLOW -> fanOut > 1 ? EdgeSemantics.PARALLEL_BRANCH : EdgeSemantics.SEQUENTIAL;
        };
    }

    private static boolean isConfigurationKind(NodeKind kind) {
        return kind == NodeKind.VARIABLE || kind == NodeKind.CUSTOM;
    }
}
