package io.flowc.core.graph;

import java.util.Comparator;
import java.util.Objects;

/// A node whose kind and payload have been validated.
///
/// @param id project-wide unique id, not null
/// @param kind node kind, not null
/// @param position layout position, not null
/// @param payload kind-specific configuration matching `kind`, not null
/// @param regionId owning region, not null
public record ParsedNode(
        String id, NodeKind kind, Position position, NodePayload payload, String regionId) {

    /// Deterministic sibling order: layout position, then id.
    public static final Comparator<ParsedNode> LAYOUT_ORDER =
            Comparator.comparing(ParsedNode::position, Position.LAYOUT_ORDER)
                    .thenComparing(ParsedNode::id);

    public ParsedNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(regionId, "regionId must not be null");
    }

    /// Returns the payload's display name, falling back to the id.
    ///
    /// @return name, never null
    public String displayName() {
        String name = payload.name();
        return name != null && !name.isBlank() ? name : id;
    }
}
