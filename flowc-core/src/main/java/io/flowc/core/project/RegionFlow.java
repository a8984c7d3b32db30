package io.flowc.core.project;

import java.util.List;
import java.util.Objects;

/// One independently authored sub-graph (tab) of a project.
///
/// @param id region id, unique within the project, not null
/// @param name display name, not null
/// @param order position among the project's regions
/// @param nodes node records in declaration order, not null
/// @param edges edge records in declaration order, not null
public record RegionFlow(
        String id, String name, int order, List<RawNode> nodes, List<RawEdge> edges) {

    public RegionFlow {
        Objects.requireNonNull(id, "id must not be null");
        name = name != null ? name : id;
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }
}
