package io.flowc.core.graph;

import java.util.List;

/// Output of {@link FlowParser}: every node and edge of a project.
///
/// @param nodes parsed nodes in region then declaration order, not null
/// @param edges parsed edges in region then declaration order, not null
public record ParsedProject(List<ParsedNode> nodes, List<ParsedEdge> edges) {

    public ParsedProject {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }
}
