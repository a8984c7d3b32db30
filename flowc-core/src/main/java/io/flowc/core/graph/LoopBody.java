package io.flowc.core.graph;

import java.util.List;
import java.util.Set;

/// Body analysis of one loop marker, computed while building the graph.
///
/// The body is the set of nodes that are reachable from the body-port target without passing
/// through the marker and that can reach the marker again. Nodes reachable from the body start
/// that never return are reported as escapes.
///
/// @param markerId loop marker id, not null
/// @param bodyEdges ids of the edges leaving the marker's body port, not null
/// @param startId target of the single body edge, null unless exactly one body edge exists
/// @param members body node ids (marker excluded), not null
/// @param escapes nodes reachable from the body start that cannot return to the marker, not null
public record LoopBody(
        String markerId,
        List<String> bodyEdges,
        String startId,
        Set<String> members,
        Set<String> escapes) {

    public LoopBody {
        bodyEdges = List.copyOf(bodyEdges);
        members = Set.copyOf(members);
        escapes = Set.copyOf(escapes);
    }

    /// @return true if there is one body edge, the body closes back onto the marker, and
    ///     nothing leaves the body
    public boolean isWellFormed() {
        return bodyEdges.size() == 1 && members.contains(startId) && escapes.isEmpty();
    }
}
