package io.flowc.core.graph;

import java.util.Objects;

/// An edge with normalized ports (blank ports become null).
///
/// @param id edge id, not null
/// @param sourceId source node id, not null
/// @param sourcePort port on the source node, may be null
/// @param targetId target node id, not null
/// @param targetPort port on the target node, may be null
/// @param regionId region the edge was declared in, not null
public record ParsedEdge(
        String id,
        String sourceId,
        String sourcePort,
        String targetId,
        String targetPort,
        String regionId) {

    public ParsedEdge {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(targetId, "targetId must not be null");
        Objects.requireNonNull(regionId, "regionId must not be null");
        sourcePort = sourcePort == null || sourcePort.isBlank() ? null : sourcePort;
        targetPort = targetPort == null || targetPort.isBlank() ? null : targetPort;
    }
}
