package io.flowc.core.graph;

import java.util.Objects;

/// A teleporter-out and teleporter-in joined by their shared channel.
///
/// @param outNodeId teleporter-out node id, not null
/// @param inNodeId teleporter-in node id, not null
/// @param channel shared channel name, not null
public record TeleporterPair(String outNodeId, String inNodeId, String channel) {

    public TeleporterPair {
        Objects.requireNonNull(outNodeId, "outNodeId must not be null");
        Objects.requireNonNull(inNodeId, "inNodeId must not be null");
        Objects.requireNonNull(channel, "channel must not be null");
    }
}
