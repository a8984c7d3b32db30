package io.flowc.core.ir;

import java.util.Objects;

/// A resolved cross-region connection.
///
/// @param channel pairing key, not null
/// @param outNodeId teleporter-out node, not null
/// @param inNodeId teleporter-in node, not null
/// @param outRegion region of the out node, not null
/// @param inRegion region of the in node, not null
public record TeleporterIR(
        String channel, String outNodeId, String inNodeId, String outRegion, String inRegion) {

    public TeleporterIR {
        Objects.requireNonNull(channel, "channel must not be null");
        Objects.requireNonNull(outNodeId, "outNodeId must not be null");
        Objects.requireNonNull(inNodeId, "inNodeId must not be null");
    }

    /// @return true if the connection leaves its region
    public boolean crossesRegions() {
        return !Objects.equals(outRegion, inRegion);
    }
}
