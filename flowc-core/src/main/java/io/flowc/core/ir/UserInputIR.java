package io.flowc.core.ir;

import java.util.Objects;

/// A user-input node handed to the runtime.
///
/// @param id node id, not null
/// @param name display name, not null
/// @param trigger true if the node starts the workflow, false if it pauses it
/// @param regionId owning region, not null
public record UserInputIR(String id, String name, boolean trigger, String regionId) {

    public UserInputIR {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(regionId, "regionId must not be null");
    }
}
