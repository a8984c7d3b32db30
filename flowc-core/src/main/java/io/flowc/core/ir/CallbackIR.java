package io.flowc.core.ir;

import java.util.Objects;

/// A lifecycle callback attached to an agent.
///
/// Exactly one of `code` (inline callback node) and `ref` (capability registry id) is set.
///
/// @param phase lifecycle point, not null
/// @param name callback name, not null
/// @param code inline source code, may be null
/// @param ref registry id, may be null
/// @param sourceNodeId callback node the value came from, null for an agent text field
public record CallbackIR(
        CallbackPhase phase, String name, String code, String ref, String sourceNodeId) {

    public CallbackIR {
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(name, "name must not be null");
        if ((code == null) == (ref == null)) {
            throw new IllegalArgumentException("exactly one of code and ref must be set");
        }
    }

    /// @param phase lifecycle point, not null
    /// @param ref registry id, not null
    /// @return callback referencing the registry, never null
    public static CallbackIR reference(CallbackPhase phase, String ref) {
        return new CallbackIR(phase, ref, null, ref, null);
    }
}
