package io.flowc.core.ir;

import java.util.Objects;

/// An input or output schema attached to an agent.
///
/// @param name schema name, not null
/// @param code inline schema source, may be null
/// @param className model class the runtime instantiates, may be null
/// @param ref capability registry id, may be null
/// @param sourceNodeId schema node the value came from, null for an agent text field
public record SchemaIR(
        String name, String code, String className, String ref, String sourceNodeId) {

    public SchemaIR {
        Objects.requireNonNull(name, "name must not be null");
    }
}
