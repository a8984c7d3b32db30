package io.flowc.core.registry;

import java.util.Locale;

/// Kinds of capabilities an agent can reference by id.
public enum CapabilityKind {
    TOOL,
    CALLBACK,
    SCHEMA;

    /// @return lower-case name used in messages, e.g. `tool`
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
