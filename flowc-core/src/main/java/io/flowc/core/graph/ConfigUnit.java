package io.flowc.core.graph;

import java.util.Locale;
import java.util.Optional;

/// Variants of the `custom` node kind. Each feeds one part of an agent's configuration.
public enum ConfigUnit {
    /// Instruction text from a file or inline content.
    PROMPT,
    /// Reference material appended to the instruction under a context heading.
    CONTEXT,
    /// Tool from a file, inline code or a registry reference.
    TOOL,
    /// Lifecycle callback from inline code or a registry reference.
    CALLBACK,
    /// Input or output schema from inline code or a registry reference.
    SCHEMA,
    /// Named context variables for session seeding.
    AGGREGATOR;

    /// @return lower-case name used in flow documents
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// @param wireName name from a flow document, may be null
    /// @return matching unit, empty if unknown
    public static Optional<ConfigUnit> fromWireName(String wireName) {
        for (ConfigUnit unit : values()) {
            if (unit.wireName().equals(wireName)) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
