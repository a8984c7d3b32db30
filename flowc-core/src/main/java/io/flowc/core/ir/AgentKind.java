package io.flowc.core.ir;

import java.util.Locale;
import java.util.Optional;

/// Construct kind of an {@link AgentIR}: a model-backed leaf or one of three composites.
public enum AgentKind {
    LLM,
    SEQUENTIAL,
    PARALLEL,
    LOOP;

    /// @return lower-case name used in serialized IR, e.g. `sequential`
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// @return true for the three composite kinds
    public boolean isComposite() {
        return this != LLM;
    }

    /// @param wireName serialized kind, may be null
    /// @return matching kind, empty if unknown
    public static Optional<AgentKind> fromWireName(String wireName) {
        for (AgentKind kind : values()) {
            if (kind.wireName().equals(wireName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
