package io.flowc.core.ir;

import java.util.Locale;
import java.util.Optional;

/// Lifecycle point a callback is attached to: before/after × agent/model/tool.
public enum CallbackPhase {
    BEFORE_AGENT,
    AFTER_AGENT,
    BEFORE_MODEL,
    AFTER_MODEL,
    BEFORE_TOOL,
    AFTER_TOOL;

    /// Returns the agent port (and data field) carrying this phase, e.g. `before_model_callback`.
    ///
    /// @return port name, never null
    public String portName() {
        return name().toLowerCase(Locale.ROOT) + "_callback";
    }

    /// Maps an agent port name back to its phase.
    ///
    /// @param port source port of an edge, may be null
    /// @return matching phase, empty if `port` is not a callback port
    public static Optional<CallbackPhase> fromPortName(String port) {
        for (CallbackPhase phase : values()) {
            if (phase.portName().equals(port)) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }
}
