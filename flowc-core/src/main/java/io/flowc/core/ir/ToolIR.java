package io.flowc.core.ir;

import java.util.Locale;
import java.util.Objects;

/// A tool attached to an agent.
///
/// ```
/// source     filePath  code  meaning
/// ————————   ————————  ————  ———————————————————————————————————
/// FILE       set       set   tool module loaded from the project
/// INLINE     null      set   code written on a tool node
/// REGISTRY   null      null  `name` is an id in the capability registry
/// ```
///
/// @param name tool name, not null
/// @param source where the tool comes from, not null
/// @param filePath declared file path, may be null
/// @param code tool source code, may be null
/// @param errorBehavior how the runtime reacts to tool failures, not null
public record ToolIR(
        String name, Source source, String filePath, String code, ErrorBehavior errorBehavior) {

    public ToolIR {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(source, "source must not be null");
        errorBehavior = errorBehavior != null ? errorBehavior : ErrorBehavior.FAIL_FAST;
    }

    /// @param id capability registry id, not null
    /// @return registry tool with default error behavior, never null
    public static ToolIR registry(String id) {
        return new ToolIR(id, Source.REGISTRY, null, null, ErrorBehavior.FAIL_FAST);
    }

    /// Where a tool definition comes from.
    public enum Source {
        FILE,
        INLINE,
        REGISTRY
    }

    /// Runtime reaction to a failing tool call.
    public enum ErrorBehavior {
        /// Abort the agent run.
        FAIL_FAST,
        /// Hand the error text to the model as the tool result.
        PASS_TO_MODEL;

        /// @return lower-case name used in node data and serialized IR
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        /// @param wireName name from node data, may be null
        /// @return matching behavior, {@link #FAIL_FAST} when null or unknown
        public static ErrorBehavior fromWireName(String wireName) {
            for (ErrorBehavior behavior : values()) {
                if (behavior.wireName().equals(wireName)) {
                    return behavior;
                }
            }
            return FAIL_FAST;
        }
    }
}
