package io.flowc.core.graph;

import io.flowc.core.ir.CallbackPhase;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Kind-specific configuration of a parsed node.
///
/// One record per {@link NodeKind}; {@link FlowParser} produces the record matching the node's
/// kind after checking the data shape, so downstream stages can rely on required fields.
public sealed interface NodePayload {

    /// Display name of the node, or null when the kind has none.
    ///
    /// @return name, may be null
    String name();

    /// Payload of `start` nodes.
    record Start() implements NodePayload {
        @Override
        public String name() {
            return null;
        }
    }

    /// Payload of `end` nodes.
    record End() implements NodePayload {
        @Override
        public String name() {
            return null;
        }
    }

    /// Payload of `parallel-join` nodes.
    ///
    /// @param name display name, may be null
    record ParallelJoin(String name) implements NodePayload {}

    /// Payload of `agent` nodes.
    ///
    /// @param name agent name, not blank
    /// @param model model id, null for the configured default
    /// @param temperature sampling temperature, null for the configured default
    /// @param description routing description, may be null
    /// @param outputKey state key receiving the agent output, may be null
    /// @param instruction inline instruction text placed before connected prompts, may be null
    /// @param tools registry tool ids, not null
    /// @param callbacks registry callback ids by phase, not null
    /// @param inputSchema registry schema id, may be null
    /// @param outputSchema registry schema id, may be null
    /// @param settings free-form runtime settings, not null
    record Agent(
            String name,
            String model,
            Double temperature,
            String description,
            String outputKey,
            String instruction,
            List<String> tools,
            Map<CallbackPhase, String> callbacks,
            String inputSchema,
            String outputSchema,
            Map<String, Object> settings)
            implements NodePayload {

        public Agent {
            Objects.requireNonNull(name, "name must not be null");
            tools = tools != null ? List.copyOf(tools) : List.of();
            callbacks = callbacks != null ? Map.copyOf(callbacks) : Map.of();
            settings = settings != null ? settings : Map.of();
        }

        /// Creates an agent payload with only a name.
        ///
        /// @param name agent name, not null
        /// @return new payload, never null
        public static Agent named(String name) {
            return new Agent(name, null, null, null, null, null, null, null, null, null, null);
        }
    }

    /// Payload of `loop` markers.
    ///
    /// @param name display name, not null
    /// @param maxIterations iteration bound, null for the configured default
    record Loop(String name, Integer maxIterations) implements NodePayload {}

    /// Payload of `teleporter-out` and `teleporter-in` nodes.
    ///
    /// @param channel pairing key, not blank
    record Teleporter(String channel) implements NodePayload {
        @Override
        public String name() {
            return channel;
        }
    }

    /// Payload of `variable` nodes.
    ///
    /// @param name variable name, not blank
    /// @param value variable value rendered as text, not null
    record Variable(String name, String value) implements NodePayload {}

    /// Payload of `user-input` nodes.
    ///
    /// @param name display name, not null
    /// @param trigger whether the node starts the workflow
    record UserInput(String name, boolean trigger) implements NodePayload {}

    /// Payload of `custom` configuration nodes.
    ///
    /// @param unit configuration variant, not null
    /// @param name display name, may be null
    /// @param attributes remaining data fields, not null
    record Custom(ConfigUnit unit, String name, Map<String, Object> attributes)
            implements NodePayload {

        public Custom {
            Objects.requireNonNull(unit, "unit must not be null");
            attributes = attributes != null ? attributes : Map.of();
        }

        /// Reads a text attribute.
        ///
        /// @param key attribute name, not null
        /// @return non-blank text value, empty if absent, blank or not text
        public Optional<String> text(String key) {
            Object value = attributes.get(key);
            if (value instanceof String s && !s.isBlank()) {
                return Optional.of(s);
            }
            return Optional.empty();
        }
    }
}
