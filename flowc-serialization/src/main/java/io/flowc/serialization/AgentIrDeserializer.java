package io.flowc.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.flowc.core.ir.AgentIR;
import io.flowc.core.ir.AgentKind;
import io.flowc.core.ir.CallbackIR;
import io.flowc.core.ir.CallbackPhase;
import io.flowc.core.ir.SchemaIR;
import io.flowc.core.ir.ToolIR;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Deserializes JSON to an {@link AgentIR} tree using the `"type"` discriminator field.
///
/// Tools, callbacks and schemas only hold strings and enums, so they are extracted manually
/// from the `JsonNode` tree; free-form `settings` and `context_variables` go through
/// `convertValue`.
///
/// @implNote Package-private. Registered by {@link FlowcJacksonModule}.
/// @see AgentIrSerializer for the inverse operation
class AgentIrDeserializer extends StdDeserializer<AgentIR> {

    @Serial private static final long serialVersionUID = -6109274751327749265L;

    private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    AgentIrDeserializer() {
        super(AgentIR.class);
    }

    /// Reads the agent object and its subagents.
    ///
    /// @param p parser positioned at the start of the agent object, not null
    /// @param ctxt deserialization context, not null
    /// @return the agent, never null
    /// @throws IOException if `id` or `type` is missing or `type` is unknown
    @Override
    public AgentIR deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return readAgent(mapper, mapper.readTree(p));
    }

    private AgentIR readAgent(ObjectMapper mapper, JsonNode root) throws IOException {
        String id = requiredText(root, "id");
        String type = requiredText(root, "type");
        AgentKind kind =
                AgentKind.fromWireName(type)
                        .orElseThrow(() -> new IOException("Unknown agent type: " + type));

        AgentIR.Builder builder =
                AgentIR.builder()
                        .id(id)
                        .name(text(root, "name"))
                        .kind(kind)
                        .description(text(root, "description"))
                        .sourceNodeId(text(root, "source_node_id"))
                        .condition(text(root, "condition"));

        if (kind.isComposite()) {
            List<AgentIR> subagents = new ArrayList<>();
            for (JsonNode child : root.path("subagents")) {
                subagents.add(readAgent(mapper, child));
            }
            builder.subagents(subagents);
            if (root.hasNonNull("max_iterations")) {
                builder.maxIterations(root.get("max_iterations").asInt());
            }
        } else {
            readLeaf(mapper, root, builder);
        }
        return builder.build();
    }

    private void readLeaf(ObjectMapper mapper, JsonNode root, AgentIR.Builder builder)
            throws IOException {
        builder.instruction(text(root, "instruction"))
                .model(text(root, "model"))
                .outputKey(text(root, "output_key"))
                .inputSchema(readSchema(root.get("input_schema")))
                .outputSchema(readSchema(root.get("output_schema")));
        if (root.hasNonNull("temperature")) {
            builder.temperature(root.get("temperature").asDouble());
        }

        List<ToolIR> tools = new ArrayList<>();
        for (JsonNode tool : root.path("tools")) {
            tools.add(
                    new ToolIR(
                            requiredText(tool, "name"),
                            ToolIR.Source.valueOf(
                                    requiredText(tool, "source").toUpperCase(Locale.ROOT)),
                            text(tool, "file_path"),
                            text(tool, "code"),
                            ToolIR.ErrorBehavior.fromWireName(text(tool, "error_behavior"))));
        }
        builder.tools(tools);

        List<CallbackIR> callbacks = new ArrayList<>();
        for (JsonNode callback : root.path("callbacks")) {
            callbacks.add(
                    new CallbackIR(
                            CallbackPhase.valueOf(
                                    requiredText(callback, "phase").toUpperCase(Locale.ROOT)),
                            requiredText(callback, "name"),
                            text(callback, "code"),
                            text(callback, "ref"),
                            text(callback, "source_node_id")));
        }
        builder.callbacks(callbacks);

        if (root.has("context_variables")) {
            builder.contextVariables(
                    mapper.convertValue(root.get("context_variables"), STRING_MAP));
        }
        if (root.has("settings")) {
            builder.settings(mapper.convertValue(root.get("settings"), OBJECT_MAP));
        }
    }

    private SchemaIR readSchema(JsonNode node) throws IOException {
        if (node == null || node.isNull()) {
            return null;
        }
        return new SchemaIR(
                requiredText(node, "name"),
                text(node, "code"),
                text(node, "class_name"),
                text(node, "ref"),
                text(node, "source_node_id"));
    }

    private static String requiredText(JsonNode node, String field) throws IOException {
        String value = text(node, field);
        if (value == null) {
            throw new IOException("Missing required field '" + field + "'");
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
