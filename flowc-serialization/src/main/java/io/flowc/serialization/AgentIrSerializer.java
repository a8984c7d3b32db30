package io.flowc.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.flowc.core.ir.AgentIR;
import io.flowc.core.ir.CallbackIR;
import io.flowc.core.ir.SchemaIR;
import io.flowc.core.ir.ToolIR;
import java.io.IOException;
import java.io.Serial;
import java.util.Locale;
import java.util.Map;

/// Serializes an {@link AgentIR} tree with a `"type"` discriminator field.
///
/// Every object begins with `"id"`, `"name"` and `"type"`; composites follow with nested
/// `"subagents"`. Optional fields are omitted when null or empty.
///
/// ```
/// type        additional fields
/// ——————————— +———————————————————————————————————————————————————————————————
/// llm         │ instruction, tools, callbacks, input_schema, output_schema,
///             │ context_variables, model, temperature, output_key, settings
/// sequential  │ subagents
/// parallel    │ subagents
/// loop        │ subagents, max_iterations
/// all         │ description, source_node_id, condition
/// ```
///
/// @implNote Package-private. Registered by {@link FlowcJacksonModule}.
/// @see AgentIrDeserializer for the inverse operation
class AgentIrSerializer extends StdSerializer<AgentIR> {

    @Serial private static final long serialVersionUID = 4725981633017415120L;

    AgentIrSerializer() {
        super(AgentIR.class);
    }

    @Override
    public void serialize(AgentIR agent, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("id", agent.getId());
        gen.writeStringField("name", agent.getName());
        gen.writeStringField("type", agent.getKind().wireName());

        if (agent.isComposite()) {
            gen.writeArrayFieldStart("subagents");
            for (AgentIR subagent : agent.getSubagents()) {
                serialize(subagent, gen, provider);
            }
            gen.writeEndArray();
            if (agent.getMaxIterations() != null) {
                gen.writeNumberField("max_iterations", agent.getMaxIterations());
            }
        } else {
            writeLeaf(agent, gen, provider);
        }

        writeIfNotNull(gen, "description", agent.getDescription());
        writeIfNotNull(gen, "source_node_id", agent.getSourceNodeId());
        writeIfNotNull(gen, "condition", agent.getCondition());
        gen.writeEndObject();
    }

    private void writeLeaf(AgentIR agent, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        writeIfNotNull(gen, "instruction", agent.getInstruction());
        if (!agent.getTools().isEmpty()) {
            gen.writeArrayFieldStart("tools");
            for (ToolIR tool : agent.getTools()) {
                writeTool(tool, gen);
            }
            gen.writeEndArray();
        }
        if (!agent.getCallbacks().isEmpty()) {
            gen.writeArrayFieldStart("callbacks");
            for (CallbackIR callback : agent.getCallbacks()) {
                gen.writeStartObject();
                gen.writeStringField("phase", callback.phase().name().toLowerCase(Locale.ROOT));
                gen.writeStringField("name", callback.name());
                writeIfNotNull(gen, "code", callback.code());
                writeIfNotNull(gen, "ref", callback.ref());
                writeIfNotNull(gen, "source_node_id", callback.sourceNodeId());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
        writeSchema(gen, "input_schema", agent.getInputSchema());
        writeSchema(gen, "output_schema", agent.getOutputSchema());
        writeMap(gen, provider, "context_variables", agent.getContextVariables());
        writeIfNotNull(gen, "model", agent.getModel());
        if (agent.getTemperature() != null) {
            gen.writeNumberField("temperature", agent.getTemperature());
        }
        writeIfNotNull(gen, "output_key", agent.getOutputKey());
        writeMap(gen, provider, "settings", agent.getSettings());
    }

    private void writeTool(ToolIR tool, JsonGenerator gen) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", tool.name());
        gen.writeStringField("source", tool.source().name().toLowerCase(Locale.ROOT));
        writeIfNotNull(gen, "file_path", tool.filePath());
        writeIfNotNull(gen, "code", tool.code());
        gen.writeStringField("error_behavior", tool.errorBehavior().wireName());
        gen.writeEndObject();
    }

    private void writeSchema(JsonGenerator gen, String field, SchemaIR schema) throws IOException {
        if (schema == null) {
            return;
        }
        gen.writeObjectFieldStart(field);
        gen.writeStringField("name", schema.name());
        writeIfNotNull(gen, "code", schema.code());
        writeIfNotNull(gen, "class_name", schema.className());
        writeIfNotNull(gen, "ref", schema.ref());
        writeIfNotNull(gen, "source_node_id", schema.sourceNodeId());
        gen.writeEndObject();
    }

    private void writeMap(
            JsonGenerator gen, SerializerProvider provider, String field, Map<String, ?> map)
            throws IOException {
        if (!map.isEmpty()) {
            provider.defaultSerializeField(field, map, gen);
        }
    }

    private void writeIfNotNull(JsonGenerator gen, String field, String value)
            throws IOException {
        if (value != null) {
            gen.writeStringField(field, value);
        }
    }
}
