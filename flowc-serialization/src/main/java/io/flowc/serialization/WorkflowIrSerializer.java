package io.flowc.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.flowc.core.ir.WorkflowIR;

/// Utility class for serializing and deserializing compiled workflows to/from JSON.
///
/// Provides a pre-configured `ObjectMapper` that writes the snake_case document the agent
/// runtime reads:
///
/// ```
/// metadata{project_name, version}, project_path, tab_ids, has_start_node, has_end_node,
/// global_variables, roots{region: agent}, all_agents{id: agent}, teleporters, user_inputs
/// ```
///
/// ### Usage
/// {@snippet :
/// String json = WorkflowIrSerializer.toJson(result.workflow());
/// WorkflowIR restored = WorkflowIrSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. The internal ObjectMapper is created per call via
/// `createMapper()`. For high-throughput scenarios, cache the mapper.
///
/// @see FlowcJacksonModule for the registered type handlers
public final class WorkflowIrSerializer {

    private WorkflowIrSerializer() {}

    /// Serializes a workflow to pretty-printed JSON.
    ///
    /// @param workflow the workflow to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(WorkflowIR workflow) {
        try {
            return createMapper().writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow: " + e.getMessage(), e);
        }
    }

    /// Deserializes a workflow from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized workflow, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static WorkflowIR fromJson(String json) {
        try {
            return createMapper().readValue(json, WorkflowIR.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize workflow: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for workflow IR serialization.
    ///
    /// Registers:
    /// - `FlowcJacksonModule` for the agent tree and the workflow builder
    /// - snake_case property naming
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new FlowcJacksonModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
