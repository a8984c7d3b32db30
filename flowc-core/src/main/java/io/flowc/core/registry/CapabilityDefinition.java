package io.flowc.core.registry;

import java.util.Map;
import java.util.Objects;

/// Describes a tool, callback or schema that flows may reference by id.
///
/// The compiler only checks that a referenced id exists and copies the reference into the IR;
/// the runtime binds the implementation.
///
/// ### Contracts
/// - **Precondition**: `id` must not be null or blank
/// - **Postcondition**: All fields immutable after construction
///
/// ### Usage
/// {@snippet :
/// CapabilityDefinition search = CapabilityDefinition.tool("web_search", "Search the web");
/// }
///
/// @param kind capability kind, not null
/// @param id unique id within its kind, not null
/// @param description human-readable description, not null (may be empty)
/// @param attributes extra descriptor fields (e.g. `class_name` of a schema), not null
public record CapabilityDefinition(
        CapabilityKind kind, String id, String description, Map<String, String> attributes) {

    /// Attribute key of a schema's model class.
    public static final String CLASS_NAME = "class_name";

    /// Compact constructor with validation.
    public CapabilityDefinition {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        description = description != null ? description : "";
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    /// @param id tool id, not null
    /// @param description description, may be null
    /// @return new tool definition, never null
    public static CapabilityDefinition tool(String id, String description) {
        return new CapabilityDefinition(CapabilityKind.TOOL, id, description, Map.of());
    }

    /// @param id callback id, not null
    /// @param description description, may be null
    /// @return new callback definition, never null
    public static CapabilityDefinition callback(String id, String description) {
        return new CapabilityDefinition(CapabilityKind.CALLBACK, id, description, Map.of());
    }

    /// @param id schema id, not null
    /// @param className fully qualified class name of the schema model, may be null
    /// @return new schema definition, never null
    public static CapabilityDefinition schema(String id, String className) {
        return new CapabilityDefinition(
                CapabilityKind.SCHEMA,
                id,
                "",
                className != null ? Map.of(CLASS_NAME, className) : Map.of());
    }
}
