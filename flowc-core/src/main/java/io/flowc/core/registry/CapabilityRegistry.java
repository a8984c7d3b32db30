package io.flowc.core.registry;

import java.util.List;
import java.util.Optional;

/// Read-only lookup of the tools, callbacks and schemas flows may reference.
///
/// The compiler treats a registry as an externally owned collaborator that does not change
/// while a compile runs. Scope precedence (project over global) is modelled by
/// {@link LayeredCapabilityRegistry}, not by global state.
///
/// ### Usage
/// {@snippet :
/// CapabilityRegistry registry = new DefaultCapabilityRegistry(List.of(
///     CapabilityDefinition.tool("web_search", "Search the web"),
///     CapabilityDefinition.callback("audit_log", "Log every model call")));
///
/// boolean known = registry.contains(CapabilityKind.TOOL, "web_search");
/// }
///
/// @implNote Implementations should be thread-safe for concurrent compile calls.
///
/// @see DefaultCapabilityRegistry
/// @see LayeredCapabilityRegistry
public interface CapabilityRegistry {

    /// Retrieves a capability by kind and id.
    ///
    /// @param kind capability kind, not null
    /// @param id capability id, not null
    /// @return the definition if found, empty otherwise
    /// @throws NullPointerException if `kind` or `id` is null
    Optional<CapabilityDefinition> find(CapabilityKind kind, String id);

    /// Returns all capabilities of a kind.
    ///
    /// @param kind capability kind, not null
    /// @return unmodifiable list, never null (may be empty)
    List<CapabilityDefinition> all(CapabilityKind kind);

    /// Returns whether a capability is registered.
    ///
    /// @param kind capability kind, not null
    /// @param id capability id, not null
    /// @return true if found
    default boolean contains(CapabilityKind kind, String id) {
        return find(kind, id).isPresent();
    }

    /// Returns a registry that knows nothing.
    ///
    /// @return empty registry, never null
    static CapabilityRegistry empty() {
        return new DefaultCapabilityRegistry();
    }
}
