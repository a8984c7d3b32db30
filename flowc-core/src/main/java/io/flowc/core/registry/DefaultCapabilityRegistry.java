package io.flowc.core.registry;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Default thread-safe implementation of {@link CapabilityRegistry}.
///
/// Uses a ConcurrentHashMap per kind. Registration is meant to happen before compiling; the
/// compiler itself only reads.
///
/// ### Usage
/// {@snippet :
/// DefaultCapabilityRegistry registry = new DefaultCapabilityRegistry();
/// registry.register(CapabilityDefinition.tool("web_search", "Search the web"));
/// }
///
/// @implNote Thread-safe.
public final class DefaultCapabilityRegistry implements CapabilityRegistry {

    private final Map<CapabilityKind, Map<String, CapabilityDefinition>> definitions =
            new ConcurrentHashMap<>();

    /// Creates an empty registry.
    public DefaultCapabilityRegistry() {}

    /// Creates a registry with initial definitions.
    ///
    /// @param initial definitions to register, not null
    public DefaultCapabilityRegistry(List<CapabilityDefinition> initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        initial.forEach(this::register);
    }

    /// Registers a definition, replacing one with the same kind and id.
    ///
    /// @apiNote **Side effects**: Modifies the registry
    ///
    /// @param definition the definition to register, not null
    /// @throws NullPointerException if `definition` is null
    public void register(CapabilityDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        byKind(definition.kind()).put(definition.id(), definition);
    }

    /// Removes a definition.
    ///
    /// @param kind capability kind, not null
    /// @param id capability id, not null
    /// @return true if a definition was removed
    public boolean remove(CapabilityKind kind, String id) {
        Objects.requireNonNull(id, "id must not be null");
        return byKind(kind).remove(id) != null;
    }

    @Override
    public Optional<CapabilityDefinition> find(CapabilityKind kind, String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(byKind(kind).get(id));
    }

    /// Returns the definitions of a kind sorted by id.
    @Override
    public List<CapabilityDefinition> all(CapabilityKind kind) {
        return byKind(kind).values().stream()
                .sorted(Comparator.comparing(CapabilityDefinition::id))
                .toList();
    }

    /// @return number of definitions across all kinds
    public int size() {
        return definitions.values().stream().mapToInt(Map::size).sum();
    }

    private Map<String, CapabilityDefinition> byKind(CapabilityKind kind) {
        Objects.requireNonNull(kind, "kind must not be null");
        return definitions.computeIfAbsent(kind, k -> new ConcurrentHashMap<>());
    }
}
