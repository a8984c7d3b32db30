package io.flowc.core.registry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Ordered list of registries searched front to back; the first match wins.
///
/// Models scope precedence explicitly: a project-specific registry placed before a global one
/// shadows the global definitions with the same id.
///
/// {@snippet :
/// CapabilityRegistry registry = new LayeredCapabilityRegistry(List.of(projectScope, globalScope));
/// }
///
/// @implNote Thread-safe if every layer is.
public final class LayeredCapabilityRegistry implements CapabilityRegistry {

    private final List<CapabilityRegistry> layers;

    /// @param layers registries in precedence order, not null
    public LayeredCapabilityRegistry(List<CapabilityRegistry> layers) {
        Objects.requireNonNull(layers, "layers must not be null");
        this.layers = List.copyOf(layers);
    }

    @Override
    public Optional<CapabilityDefinition> find(CapabilityKind kind, String id) {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(id, "id must not be null");
        for (CapabilityRegistry layer : layers) {
            Optional<CapabilityDefinition> found = layer.find(kind, id);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /// Returns the visible definitions of a kind: one per id, from the first layer defining it.
    @Override
    public List<CapabilityDefinition> all(CapabilityKind kind) {
        Map<String, CapabilityDefinition> visible = new LinkedHashMap<>();
        for (CapabilityRegistry layer : layers) {
            for (CapabilityDefinition definition : layer.all(kind)) {
                visible.putIfAbsent(definition.id(), definition);
            }
        }
        return List.copyOf(new ArrayList<>(visible.values()));
    }

    /// @return layers in precedence order, never null
    public List<CapabilityRegistry> layers() {
        return layers;
    }
}
