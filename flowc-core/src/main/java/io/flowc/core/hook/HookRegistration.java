package io.flowc.core.hook;

import java.util.Comparator;
import java.util.Objects;

/// A named hook with its dispatch priority.
///
/// @param name unique hook name, not null
/// @param priority higher runs first
/// @param hook the hook, not null
public record HookRegistration(String name, int priority, CompileHook hook) {

    /// Priority descending, then name.
    public static final Comparator<HookRegistration> DISPATCH_ORDER =
            Comparator.comparingInt(HookRegistration::priority)
                    .reversed()
                    .thenComparing(HookRegistration::name);

    public HookRegistration {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(hook, "hook must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
    }
}
