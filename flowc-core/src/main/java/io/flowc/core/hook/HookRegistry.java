package io.flowc.core.hook;

import io.flowc.core.exception.CompilationException;
import io.flowc.core.ir.WorkflowIR;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Immutable, pre-sorted set of {@link CompileHook}s.
///
/// Hooks are registered explicitly as (name, priority, hook) triples, sorted once when the
/// registry is built (priority descending, then name) and dispatched in that order for every
/// compile.
///
/// ### Usage
/// {@snippet :
/// HookRegistry hooks = HookRegistry.builder()
///     .register("stamp-version", 10, ir -> ir)
///     .register("audit", 0, auditHook)
///     .build();
/// }
///
/// ### Contracts
/// - **Invariant**: names are unique
/// - **Invariant**: dispatch order never changes after construction
///
/// @implNote Immutable and thread-safe.
public final class HookRegistry {

    private static final Logger logger = Logger.getLogger(HookRegistry.class.getName());

    private static final HookRegistry EMPTY = new HookRegistry(List.of());

    private final List<HookRegistration> registrations;

    private HookRegistry(List<HookRegistration> registrations) {
        List<HookRegistration> sorted = new ArrayList<>(registrations);
        sorted.sort(HookRegistration.DISPATCH_ORDER);
        this.registrations = List.copyOf(sorted);
    }

    /// @return registry without hooks, never null
    public static HookRegistry empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return registrations in dispatch order, never null
    public List<HookRegistration> registrations() {
        return registrations;
    }

    /// Runs every hook in dispatch order, threading the workflow through.
    ///
    /// @param workflow compiled workflow, not null
    /// @return the last hook's result, `workflow` if there are no hooks
    /// @throws CompilationException if a hook aborts or returns null
    public WorkflowIR dispatch(WorkflowIR workflow) throws CompilationException {
        WorkflowIR current = workflow;
        for (HookRegistration registration : registrations) {
            WorkflowIR next = registration.hook().afterCompile(current);
            if (next == null) {
                throw new CompilationException(
                        "Compile hook '" + registration.name() + "' returned no workflow");
            }
            if (next != current) {
                logger.fine(() -> "Compile hook '" + registration.name() + "' replaced the IR");
            }
            current = next;
        }
        return current;
    }

    /// Collects registrations; names must be unique.
    public static final class Builder {
        private final List<HookRegistration> registrations = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        private Builder() {}

        /// @param name unique hook name, not null
        /// @param priority higher runs first
        /// @param hook the hook, not null
        /// @return this builder
        /// @throws IllegalArgumentException if `name` is already registered
        public Builder register(String name, int priority, CompileHook hook) {
            return register(new HookRegistration(name, priority, hook));
        }

        /// @param registration registration, not null
        /// @return this builder
        /// @throws IllegalArgumentException if its name is already registered
        public Builder register(HookRegistration registration) {
            Objects.requireNonNull(registration, "registration must not be null");
            if (!names.add(registration.name())) {
                throw new IllegalArgumentException(
                        "Hook already registered: " + registration.name());
            }
            registrations.add(registration);
            return this;
        }

        public HookRegistry build() {
            return new HookRegistry(registrations);
        }
    }
}
