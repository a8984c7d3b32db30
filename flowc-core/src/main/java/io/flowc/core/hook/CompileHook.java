package io.flowc.core.hook;

import io.flowc.core.exception.CompilationException;
import io.flowc.core.ir.WorkflowIR;

/// Post-compile extension point: inspects or replaces the compiled workflow.
///
/// Hooks run after substitution, in the order fixed by {@link HookRegistry}. Each receives the
/// output of the previous one.
@FunctionalInterface
public interface CompileHook {

    /// @param workflow compiled workflow, not null
    /// @return the workflow to hand to the next hook, never null (return `workflow` to keep it)
    /// @throws CompilationException to abort the compile
    WorkflowIR afterCompile(WorkflowIR workflow) throws CompilationException;
}
