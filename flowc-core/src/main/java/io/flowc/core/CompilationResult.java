package io.flowc.core;

import io.flowc.core.ir.WorkflowIR;
import io.flowc.core.validation.ValidationIssue;
import java.util.List;
import java.util.Objects;

/// Output of a successful compile.
///
/// @param workflow the compiled workflow, not null
/// @param warnings validation warnings in detection order, not null (may be empty)
public record CompilationResult(WorkflowIR workflow, List<ValidationIssue> warnings) {

    public CompilationResult {
        Objects.requireNonNull(workflow, "workflow must not be null");
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /// @return true if validation produced at least one warning
    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
