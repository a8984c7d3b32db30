package io.flowc.core.exception;

import io.flowc.core.validation.ValidationIssue;
import io.flowc.core.validation.ValidationResult;
import java.io.Serial;
import java.util.Objects;

/// Thrown when validation finds one or more errors.
///
/// The validator finishes its whole pass before raising, so the carried result lists every
/// detected problem. The message and location are taken from the first error.
///
/// @see ValidationResult#errors()
public class WorkflowValidationException extends CompilationException {

    @Serial private static final long serialVersionUID = 8623470132457180076L;

    private final transient ValidationResult result;

    /// Creates exception from a result that contains at least one error.
    ///
    /// @param result the collected validation result, not null
    /// @throws IllegalArgumentException if `result` has no errors
    public WorkflowValidationException(ValidationResult result) {
        super(firstError(result).message(), firstError(result).location());
        this.result = result;
    }

    /// Returns the full result, including warnings.
    ///
    /// @return collected result, never null
    public ValidationResult getResult() {
        return result;
    }

    private static ValidationIssue firstError(ValidationResult result) {
        Objects.requireNonNull(result, "result must not be null");
        return result.errors().stream()
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("result has no errors"));
    }
}
