package io.flowc.core.exception;

import java.io.Serial;
import java.util.Objects;

/// Thrown when a project cannot be compiled.
///
/// Root of every compile failure. Direct instances signal loader, parser and graph problems
/// that abort the compile immediately; subclasses mark the more specific kinds:
/// - {@link TeleporterException} - channel pairing failures
/// - {@link PromptLoadException} / {@link ToolLoadException} - referenced resources
/// - {@link WorkflowValidationException} - collected structural problems
/// - {@link ContextVariableConflictException} - conflicting context variable sources
///
/// The message returned by {@link #getMessage()} is suffixed with the rendered location.
public class CompilationException extends Exception {

    @Serial private static final long serialVersionUID = 3418827596104522391L;

    private final transient ErrorLocation location;

    /// Creates exception with message and no location.
    ///
    /// @param message description of the failure
    public CompilationException(String message) {
        this(message, ErrorLocation.UNKNOWN, null);
    }

    /// Creates exception with message and location.
    ///
    /// @param message description of the failure
    /// @param location where the failure was detected, not null
    public CompilationException(String message, ErrorLocation location) {
        this(message, location, null);
    }

    /// Creates exception with message, location and cause.
    ///
    /// @param message description of the failure
    /// @param location where the failure was detected, not null
    /// @param cause the underlying exception, may be null
    public CompilationException(String message, ErrorLocation location, Throwable cause) {
        super(message, cause);
        this.location = Objects.requireNonNull(location, "location must not be null");
    }

    /// Returns where the failure was detected.
    ///
    /// @return location, never null (may be {@link ErrorLocation#UNKNOWN})
    public ErrorLocation getLocation() {
        return location;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        if (location == null || location.isUnknown()) {
            return message;
        }
        return message + " [" + location.describe() + "]";
    }
}
