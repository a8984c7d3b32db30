package io.flowc.core.validation;

import io.flowc.core.exception.ErrorLocation;
import java.util.Objects;

/// A single problem found during validation.
///
/// @param severity whether the issue fails the compile, not null
/// @param code stable machine-readable category, e.g. `cycle` or `missing-reference`, not null
/// @param message human-readable description, not null
/// @param location where the issue was found, not null
public record ValidationIssue(
        Severity severity, String code, String message, ErrorLocation location) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
        location = location != null ? location : ErrorLocation.UNKNOWN;
    }

    /// Issue severity.
    public enum Severity {
        ERROR,
        WARNING
    }

    @Override
    public String toString() {
        String where = location.isUnknown() ? "" : " [" + location.describe() + "]";
        return severity + " " + code + ": " + message + where;
    }
}
