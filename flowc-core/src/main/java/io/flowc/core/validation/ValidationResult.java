package io.flowc.core.validation;

import io.flowc.core.exception.ErrorLocation;
import io.flowc.core.validation.ValidationIssue.Severity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Collected outcome of one validation pass.
///
/// Issues are kept in detection order. Errors and warnings are collected side by side, so a
/// single pass reports the complete problem set.
///
/// @implNote **Not thread-safe**. Filled by a single validator run, then only read.
public final class ValidationResult {

    private final List<ValidationIssue> issues = new ArrayList<>();

    /// Records an error.
    ///
    /// @param code issue category, not null
    /// @param message description, not null
    /// @param location where it was found, may be null
    public void addError(String code, String message, ErrorLocation location) {
        issues.add(new ValidationIssue(Severity.ERROR, code, message, location));
    }

    /// Records a warning.
    ///
    /// @param code issue category, not null
    /// @param message description, not null
    /// @param location where it was found, may be null
    public void addWarning(String code, String message, ErrorLocation location) {
        issues.add(new ValidationIssue(Severity.WARNING, code, message, location));
    }

    /// Copies every warning of this result into a new result as an error.
    ///
    /// @return new result with all issues at error severity, never null
    public ValidationResult promoteWarnings() {
        ValidationResult promoted = new ValidationResult();
        for (ValidationIssue issue : issues) {
            promoted.addError(issue.code(), issue.message(), issue.location());
        }
        return promoted;
    }

    /// Returns whether no error was recorded.
    ///
    /// @return true if only warnings (or nothing) were found
    public boolean isValid() {
        return issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);
    }

    /// @return unmodifiable list of all issues in detection order
    public List<ValidationIssue> issues() {
        return Collections.unmodifiableList(issues);
    }

    /// @return errors in detection order, never null
    public List<ValidationIssue> errors() {
        return issues.stream().filter(i -> i.severity() == Severity.ERROR).toList();
    }

    /// @return warnings in detection order, never null
    public List<ValidationIssue> warnings() {
        return issues.stream().filter(i -> i.severity() == Severity.WARNING).toList();
    }
}
