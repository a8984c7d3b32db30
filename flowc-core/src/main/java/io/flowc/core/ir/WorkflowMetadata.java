package io.flowc.core.ir;

import java.util.Objects;

/// Descriptive project data carried by a {@link WorkflowIR}.
///
/// @param projectName project name from the manifest, not null
/// @param version project version from the manifest, not null
public record WorkflowMetadata(String projectName, String version) {

    public WorkflowMetadata {
        Objects.requireNonNull(projectName, "projectName must not be null");
        Objects.requireNonNull(version, "version must not be null");
    }
}
