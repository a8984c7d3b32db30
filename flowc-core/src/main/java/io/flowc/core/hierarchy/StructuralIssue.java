package io.flowc.core.hierarchy;

import java.util.Objects;

/// A shape the hierarchy builder could not interpret, reported as a validation error.
///
/// @param code issue category: `ambiguous-merge` or `loop-body`, not null
/// @param message description naming the nodes involved, not null
/// @param regionId region of the offending node, may be null
/// @param nodeId offending node, may be null
public record StructuralIssue(String code, String message, String regionId, String nodeId) {

    public static final String AMBIGUOUS_MERGE = "ambiguous-merge";
    public static final String LOOP_BODY = "loop-body";

    public StructuralIssue {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
