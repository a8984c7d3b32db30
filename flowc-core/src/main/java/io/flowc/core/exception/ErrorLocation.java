package io.flowc.core.exception;

import java.util.ArrayList;
import java.util.List;

/// Where in a project a compile problem was detected.
///
/// Every component is optional; callers fill in whatever is known at the point of failure.
/// Loader errors usually carry `filePath` (and `line` for malformed JSON), graph errors carry
/// `regionId` and `nodeId`.
///
/// @param regionId owning region (tab) id, may be null
/// @param nodeId offending node id, may be null
/// @param filePath project-relative or absolute file path, may be null
/// @param line 1-based line number inside `filePath`, may be null
public record ErrorLocation(String regionId, String nodeId, String filePath, Integer line) {

    /// Location with no information.
    public static final ErrorLocation UNKNOWN = new ErrorLocation(null, null, null, null);

    /// Location of a node inside a region.
    ///
    /// @param regionId owning region id, may be null
    /// @param nodeId node id, may be null
    /// @return new location, never null
    public static ErrorLocation node(String regionId, String nodeId) {
        return new ErrorLocation(regionId, nodeId, null, null);
    }

    /// Location of a file.
    ///
    /// @param filePath file path, may be null
    /// @return new location, never null
    public static ErrorLocation file(String filePath) {
        return new ErrorLocation(null, null, filePath, null);
    }

    /// Returns a copy with the given file path.
    ///
    /// @param path file path, may be null
    /// @return new location, never null
    public ErrorLocation withFile(String path) {
        return new ErrorLocation(regionId, nodeId, path, line);
    }

    /// Returns a copy with the given line number.
    ///
    /// @param lineNumber 1-based line, may be null
    /// @return new location, never null
    public ErrorLocation withLine(Integer lineNumber) {
        return new ErrorLocation(regionId, nodeId, filePath, lineNumber);
    }

    /// Returns whether no component is set.
    ///
    /// @return true if every component is null
    public boolean isUnknown() {
        return regionId == null && nodeId == null && filePath == null && line == null;
    }

    /// Renders the known components, e.g. `region=main, node=a1, file=prompts/x.md:3`.
    ///
    /// @return human-readable description, empty when unknown
    public String describe() {
        List<String> parts = new ArrayList<>();
        if (regionId != null) {
            parts.add("region=" + regionId);
        }
        if (nodeId != null) {
            parts.add("node=" + nodeId);
        }
        if (filePath != null) {
            parts.add("file=" + filePath + (line != null ? ":" + line : ""));
        }
        return String.join(", ", parts);
    }
}
