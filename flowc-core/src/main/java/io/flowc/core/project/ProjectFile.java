package io.flowc.core.project;

import java.nio.file.Path;
import java.util.Objects;

/// A text file referenced by a node and read by the loader.
///
/// @param declaredPath the path as written in the node data, used as lookup key, not null
/// @param name file name without extension, not null
/// @param absolutePath resolved location inside the project, may be null for in-memory files
/// @param content file content, not null
public record ProjectFile(String declaredPath, String name, Path absolutePath, String content) {

    public ProjectFile {
        Objects.requireNonNull(declaredPath, "declaredPath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        name = name != null ? name : baseName(declaredPath);
    }

    /// Creates an in-memory file named after its declared path.
    ///
    /// @param declaredPath lookup key, not null
    /// @param content file content, not null
    /// @return new file, never null
    public static ProjectFile of(String declaredPath, String content) {
        return new ProjectFile(declaredPath, null, null, content);
    }

    /// Strips directories and the first extension: `prompts/writer.prompt.md` gives `writer`.
    static String baseName(String path) {
        String fileName = path.replace('\\', '/');
        fileName = fileName.substring(fileName.lastIndexOf('/') + 1);
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
