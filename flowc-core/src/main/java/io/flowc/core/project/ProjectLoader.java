package io.flowc.core.project;

import io.flowc.core.exception.CompilationException;
import java.nio.file.Path;

/// Reads a project directory into an immutable {@link ProjectSnapshot}.
///
/// The core module only defines the contract; the JSON implementation lives in
/// `flowc-serialization`.
///
/// @implNote Implementations must not keep per-call state, so one loader can serve concurrent
/// compile calls.
public interface ProjectLoader {

    /// Loads the manifest, every region flow and every referenced prompt and tool file.
    ///
    /// @param projectPath project directory, not null
    /// @return snapshot of the project, never null
    /// @throws CompilationException if the directory, manifest or a flow document is invalid
    /// @throws io.flowc.core.exception.PromptLoadException if a prompt file cannot be read
    /// @throws io.flowc.core.exception.ToolLoadException if a tool file cannot be read
    ProjectSnapshot load(Path projectPath) throws CompilationException;
}
