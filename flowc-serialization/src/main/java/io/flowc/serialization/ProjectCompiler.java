package io.flowc.serialization;

import io.flowc.core.CompilationResult;
import io.flowc.core.FlowcConfig;
import io.flowc.core.WorkflowCompiler;
import io.flowc.core.exception.CompilationException;
import io.flowc.core.project.ProjectLoader;
import io.flowc.core.project.ProjectSnapshot;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

/// One-call facade: load a project directory and compile it.
///
/// ### Usage
/// {@snippet :
/// ProjectCompiler compiler = ProjectCompiler.create();
/// CompilationResult result = compiler.compile(Path.of("projects/haiku"));
/// String json = WorkflowIrSerializer.toJson(result.workflow());
/// }
///
/// @implNote Thread-safe when the loader and compiler are; the defaults are.
public final class ProjectCompiler {

    private static final Logger logger = Logger.getLogger(ProjectCompiler.class.getName());

    /// Classpath resource read by {@link #loadConfig()}.
    public static final String CONFIG_RESOURCE = "/flowc.properties";

    private final ProjectLoader loader;
    private final WorkflowCompiler compiler;

    /// @param loader project reader, not null
    /// @param compiler configured compiler, not null
    public ProjectCompiler(ProjectLoader loader, WorkflowCompiler compiler) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
    }

    /// Creates a facade with the JSON loader and a compiler configured from
    /// `flowc.properties` on the classpath, if present.
    ///
    /// @return new facade, never null
    public static ProjectCompiler create() {
        return new ProjectCompiler(
                new JsonProjectLoader(),
                WorkflowCompiler.builder().config(loadConfig()).build());
    }

    /// Reads compiler options from the `flowc.properties` classpath resource.
    ///
    /// @return configuration from the resource, or defaults when it is absent, never null
    /// @throws IllegalArgumentException if the resource holds an invalid value
    /// @throws IllegalStateException if the resource exists but cannot be read
    public static FlowcConfig loadConfig() {
        try (InputStream is = ProjectCompiler.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                logger.fine("No " + CONFIG_RESOURCE + " on the classpath, using defaults");
                return new FlowcConfig();
            }
            Properties properties = new Properties();
            properties.load(is);
            return FlowcConfig.fromProperties(properties);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + CONFIG_RESOURCE, e);
        }
    }

    /// Loads and compiles a project without caller-supplied globals.
    ///
    /// @param projectPath project directory, not null
    /// @return compiled workflow and warnings, never null
    /// @throws CompilationException if loading or any compile stage fails
    public CompilationResult compile(Path projectPath) throws CompilationException {
        return compile(projectPath, Map.of());
    }

    /// Loads and compiles a project.
    ///
    /// @param projectPath project directory, not null
    /// @param globalVariables caller values for global variables, not null
    /// @return compiled workflow and warnings, never null
    /// @throws CompilationException if loading or any compile stage fails
    public CompilationResult compile(Path projectPath, Map<String, String> globalVariables)
            throws CompilationException {
        ProjectSnapshot snapshot = loader.load(projectPath);
        return compiler.compile(snapshot, globalVariables);
    }

    public ProjectLoader getLoader() {
        return loader;
    }

    public WorkflowCompiler getCompiler() {
        return compiler;
    }
}
