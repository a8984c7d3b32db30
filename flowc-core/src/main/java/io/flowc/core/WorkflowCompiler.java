package io.flowc.core;

import io.flowc.core.exception.CompilationException;
import io.flowc.core.exception.ErrorLocation;
import io.flowc.core.graph.FlowParser;
import io.flowc.core.graph.GraphBuilder;
import io.flowc.core.graph.ParsedProject;
import io.flowc.core.graph.WorkflowGraph;
import io.flowc.core.hierarchy.Hierarchy;
import io.flowc.core.hierarchy.HierarchyBuilder;
import io.flowc.core.hook.HookRegistry;
import io.flowc.core.ir.WorkflowIR;
import io.flowc.core.project.ProjectSnapshot;
import io.flowc.core.registry.CapabilityRegistry;
import io.flowc.core.template.Substitution;
import io.flowc.core.transform.IrTransformer;
import io.flowc.core.validation.ValidationResult;
import io.flowc.core.validation.WorkflowValidator;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Entry point of the compiler: turns a {@link ProjectSnapshot} into a {@link WorkflowIR}.
///
/// ### Pipeline
/// ```
/// FlowParser → GraphBuilder → HierarchyBuilder → WorkflowValidator
///            → IrTransformer → Substitution → HookRegistry
/// ```
///
/// Every stage either returns its product or throws; nothing is retried and no partial IR is
/// returned. Validation collects all issues before failing.
///
/// ### Usage
/// {@snippet :
/// WorkflowCompiler compiler = WorkflowCompiler.builder()
///     .config(FlowcConfig.builder().failOnWarnings(true).build())
///     .registry(capabilities)
///     .build();
///
/// CompilationResult result = compiler.compile(snapshot, Map.of("topic", "rivers"));
/// WorkflowIR ir = result.workflow();
/// }
///
/// @implNote Thread-safe. The compiler holds only immutable collaborators; every call builds
/// its own graph, hierarchy and IR.
///
/// @see FlowcConfig
/// @see HookRegistry
public final class WorkflowCompiler {

    private static final Logger logger = Logger.getLogger(WorkflowCompiler.class.getName());

    private final FlowcConfig config;
    private final CapabilityRegistry registry;
    private final HookRegistry hooks;
    private final FlowParser parser;
    private final GraphBuilder graphBuilder;
    private final HierarchyBuilder hierarchyBuilder;
    private final WorkflowValidator validator;
    private final IrTransformer transformer;

    private WorkflowCompiler(Builder builder) {
        this.config = builder.config;
        this.registry = builder.registry;
        this.hooks = builder.hooks;
        this.parser = new FlowParser();
        this.graphBuilder = new GraphBuilder();
        this.hierarchyBuilder = new HierarchyBuilder();
        this.validator = new WorkflowValidator(registry, config);
        this.transformer = new IrTransformer(config, registry);
    }

    /// Creates a compiler with default configuration, an empty registry and no hooks.
    ///
    /// @return new compiler, never null
    public static WorkflowCompiler create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Compiles a project without caller-supplied global values.
    ///
    /// @param project the project snapshot, not null
    /// @return compiled workflow and warnings, never null
    /// @throws CompilationException if any stage fails
    public CompilationResult compile(ProjectSnapshot project) throws CompilationException {
        return compile(project, Map.of());
    }

    /// Compiles a project.
    ///
    /// @param project the project snapshot, not null
    /// @param globalVariables caller values merged over unconnected variable nodes and used
    ///     for build-time substitution, not null
    /// @return compiled workflow and warnings, never null
    /// @throws io.flowc.core.exception.TeleporterException if a channel is not paired one-to-one
    /// @throws io.flowc.core.exception.WorkflowValidationException if validation finds errors
    /// @throws io.flowc.core.exception.ContextVariableConflictException if context sources
    ///     disagree
    /// @throws CompilationException for malformed input, an unresolvable resource or global
    ///     variables that reference each other in a cycle
    public CompilationResult compile(ProjectSnapshot project, Map<String, String> globalVariables)
            throws CompilationException {
        Objects.requireNonNull(project, "project must not be null");
        Objects.requireNonNull(globalVariables, "globalVariables must not be null");

        ParsedProject parsed = parser.parse(project);
        WorkflowGraph graph = graphBuilder.build(parsed);
        Hierarchy hierarchy = hierarchyBuilder.build(graph);
        ValidationResult validation = validator.validate(graph, hierarchy, project);

        WorkflowIR workflow = transformer.transform(project, graph, hierarchy, globalVariables);
        if (config.isSubstituteGlobals()) {
            workflow = substitute(workflow);
        }
        workflow = hooks.dispatch(workflow);

        logger.info(
                "Compiled project '"
                        + project.getName()
                        + "' with "
                        + workflow.getAllAgents().size()
                        + " agents and "
                        + validation.warnings().size()
                        + " warnings");
        return new CompilationResult(workflow, validation.warnings());
    }

    private static WorkflowIR substitute(WorkflowIR workflow) throws CompilationException {
        try {
            return Substitution.of(workflow.getGlobalVariables()).apply(workflow);
        } catch (IllegalArgumentException e) {
            throw new CompilationException(e.getMessage(), ErrorLocation.UNKNOWN, e);
        }
    }

    public FlowcConfig getConfig() {
        return config;
    }

    public CapabilityRegistry getRegistry() {
        return registry;
    }

    public HookRegistry getHooks() {
        return hooks;
    }

    /// Fluent builder for {@link WorkflowCompiler}.
    ///
    /// Unset collaborators default to a fresh {@link FlowcConfig}, an empty registry and an
    /// empty hook registry.
    public static final class Builder {
        private FlowcConfig config = new FlowcConfig();
        private CapabilityRegistry registry = CapabilityRegistry.empty();
        private HookRegistry hooks = HookRegistry.empty();

        private Builder() {}

        public Builder config(FlowcConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder registry(CapabilityRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry must not be null");
            return this;
        }

        public Builder hooks(HookRegistry hooks) {
            this.hooks = Objects.requireNonNull(hooks, "hooks must not be null");
            return this;
        }

        public WorkflowCompiler build() {
            return new WorkflowCompiler(this);
        }
    }
}
