package io.flowc.core;

import static io.flowc.core.TestProjects.project;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowc.core.exception.CompilationException;
import io.flowc.core.exception.TeleporterException;
import io.flowc.core.exception.WorkflowValidationException;
import io.flowc.core.hook.HookRegistry;
import io.flowc.core.ir.AgentIR;
import io.flowc.core.ir.AgentKind;
import io.flowc.core.ir.ToolIR;
import io.flowc.core.ir.WorkflowIR;
import io.flowc.core.registry.CapabilityDefinition;
import io.flowc.core.registry.DefaultCapabilityRegistry;
import io.flowc.core.validation.ValidationIssue;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkflowCompilerTest {

    /// start -> writer -> editor, with an unconnected `topic` variable.
    private static TestProjects writingProject() {
        return project().start("start")
                .agent("writer", Map.of("instruction", "Write about {topic}", "output_key", "draft"))
                .agent("editor", Map.of("instruction", "Polish {draft} on {topic}"))
                .variable("topic", "topic", "rivers")
                .chain("start", "writer", "editor");
    }

    @Nested
    class Pipeline {

        @Test
        void shouldCompileLinearProject() throws Exception {
            // When
            CompilationResult result = WorkflowCompiler.create().compile(writingProject().build());

            // Then
            WorkflowIR workflow = result.workflow();
            AgentIR root = workflow.getRoots().get("main");
            assertThat(root.getKind()).isEqualTo(AgentKind.SEQUENTIAL);
            assertThat(root.getSubagents())
                    .extracting(AgentIR::getName)
                    .containsExactly("writer", "editor");
            assertThat(workflow.getGlobalVariables()).containsEntry("topic", "rivers");
            assertThat(workflow.hasStartNode()).isTrue();
            assertThat(result.hasWarnings()).isFalse();
        }

        @Test
        void shouldSubstituteGlobalsWithCallerValuesFirst() throws Exception {
            // When
            WorkflowIR workflow =
                    WorkflowCompiler.create()
                            .compile(writingProject().build(), Map.of("topic", "lakes"))
                            .workflow();

            // Then
            assertThat(workflow.agent("writer").orElseThrow().getInstruction())
                    .isEqualTo("Write about lakes");
            assertThat(workflow.agent("editor").orElseThrow().getInstruction())
                    .isEqualTo("Polish {draft} on lakes");
        }

        @Test
        void shouldSubstituteEveryAgentFieldWithChainedGlobals() throws Exception {
            // Given
            TestProjects project =
                    project().start("start")
                            .agent(
                                    "writer",
                                    Map.of(
                                            "instruction", "Use {m}",
                                            "model", "{m}",
                                            "output_key", "{k}"))
                            .custom("t", "tool", Map.of("code", "def f(): return '{m}'"))
                            .edge("t", null, "writer", "tools")
                            .chain("start", "writer");
            Map<String, String> globals = Map.of("m", "{tier}-model", "tier", "pro", "k", "draft");

            // When
            WorkflowIR workflow = WorkflowCompiler.create().compile(project.build(), globals).workflow();

            // Then
            AgentIR writer = workflow.agent("writer").orElseThrow();
            assertThat(writer.getInstruction()).isEqualTo("Use pro-model");
            assertThat(writer.getModel()).isEqualTo("pro-model");
            assertThat(writer.getOutputKey()).isEqualTo("draft");
            assertThat(writer.getTools())
                    .extracting(ToolIR::code)
                    .containsExactly("def f(): return 'pro-model'");
        }

        @Test
        void shouldKeepPlaceholdersWhenSubstitutionIsOff() throws Exception {
            // Given
            WorkflowCompiler compiler =
                    WorkflowCompiler.builder()
                            .config(FlowcConfig.builder().substituteGlobals(false).build())
                            .build();

            // When
            WorkflowIR workflow = compiler.compile(writingProject().build()).workflow();

            // Then
            assertThat(workflow.agent("writer").orElseThrow().getInstruction())
                    .isEqualTo("Write about {topic}");
        }

        @Test
        void shouldRunHooksOnFinalWorkflow() throws Exception {
            // Given
            HookRegistry hooks =
                    HookRegistry.builder()
                            .register(
                                    "rename",
                                    0,
                                    ir -> ir.toBuilder()
                                            .projectPath("/srv/" + ir.getMetadata().projectName())
                                            .build())
                            .build();

            // When
            WorkflowIR workflow =
                    WorkflowCompiler.builder()
                            .hooks(hooks)
                            .build()
                            .compile(writingProject().build())
                            .workflow();

            // Then
            assertThat(workflow.getProjectPath()).isEqualTo("/srv/test-project");
        }

        @Test
        void shouldCompileSameProjectDeterministically() throws Exception {
            WorkflowCompiler compiler = WorkflowCompiler.create();

            WorkflowIR first = compiler.compile(writingProject().build()).workflow();
            WorkflowIR second = compiler.compile(writingProject().build()).workflow();

            assertThat(second.getAllAgents().keySet())
                    .containsExactlyElementsOf(first.getAllAgents().keySet());
            assertThat(second.getRoots().get("main").toString())
                    .isEqualTo(first.getRoots().get("main").toString());
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldReturnWarningsWithWorkflow() throws Exception {
            // Given
            TestProjects project =
                    project().start("start").agent("A").agent("B").chain("start", "A", "B");

            // When
            CompilationResult result = WorkflowCompiler.create().compile(project.build());

            // Then
            assertThat(result.hasWarnings()).isTrue();
            assertThat(result.warnings())
                    .extracting(ValidationIssue::code)
                    .containsExactly("missing-output-key");
        }

        @Test
        void shouldFailOnWarningsWhenConfigured() {
            // Given
            WorkflowCompiler compiler =
                    WorkflowCompiler.builder()
                            .config(FlowcConfig.builder().failOnWarnings(true).build())
                            .build();
            TestProjects project =
                    project().start("start").agent("A").agent("B").chain("start", "A", "B");

            // When / Then
            assertThatThrownBy(() -> compiler.compile(project.build()))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("Agent 'A' feeds another agent but has no output_key");
        }

        @Test
        void shouldRejectUnknownToolReference() {
            TestProjects project =
                    project().start("start")
                            .agent("A", Map.of("tools", List.of("search")))
                            .chain("start", "A");

            assertThatThrownBy(() -> WorkflowCompiler.create().compile(project.build()))
                    .isInstanceOf(WorkflowValidationException.class)
                    .hasMessageContaining("Missing tool reference 'search' in 'A'");
        }

        @Test
        void shouldResolveToolReferenceFromRegistry() throws Exception {
            // Given
            WorkflowCompiler compiler =
                    WorkflowCompiler.builder()
                            .registry(
                                    new DefaultCapabilityRegistry(
                                            List.of(CapabilityDefinition.tool("search", "Search"))))
                            .build();
            TestProjects project =
                    project().start("start")
                            .agent("A", Map.of("tools", List.of("search")))
                            .chain("start", "A");

            // When
            WorkflowIR workflow = compiler.compile(project.build()).workflow();

            // Then
            assertThat(workflow.agent("A").orElseThrow().getTools())
                    .extracting(ToolIR::name)
                    .containsExactly("search");
        }

        @Test
        void shouldRejectGlobalsReferencingEachOther() {
            assertThatThrownBy(
                            () ->
                                    WorkflowCompiler.create()
                                            .compile(
                                                    writingProject().build(),
                                                    Map.of("a", "{b}", "b", "{a}")))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("references itself");
        }

        @Test
        void shouldFailOnUnpairedTeleporter() {
            TestProjects project =
                    project().start("start").agent("A").teleporterOut("out", "lost")
                            .chain("start", "A", "out");

            assertThatThrownBy(() -> WorkflowCompiler.create().compile(project.build()))
                    .isInstanceOf(TeleporterException.class);
        }
    }
}
