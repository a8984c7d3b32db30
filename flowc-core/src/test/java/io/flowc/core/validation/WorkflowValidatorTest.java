package io.flowc.core.validation;

import static io.flowc.core.TestProjects.project;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowc.core.FlowcConfig;
import io.flowc.core.TestProjects;
import io.flowc.core.exception.ErrorLocation;
import io.flowc.core.exception.WorkflowValidationException;
import io.flowc.core.graph.FlowParser;
import io.flowc.core.graph.GraphBuilder;
import io.flowc.core.graph.WorkflowGraph;
import io.flowc.core.hierarchy.HierarchyBuilder;
import io.flowc.core.project.ProjectSnapshot;
import io.flowc.core.registry.CapabilityDefinition;
import io.flowc.core.registry.CapabilityRegistry;
import io.flowc.core.registry.DefaultCapabilityRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class WorkflowValidatorTest {

    private static ValidationResult validate(TestProjects project) throws Exception {
        return validate(project, CapabilityRegistry.empty(), new FlowcConfig());
    }

    private static ValidationResult validate(
            TestProjects project, CapabilityRegistry registry, FlowcConfig config)
            throws Exception {
        ProjectSnapshot snapshot = project.build();
        WorkflowGraph graph = new GraphBuilder().build(new FlowParser().parse(snapshot));
        return new WorkflowValidator(registry, config)
                .validate(graph, new HierarchyBuilder().build(graph), snapshot);
    }

    private static List<ValidationIssue> errorsOf(TestProjects project) {
        try {
            validate(project);
        } catch (WorkflowValidationException e) {
            return e.getResult().errors();
        } catch (Exception e) {
            throw new AssertionError("Unexpected failure", e);
        }
        throw new AssertionError("Expected validation to fail");
    }

    private static List<String> codes(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::code).toList();
    }

    @Nested
    class Cycles {

        private static final int LONG_CHAIN = 5000;

        private TestProjects longChain(boolean closed) {
            TestProjects project = project().start("start");
            List<String> ids = new ArrayList<>();
            ids.add("start");
            for (int i = 0; i < LONG_CHAIN; i++) {
                project.agent("A" + i, Map.of("output_key", "k" + i));
                ids.add("A" + i);
            }
            if (closed) {
                ids.add("A0");
            }
            return project.chain(ids.toArray(new String[0]));
        }

        @Test
        void shouldValidateLongChainWithoutExhaustingStack() throws Exception {
            // Given
            TestProjects project = longChain(false);

            // When
            ValidationResult result = validate(project);

            // Then
            assertThat(result.errors()).isEmpty();
        }

        @Test
        void shouldReportCycleClosingLongChain() {
            // Given
            TestProjects project = longChain(true);

            // When
            List<ValidationIssue> errors = errorsOf(project);

            // Then
            assertThat(codes(errors)).contains("cycle");
            assertThat(errors)
                    .filteredOn(i -> i.code().equals("cycle"))
                    .singleElement()
                    .satisfies(
                            issue ->
                                    assertThat(issue.message())
                                            .startsWith("Cycle outside of a loop body: A0 -> A1 -> ")
                                            .endsWith("A" + (LONG_CHAIN - 1) + " -> A0"));
        }

        @Test
        void shouldRejectCycleOutsideLoop() {
            // Given
            TestProjects project =
                    project().start("start").agent("A").agent("B")
                            .chain("start", "A", "B", "A");

            // When
            List<ValidationIssue> errors = errorsOf(project);

            // Then
            assertThat(errors)
                    .filteredOn(i -> i.code().equals("cycle"))
                    .singleElement()
                    .satisfies(
                            issue -> {
                                assertThat(issue.message())
                                        .isEqualTo("Cycle outside of a loop body: A -> B -> A");
                                assertThat(issue.location())
                                        .isEqualTo(ErrorLocation.node("main", "A"));
                            });
        }

        @Test
        void shouldRejectSelfLoop() {
            TestProjects project =
                    project().start("start").agent("A").chain("start", "A").edge("A", "A");

            assertThat(codes(errorsOf(project))).contains("cycle");
        }

        @Test
        void shouldAcceptCycleThroughLoopMarker() throws Exception {
            // Given
            TestProjects project =
                    project().start("start").loop("L").agent("A", Map.of("output_key", "draft"))
                            .agent("B", Map.of("output_key", "review"))
                            .chain("start", "L")
                            .edge("L", "body", "A", null)
                            .chain("A", "B", "L");

            // When
            ValidationResult result = validate(project);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.issues()).isEmpty();
        }
    }

    @Nested
    class References {

        @Test
        void shouldReportUnknownRegistryTool() {
            // Given
            TestProjects project =
                    project().start("start").agent("A", Map.of("tools", List.of("nope")))
                            .chain("start", "A");

            // When
            List<ValidationIssue> errors = errorsOf(project);

            // Then
            assertThat(errors)
                    .extracting(ValidationIssue::message)
                    .containsExactly("Missing tool reference 'nope' in 'A'");
        }

        @Test
        void shouldAcceptRegisteredCapabilities() throws Exception {
            // Given
            CapabilityRegistry registry =
                    new DefaultCapabilityRegistry(
                            List.of(
                                    CapabilityDefinition.tool("search", "Search"),
                                    CapabilityDefinition.callback("guard", "Guard"),
                                    CapabilityDefinition.schema("Report", "com.acme.Report")));
            TestProjects project =
                    project().start("start")
                            .agent(
                                    "A",
                                    Map.of(
                                            "tools", List.of("search"),
                                            "before_model_callback", "guard",
                                            "output_schema", "Report"))
                            .chain("start", "A");

            // When
            ValidationResult result = validate(project, registry, new FlowcConfig());

            // Then
            assertThat(result.isValid()).isTrue();
        }

        @Test
        void shouldReportMissingPromptFileWithLocation() {
            // Given
            TestProjects project =
                    project().start("start").agent("A")
                            .custom("p", "prompt", Map.of("file", "prompts/missing.md"))
                            .chain("start", "A")
                            .edge("p", null, "A", "instruction");

            // When
            List<ValidationIssue> errors = errorsOf(project);

            // Then
            assertThat(errors).singleElement().satisfies(
                    issue -> {
                        assertThat(issue.code()).isEqualTo("missing-reference");
                        assertThat(issue.message())
                                .isEqualTo("Missing prompt reference 'prompts/missing.md' in 'p'");
                        assertThat(issue.location().filePath()).isEqualTo("prompts/missing.md");
                    });
        }

        @Test
        void shouldReportMissingToolFile() {
            TestProjects project =
                    project().start("start").agent("A")
                            .custom("t", "tool", Map.of("file", "tools/gone.py"))
                            .chain("start", "A")
                            .edge("t", null, "A", "tools");

            assertThat(errorsOf(project))
                    .extracting(ValidationIssue::message)
                    .containsExactly("Missing tool file reference 'tools/gone.py' in 't'");
        }

        @Test
        void shouldNotCheckRefWhenInlineCodeIsPresent() throws Exception {
            TestProjects project =
                    project().start("start").agent("A")
                            .custom("cb", "callback", Map.of("code", "pass", "ref", "unknown"))
                            .chain("start", "A")
                            .edge("A", "after_agent_callback", "cb", null);

            assertThat(validate(project).isValid()).isTrue();
        }
    }

    @Nested
    class Structure {

        @Test
        void shouldRejectDuplicateAgentNames() {
            TestProjects project =
                    project().agent("A", Map.of("name", "writer"))
                            .agent("B", Map.of("name", "writer"))
                            .at("B", 100, 0);

            assertThat(errorsOf(project))
                    .extracting(ValidationIssue::message)
                    .containsExactly("Agent name 'writer' is used by 'A' and 'B'");
        }

        @Test
        void shouldRejectSecondStartInRegion() {
            TestProjects project =
                    project().start("s1").start("s2").agent("A").agent("B")
                            .chain("s1", "A")
                            .chain("s2", "B");

            assertThat(codes(errorsOf(project))).containsExactly("multiple-start");
        }

        @Test
        void shouldReportEveryErrorInOnePass() {
            TestProjects project =
                    project().start("start")
                            .agent("A", Map.of("name", "same", "tools", List.of("missing")))
                            .agent("B", Map.of("name", "same"))
                            .chain("start", "A")
                            .chain("start", "B");

            assertThat(codes(errorsOf(project)))
                    .containsExactlyInAnyOrder("missing-reference", "duplicate-name");
        }

        @Test
        void shouldRaiseStructuralIssuesAsErrors() {
            TestProjects project =
                    project().start("start").loop("L").agent("A").chain("start", "L", "A");

            assertThat(codes(errorsOf(project))).containsExactly("loop-body");
        }
    }

    @Nested
    class Warnings {

        @Test
        void shouldWarnAboutUnreachableAgent() throws Exception {
            // Given
            TestProjects project =
                    project().start("start").agent("A").join("J").agent("Z")
                            .chain("start", "A")
                            .chain("J", "Z");

            // When
            ValidationResult result = validate(project);

            // Then
            assertThat(result.isValid()).isTrue();
            assertThat(result.warnings())
                    .extracting(ValidationIssue::message)
                    .containsExactly("Agent 'Z' is not reachable from any entry node");
        }

        @Test
        void shouldPromoteWarningsWhenConfigured() {
            // Given
            TestProjects project =
                    project().start("start").agent("A", Map.of("temperature", 2.5))
                            .chain("start", "A");
            FlowcConfig config = FlowcConfig.builder().failOnWarnings(true).build();

            // When / Then
            assertThatThrownBy(() -> validate(project, CapabilityRegistry.empty(), config))
                    .isInstanceOfSatisfying(
                            WorkflowValidationException.class,
                            e -> assertThat(codes(e.getResult().errors()))
                                    .containsExactly("temperature-range"));
        }

        @Test
        void shouldWarnAboutTemperatureOutOfRange() throws Exception {
            TestProjects project =
                    project().start("start").agent("A", Map.of("temperature", -0.1))
                            .chain("start", "A");

            assertThat(codes(validate(project).warnings())).containsExactly("temperature-range");
        }

        @Test
        void shouldWarnAboutLoopWithoutAgent() throws Exception {
            // Given
            TestProjects project =
                    project().start("start").loop("L").join("J")
                            .chain("start", "L")
                            .edge("L", "body", "J", null)
                            .edge("J", "L");

            // When
            ValidationResult result = validate(project);

            // Then
            assertThat(codes(result.warnings())).containsExactly("empty-loop");
        }

        @Test
        void shouldWarnAboutUnconnectedConfigurationNode() throws Exception {
            TestProjects project =
                    project().start("start").agent("A")
                            .custom("ctx", "context", Map.of("content", "facts"))
                            .chain("start", "A");

            assertThat(validate(project).warnings())
                    .extracting(ValidationIssue::message)
                    .containsExactly("custom node 'ctx' is not connected");
        }

        @Test
        void shouldWarnWhenAgentFeedsAgentWithoutOutputKey() throws Exception {
            TestProjects project =
                    project().start("start").agent("A").agent("B", Map.of("output_key", "b"))
                            .chain("start", "A", "B");

            assertThat(validate(project).warnings())
                    .extracting(ValidationIssue::message)
                    .containsExactly("Agent 'A' feeds another agent but has no output_key");
        }
    }
}
