package io.flowc.core.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowc.core.ir.AgentIR;
import io.flowc.core.ir.AgentKind;
import io.flowc.core.ir.CallbackIR;
import io.flowc.core.ir.CallbackPhase;
import io.flowc.core.ir.SchemaIR;
import io.flowc.core.ir.ToolIR;
import io.flowc.core.ir.WorkflowIR;
import io.flowc.core.ir.WorkflowMetadata;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SubstitutionTest {

    private final Substitution substitution = Substitution.of(Map.of("topic", "rivers"));

    private static AgentIR leaf(String id, String instruction) {
        return AgentIR.builder().id(id).kind(AgentKind.LLM).instruction(instruction).build();
    }

    @Nested
    class Agents {

        @Test
        void shouldResolveInstructionDescriptionAndContextVariables() {
            // Given
            AgentIR agent =
                    leaf("a1", "Write about {topic}").toBuilder()
                            .description("Knows {topic}")
                            .contextVariables(Map.of("subject", "{topic}"))
                            .build();

            // When
            AgentIR resolved = substitution.apply(agent);

            // Then
            assertThat(resolved.getInstruction()).isEqualTo("Write about rivers");
            assertThat(resolved.getDescription()).isEqualTo("Knows rivers");
            assertThat(resolved.getContextVariables()).containsEntry("subject", "rivers");
        }

        @Test
        void shouldResolveEveryConfigurationField() {
            // Given
            Substitution models = Substitution.of(Map.of("m", "gemini-2.5-pro", "k", "draft"));
            AgentIR agent =
                    leaf("a1", "Use {m}").toBuilder()
                            .name("writer_{k}")
                            .model("{m}")
                            .outputKey("{k}")
                            .condition("{k}_ready")
                            .tools(
                                    List.of(
                                            new ToolIR(
                                                    "t_{k}",
                                                    ToolIR.Source.INLINE,
                                                    null,
                                                    "def f(): return '{m}'",
                                                    ToolIR.ErrorBehavior.FAIL_FAST)))
                            .callbacks(
                                    List.of(
                                            new CallbackIR(
                                                    CallbackPhase.BEFORE_MODEL,
                                                    "guard",
                                                    "log('{m}')",
                                                    null,
                                                    "cb")))
                            .outputSchema(new SchemaIR("{k}", null, "com.acme.{k}", "{k}", null))
                            .build();

            // When
            AgentIR resolved = models.apply(agent);

            // Then
            assertThat(resolved.getId()).isEqualTo("a1");
            assertThat(resolved.getName()).isEqualTo("writer_draft");
            assertThat(resolved.getInstruction()).isEqualTo("Use gemini-2.5-pro");
            assertThat(resolved.getModel()).isEqualTo("gemini-2.5-pro");
            assertThat(resolved.getOutputKey()).isEqualTo("draft");
            assertThat(resolved.getCondition()).isEqualTo("draft_ready");
            assertThat(resolved.getTools())
                    .singleElement()
                    .satisfies(
                            t -> {
                                assertThat(t.name()).isEqualTo("t_draft");
                                assertThat(t.code()).isEqualTo("def f(): return 'gemini-2.5-pro'");
                                assertThat(t.source()).isEqualTo(ToolIR.Source.INLINE);
                            });
            assertThat(resolved.getCallbacks())
                    .singleElement()
                    .satisfies(
                            c -> {
                                assertThat(c.code()).isEqualTo("log('gemini-2.5-pro')");
                                assertThat(c.sourceNodeId()).isEqualTo("cb");
                            });
            assertThat(resolved.getOutputSchema())
                    .isEqualTo(new SchemaIR("draft", null, "com.acme.draft", "draft", null));
        }

        @Test
        void shouldResolveNestedSettingsWithoutMutatingInput() {
            // Given
            Map<String, Object> settings =
                    Map.of("header", "{topic}", "list", List.of("{topic}", 3));
            AgentIR agent = leaf("a1", null).toBuilder().settings(settings).build();

            // When
            AgentIR resolved = substitution.apply(agent);

            // Then
            assertThat(resolved.getSettings())
                    .containsEntry("header", "rivers")
                    .containsEntry("list", List.of("rivers", 3));
            assertThat(agent.getSettings()).containsEntry("header", "{topic}");
        }

        @Test
        void shouldResolveSubagents() {
            // Given
            AgentIR sequence =
                    AgentIR.builder()
                            .id("seq_a1")
                            .kind(AgentKind.SEQUENTIAL)
                            .subagents(List.of(leaf("a1", "{topic}"), leaf("a2", "{other}")))
                            .build();

            // When
            AgentIR resolved = substitution.apply(sequence);

            // Then
            assertThat(resolved.getSubagents())
                    .extracting(AgentIR::getInstruction)
                    .containsExactly("rivers", "{other}");
        }

        @Test
        void shouldBeIdempotent() {
            AgentIR agent = leaf("a1", "About {topic} and {unknown}");

            AgentIR once = substitution.apply(agent);
            AgentIR twice = substitution.apply(once);

            assertThat(twice.getInstruction()).isEqualTo(once.getInstruction());
        }
    }

    @Nested
    class ValuesNamingOtherKeys {

        @Test
        void shouldResolveChainedValuesInOnePass() {
            // Given
            Substitution chained = Substitution.of(Map.of("a", "{b}", "b", "x"));

            // When
            String once = chained.substitute("v={a}");
            String twice = chained.substitute(once);

            // Then
            assertThat(once).isEqualTo("v=x");
            assertThat(twice).isEqualTo(once);
        }

        @Test
        void shouldBeIdempotentOnAgents() {
            // Given
            Substitution chained = Substitution.of(Map.of("a", "{b}", "b", "x"));
            AgentIR agent = leaf("a1", "{a}").toBuilder().model("{a}-model").build();

            // When
            AgentIR once = chained.apply(agent);
            AgentIR twice = chained.apply(once);

            // Then
            assertThat(once.getInstruction()).isEqualTo("x");
            assertThat(twice.getInstruction()).isEqualTo(once.getInstruction());
            assertThat(twice.getModel()).isEqualTo("x-model");
        }

        @Test
        void shouldRejectMutualReference() {
            assertThatThrownBy(() -> Substitution.of(Map.of("a", "{b}", "b", "{a}")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("references itself");
        }

        @Test
        void shouldRejectSelfReference() {
            assertThatThrownBy(() -> Substitution.of(Map.of("a", "{a}")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Global variable 'a'");
        }

        @Test
        void shouldRejectGrowingValue() {
            assertThatThrownBy(() -> Substitution.of(Map.of("a", "more {a}")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void shouldKeepEscapedPlaceholderNamingKey() {
            Substitution escaped = Substitution.of(Map.of("a", "{{a}}"));

            assertThat(escaped.substitute("{a}")).isEqualTo("{{a}}");
        }
    }

    @Nested
    class Workflows {

        @Test
        void shouldRebuildAgentIndexFromResolvedRoots() {
            // Given
            AgentIR root = leaf("a1", "{topic}");
            WorkflowIR workflow =
                    WorkflowIR.builder()
                            .metadata(new WorkflowMetadata("demo", "1.0"))
                            .roots(Map.of("main", root))
                            .allAgents(Map.of("a1", root))
                            .build();

            // When
            WorkflowIR resolved = substitution.apply(workflow);

            // Then
            assertThat(resolved.getRoots().get("main").getInstruction()).isEqualTo("rivers");
            assertThat(resolved.getAllAgents().get("a1"))
                    .isSameAs(resolved.getRoots().get("main"));
            assertThat(workflow.getRoots().get("main").getInstruction()).isEqualTo("{topic}");
        }

        @Test
        void shouldReturnSameWorkflowWhenNothingToSubstitute() {
            WorkflowIR workflow =
                    WorkflowIR.builder().metadata(new WorkflowMetadata("demo", "1.0")).build();

            assertThat(Substitution.of(Map.of()).apply(workflow)).isSameAs(workflow);
        }
    }
}
