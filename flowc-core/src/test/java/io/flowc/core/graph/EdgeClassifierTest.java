package io.flowc.core.graph;

import static org.assertj.core.api.Assertions.assertThat;

import io.flowc.core.graph.EdgeClassifier.EdgeKey;
import io.flowc.core.graph.EdgeClassifier.Role;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EdgeClassifierTest {

    private final EdgeClassifier classifier = new EdgeClassifier();

    private Role role(NodeKind source, String sourcePort, NodeKind target, String targetPort) {
        return classifier.role(new EdgeKey(source, sourcePort, target, targetPort));
    }

    @Nested
    class Roles {

        @Test
        void shouldClassifyLoopBodyPortBeforeAnythingElse() {
            assertThat(role(NodeKind.LOOP, "body", NodeKind.AGENT, "instruction"))
                    .isEqualTo(Role.LOOP_BODY);
        }

        @Test
        void shouldClassifyTeleporterPair() {
            assertThat(role(NodeKind.TELEPORTER_OUT, null, NodeKind.TELEPORTER_IN, null))
                    .isEqualTo(Role.TELEPORT);
        }

        @Test
        void shouldClassifyConfigurationNodesAsData() {
            assertThat(role(NodeKind.VARIABLE, null, NodeKind.AGENT, null)).isEqualTo(Role.DATA);
            assertThat(role(NodeKind.CUSTOM, null, NodeKind.AGENT, null)).isEqualTo(Role.DATA);
            assertThat(role(NodeKind.AGENT, null, NodeKind.CUSTOM, null)).isEqualTo(Role.DATA);
        }

        @ParameterizedTest
        @ValueSource(strings = {"instruction", "tools", "input_schema", "output_schema", "context"})
        void shouldClassifyConfigurationPortsAsData(String port) {
            assertThat(role(NodeKind.AGENT, null, NodeKind.AGENT, port)).isEqualTo(Role.DATA);
        }

        @Test
        void shouldClassifyCallbackPortAsData() {
            assertThat(role(NodeKind.AGENT, "before_model_callback", NodeKind.AGENT, null))
                    .isEqualTo(Role.DATA);
        }

        @ParameterizedTest
        @ValueSource(strings = {"condition", "condition:approved"})
        void shouldClassifyConditionPorts(String port) {
            assertThat(role(NodeKind.AGENT, port, NodeKind.AGENT, null))
                    .isEqualTo(Role.CONDITIONAL);
        }

        @Test
        void shouldFallBackToFlow() {
            assertThat(role(NodeKind.START, null, NodeKind.AGENT, null)).isEqualTo(Role.FLOW);
            assertThat(role(NodeKind.AGENT, "output", NodeKind.END, "input")).isEqualTo(Role.FLOW);
        }
    }

    @Nested
    class Semantics {

        @Test
        void shouldMakeFlowParallelOnlyWithFanOut() {
            assertThat(classifier.semantics(Role.FLOW, 1)).isEqualTo(EdgeSemantics.SEQUENTIAL);
            assertThat(classifier.semantics(Role.FLOW, 2))
                    .isEqualTo(EdgeSemantics.PARALLEL_BRANCH);
        }

        @Test
        void shouldKeepConditionalRegardlessOfFanOut() {
            assertThat(classifier.semantics(Role.CONDITIONAL, 3))
                    .isEqualTo(EdgeSemantics.CONDITIONAL);
        }

        @Test
        void shouldTreatLoopBodyAsSequential() {
            assertThat(classifier.semantics(Role.LOOP_BODY, 0))
                    .isEqualTo(EdgeSemantics.SEQUENTIAL);
        }

        @Test
        void shouldNeverTreatDataAsControl() {
            assertThat(classifier.semantics(Role.DATA, 5).isControl()).isFalse();
        }
    }
}
