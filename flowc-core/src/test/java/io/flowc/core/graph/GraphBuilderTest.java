package io.flowc.core.graph;

import static io.flowc.core.TestProjects.project;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowc.core.TestProjects;
import io.flowc.core.exception.CompilationException;
import io.flowc.core.exception.TeleporterException;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GraphBuilderTest {

    private static WorkflowGraph build(TestProjects project) throws CompilationException {
        return new GraphBuilder().build(new FlowParser().parse(project.build()));
    }

    private static GraphEdge edge(WorkflowGraph graph, String source, String target) {
        return graph.get(source).outgoing().stream()
                .filter(e -> e.targetId().equals(target))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    class Classification {

        @Test
        void shouldMarkFanOutEdgesAsParallelBranches() throws Exception {
            // Given
            TestProjects project =
                    project().start("start").agent("A").agent("B").agent("C")
                            .chain("start", "A")
                            .edge("A", "B")
                            .edge("A", "C");

            // When
            WorkflowGraph graph = build(project);

            // Then
            assertThat(edge(graph, "start", "A").semantics()).isEqualTo(EdgeSemantics.SEQUENTIAL);
            assertThat(edge(graph, "A", "B").semantics())
                    .isEqualTo(EdgeSemantics.PARALLEL_BRANCH);
            assertThat(edge(graph, "A", "C").semantics())
                    .isEqualTo(EdgeSemantics.PARALLEL_BRANCH);
        }

        @Test
        void shouldNotCountDataEdgesTowardFanOut() throws Exception {
            // Given
            TestProjects project =
                    project().start("start").agent("A").agent("B")
                            .custom("cb", "callback", Map.of("code", "print('hi')"))
                            .chain("start", "A", "B")
                            .edge("A", "after_agent_callback", "cb", null);

            // When
            WorkflowGraph graph = build(project);

            // Then
            assertThat(edge(graph, "A", "B").semantics()).isEqualTo(EdgeSemantics.SEQUENTIAL);
            assertThat(edge(graph, "A", "cb").semantics()).isEqualTo(EdgeSemantics.DATA);
        }

        @Test
        void shouldExtractConditionLabels() throws Exception {
            // Given
            TestProjects project =
                    project().start("start").agent("A").agent("B").agent("C")
                            .chain("start", "A")
                            .edge("A", "condition:yes", "B", null)
                            .edge("A", "condition", "C", null);

            // When
            WorkflowGraph graph = build(project);

            // Then
            assertThat(edge(graph, "A", "B").condition()).isEqualTo("yes");
            assertThat(edge(graph, "A", "C").condition()).isEqualTo("condition");
        }

        @Test
        void shouldRejectEdgeToUnknownNode() {
            TestProjects project = project().agent("A").edge("A", "ghost");

            assertThatThrownBy(() -> build(project))
                    .isInstanceOf(CompilationException.class)
                    .hasMessageContaining("references unknown target node 'ghost'");
        }
    }

    @Nested
    class Teleporters {

        @Test
        void shouldSynthesizeTeleportEdgeForPairedChannel() throws Exception {
            // Given
            TestProjects project =
                    project().start("start").teleporterOut("out", "handoff")
                            .chain("start", "out")
                            .region("second")
                            .teleporterIn("in", "handoff").agent("B")
                            .chain("in", "B");

            // When
            WorkflowGraph graph = build(project);

            // Then
            assertThat(graph.teleporterPairs())
                    .containsExactly(new TeleporterPair("out", "in", "handoff"));
            GraphEdge teleport = edge(graph, "out", "in");
            assertThat(teleport.id()).isEqualTo("teleport:handoff");
            assertThat(teleport.semantics()).isEqualTo(EdgeSemantics.TELEPORT);
        }

        @Test
        void shouldNotDuplicateDrawnTeleportEdge() throws Exception {
            // Given
            TestProjects project =
                    project().teleporterOut("out", "x").teleporterIn("in", "x").edge("out", "in");

            // When
            WorkflowGraph graph = build(project);

            // Then
            assertThat(graph.get("out").outgoing()).hasSize(1);
        }

        @Test
        void shouldRejectChannelWithTwoSenders() {
            TestProjects project =
                    project().teleporterOut("out1", "x").teleporterOut("out2", "x")
                            .teleporterIn("in", "x");

            assertThatThrownBy(() -> build(project))
                    .isInstanceOfSatisfying(
                            TeleporterException.class,
                            e -> assertThat(e.getChannel()).isEqualTo("x"))
                    .hasMessageContaining("found 2 out [out1, out2] and 1 in [in]");
        }

        @Test
        void shouldRejectChannelWithoutReceiver() {
            TestProjects project = project().teleporterOut("out", "lonely");

            assertThatThrownBy(() -> build(project)).isInstanceOf(TeleporterException.class);
        }

        @Test
        void shouldRejectDrawnEdgeBetweenDifferentChannels() {
            TestProjects project =
                    project().teleporterOut("out", "a").teleporterIn("in", "b").edge("out", "in");

            assertThatThrownBy(() -> build(project))
                    .isInstanceOf(TeleporterException.class)
                    .hasMessageContaining("connects teleporter channel 'a' to channel 'b'");
        }
    }

    @Nested
    class Loops {

        @Test
        void shouldMarkReturnEdgeAsBackEdge() throws Exception {
            // Given
            TestProjects project =
                    project().start("start").loop("L").agent("A").agent("B")
                            .chain("start", "L")
                            .edge("L", "body", "A", null)
                            .chain("A", "B", "L");

            // When
            WorkflowGraph graph = build(project);

            // Then
            LoopBody body = graph.loopBody("L").orElseThrow();
            assertThat(body.isWellFormed()).isTrue();
            assertThat(body.members()).containsExactlyInAnyOrder("A", "B");
            assertThat(edge(graph, "B", "L").backEdge()).isTrue();
            assertThat(edge(graph, "start", "L").backEdge()).isFalse();
            assertThat(edge(graph, "L", "A").loopBody()).isTrue();
        }

        @Test
        void shouldExcludeLoopBodyFromFlowSuccessors() throws Exception {
            // Given
            TestProjects project =
                    project().start("start").loop("L").agent("A").end("end")
                            .chain("start", "L")
                            .edge("L", "body", "A", null)
                            .edge("A", "L")
                            .edge("L", "end");

            // When
            WorkflowGraph graph = build(project);

            // Then
            assertThat(graph.flowSuccessors("L")).extracting(GraphNode::id).containsExactly("end");
            assertThat(graph.forwardSuccessors("L"))
                    .extracting(GraphNode::id)
                    .containsExactlyInAnyOrder("A", "end");
        }
    }

    @Nested
    class Entries {

        @Test
        void shouldCollectEntriesInLayoutOrder() throws Exception {
            // Given
            TestProjects project =
                    project().agent("late").agent("early").start("start")
                            .at("late", 0, 500)
                            .at("early", 0, 10)
                            .at("start", 0, 0)
                            .chain("start", "late");

            // When
            WorkflowGraph graph = build(project);

            // Then
            assertThat(graph.entryNodes()).extracting(GraphNode::id).containsExactly("start", "early");
        }

        @Test
        void shouldTreatTriggerUserInputAsEntry() throws Exception {
            // Given
            TestProjects project =
                    project().userInput("ask", true).userInput("later", false).agent("A")
                            .chain("ask", "A");

            // When
            WorkflowGraph graph = build(project);

            // Then
            assertThat(graph.entryNodes()).extracting(GraphNode::id).containsExactly("ask");
        }

        @Test
        void shouldFreezeGraph() throws Exception {
            WorkflowGraph graph = build(project().agent("A"));

            assertThat(graph.isFrozen()).isTrue();
            assertThatThrownBy(() -> graph.get("A").incoming().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }
}
