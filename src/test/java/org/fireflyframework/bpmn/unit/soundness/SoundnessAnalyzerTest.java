/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.bpmn.unit.soundness;

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.core.graph.GraphBuilder;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;
import org.fireflyframework.bpmn.core.soundness.SoundnessAnalyzer;
import org.fireflyframework.bpmn.model.*;
import org.fireflyframework.bpmn.model.builder.ProcessBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SoundnessAnalyzerTest {

    private GraphBuilder graphBuilder;
    private SoundnessAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        graphBuilder = new GraphBuilder();
        analyzer = new SoundnessAnalyzer();
    }

    private List<WorkflowFailure> analyze(WorkflowProcess process) {
        return analyzer.analyze(graphBuilder.build(process).graph());
    }

    private static List<NodeId> ids(String... values) {
        return java.util.Arrays.stream(values).map(NodeId::of).toList();
    }

    // ── Reachability ───────────────────────────────────────────────

    @Test
    void analyze_startToEnd_isSound() {
        WorkflowProcess process = ProcessBuilder.process("A")
                .start("S").end("E").flow("S", "E")
                .build();

        assertThat(analyze(process)).isEmpty();
    }

    @Test
    void analyze_isolatedTask_reportsExactlyOneDeadNode() {
        WorkflowProcess process = ProcessBuilder.process("B")
                .start("S").end("E").task("T").flow("S", "E")
                .build();

        assertThat(analyze(process)).containsExactly(new WorkflowFailure.DeadNode(NodeId.of("T")));
    }

    @Test
    void analyze_unreachableChain_reportsDeadNodesAndComponent() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").end("E").task("X").task("Y")
                .flow("S", "E")
                .flow("X", "Y")
                .build();

        assertThat(analyze(process)).containsExactly(
                new WorkflowFailure.DeadNode(NodeId.of("X")),
                new WorkflowFailure.DeadNode(NodeId.of("Y")),
                new WorkflowFailure.DisconnectedComponent(ids("X", "Y")));
    }

    @Test
    void analyze_eventSubProcessAndCompensationHandler_areRoots() {
        Task host = Task.generic("Book").withBoundaryEvents(List.of(
                Event.compensationBoundary("Comp", "Book", "Refund")));
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").element(host).element(Task.generic("Refund").asCompensation()).end("E")
                .flow("S", "Book", "E")
                .subProcess("OnCancel").triggeredByEvent()
                    .element(Event.messageCatchStart("CS", "cancel")).end("CE").flow("CS", "CE")
                    .add()
                .build();

        assertThat(analyze(process)).isEmpty();
    }

    @Test
    void analyze_noReachableEnd_reportsProcessNotSound() {
        WorkflowProcess process = ProcessBuilder.process("Stuck")
                .start("S").task("T").end("E")
                .flow("S", "T")
                .build();

        assertThat(analyze(process)).containsExactly(
                new WorkflowFailure.DeadNode(NodeId.of("E")),
                new WorkflowFailure.ProcessNotSound("no end event of \"Stuck\" is reachable from its start events."));
    }

    @Test
    void analyze_processNotSoundDisabled_reportsOnlyDeadNode() {
        WorkflowProcess process = ProcessBuilder.process("Stuck")
                .start("S").task("T").end("E")
                .flow("S", "T")
                .build();

        List<WorkflowFailure> failures = new SoundnessAnalyzer(false).analyze(graphBuilder.build(process).graph());

        assertThat(failures).containsExactly(new WorkflowFailure.DeadNode(NodeId.of("E")));
    }

    @Test
    void analyze_branchThatNeverCompletes_reportsStuckNodes() {
        WorkflowProcess process = ProcessBuilder.process("Leak")
                .start("S").split("G", GatewayKind.EXCLUSIVE).task("Ok").task("Lost").end("E")
                .flow(FlowTarget.element("S"), FlowTarget.element("G"), FlowTarget.block(new FlowBlock(List.of(
                        SequenceFlow.of("b1", FlowTarget.element("Ok", FlowCondition.expression("ok")), FlowTarget.element("E")),
                        SequenceFlow.of("b2", FlowTarget.element("Lost", FlowCondition.otherwise()))))))
                .build();

        assertThat(analyze(process)).containsExactly(new WorkflowFailure.ProcessNotSound(
                "nodes Lost of \"Leak\" are reachable but can never reach an end event."));
    }

    // ── Cycles ─────────────────────────────────────────────────────

    @Test
    void analyze_cycleWithoutExit_reportsInfiniteLoop() {
        WorkflowProcess process = ProcessBuilder.process("D")
                .task("A").task("B").task("C")
                .flow("A", "B", "C", "A")
                .build();

        assertThat(analyze(process)).containsExactly(new WorkflowFailure.InfiniteLoop(ids("A", "B", "C", "A")));
    }

    @Test
    void analyze_cycleWithExclusiveExit_isNotInfinite() {
        WorkflowProcess process = ProcessBuilder.process("Retry")
                .start("S").task("A").split("G", GatewayKind.EXCLUSIVE).end("E")
                .flow("S", "A", "G", "E")
                .flow("G", "A")
                .build();

        assertThat(analyze(process)).isEmpty();
    }

    @Test
    void analyze_cycleLeftThroughBoundaryEvent_isNotInfinite() {
        Task polling = Task.generic("Poll").withBoundaryEvents(List.of(
                Event.boundary("Timeout", new EventTrigger.Timer("PT1H"))));
        WorkflowProcess process = ProcessBuilder.process("Polling")
                .start("S").element(polling).task("Check").end("E")
                .flow("S", "Poll", "Check", "Poll")
                .flow("Timeout", "E")
                .build();

        assertThat(analyze(process)).isEmpty();
    }

    // ── Synchronisation ────────────────────────────────────────────

    @Test
    void analyze_parallelSplitClosedByXorMerge_reportsLackOfSync() {
        WorkflowProcess process = ProcessBuilder.process("C")
                .split("PS", GatewayKind.PARALLEL).task("X").task("Y").merge("M", GatewayKind.EXCLUSIVE)
                .flow("PS", "X", "M")
                .flow("PS", "Y", "M")
                .build();

        assertThat(analyze(process)).containsExactly(new WorkflowFailure.LackOfSync(NodeId.of("M")));
    }

    @Test
    void analyze_parallelSplitClosedByParallelMerge_isSound() {
        WorkflowProcess process = ProcessBuilder.process("Fork")
                .start("S").split("PS", GatewayKind.PARALLEL).task("X").task("Y")
                .merge("PM", GatewayKind.PARALLEL).end("E")
                .flow("S", "PS", "X", "PM", "E")
                .flow("PS", "Y", "PM")
                .build();

        assertThat(analyze(process)).isEmpty();
    }

    @Test
    void analyze_exclusiveSplitClosedByParallelMerge_reportsSyncDeadlock() {
        WorkflowProcess process = ProcessBuilder.process("Deadlock")
                .start("S").split("G", GatewayKind.EXCLUSIVE).task("A").task("B")
                .merge("J", GatewayKind.PARALLEL).end("E")
                .flow("S", "G", "A", "J", "E")
                .flow("G", "B", "J")
                .build();

        assertThat(analyze(process)).containsExactly(new WorkflowFailure.SyncDeadlock(NodeId.of("J")));
    }

    @Test
    void analyze_parallelMergeFedFromConditionalBranch_reportsSyncDeadlock() {
        WorkflowProcess process = ProcessBuilder.process("Partial")
                .start("S").split("PS", GatewayKind.PARALLEL).task("A").task("B")
                .split("X", GatewayKind.EXCLUSIVE).task("C")
                .merge("J", GatewayKind.PARALLEL).end("E")
                .flow("S", "PS", "A", "J", "E")
                .flow("PS", "B", "X", "C", "J")
                .flow("X", "E")
                .build();

        assertThat(analyze(process)).contains(new WorkflowFailure.SyncDeadlock(NodeId.of("J")));
    }

    @Test
    void analyze_reworkLoopInsideParallelBranch_isSound() {
        WorkflowProcess process = ProcessBuilder.process("Rework")
                .start("S").split("PS", GatewayKind.PARALLEL).merge("LM", GatewayKind.EXCLUSIVE).task("X")
                .split("LS", GatewayKind.EXCLUSIVE).task("Y").merge("PM", GatewayKind.PARALLEL).end("E")
                .flow("S", "PS", "LM", "X", "LS", "PM", "E")
                .flow("LS", "LM")
                .flow("PS", "Y", "PM")
                .build();

        assertThat(analyze(process)).isEmpty();
    }

    @Test
    void analyze_reworkLoopInsideParallelBranchClosedByXor_reportsLackOfSync() {
        WorkflowProcess process = ProcessBuilder.process("Rework")
                .start("S").split("PS", GatewayKind.PARALLEL).merge("LM", GatewayKind.EXCLUSIVE).task("X")
                .split("LS", GatewayKind.EXCLUSIVE).task("Y").merge("M", GatewayKind.EXCLUSIVE).end("E")
                .flow("S", "PS", "LM", "X", "LS", "M", "E")
                .flow("LS", "LM")
                .flow("PS", "Y", "M")
                .build();

        assertThat(analyze(process)).containsExactly(new WorkflowFailure.LackOfSync(NodeId.of("M")));
    }

    @Test
    void analyze_veryLongChain_doesNotExhaustTheStack() {
        int length = 20_000;
        ProcessBuilder builder = ProcessBuilder.process("Long").start("S");
        String[] path = new String[length + 2];
        path[0] = "S";
        for (int i = 0; i < length; i++) {
            builder.task("T" + i);
            path[i + 1] = "T" + i;
        }
        path[length + 1] = "E";
        WorkflowProcess process = builder.end("E").flow(path).build();

        assertThatCode(() -> analyze(process)).doesNotThrowAnyException();
        assertThat(analyze(process)).isEmpty();
    }

    // ── Scopes ─────────────────────────────────────────────────────

    @Test
    void analyzeScope_reportsQualifiedIdsOfNestedScope() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").end("E")
                .subProcess("Sub").start("SS").end("SE").task("Orphan").flow("SS", "SE").add()
                .flow("S", "Sub", "E")
                .build();
        ProcessGraph graph = graphBuilder.build(process).graph();

        assertThat(analyzer.analyzeScope(graph, 0)).isEmpty();
        assertThat(analyzer.analyzeScope(graph, 1)).containsExactly(new WorkflowFailure.DeadNode(NodeId.of("Sub.Orphan")));
    }

    @Test
    void analyze_adHocBody_skipsReachability() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").end("E")
                .subProcess("Adhoc").adHoc("all done").task("One").task("Two").add()
                .flow("S", "Adhoc", "E")
                .build();

        assertThat(analyze(process)).isEmpty();
    }

    @Test
    void analyze_sameGraphTwice_isIdempotent() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").end("E").task("T").task("U")
                .flow("S", "E").flow("T", "U", "T")
                .build();
        ProcessGraph graph = graphBuilder.build(process).graph();

        assertThat(analyzer.analyze(graph)).isEqualTo(analyzer.analyze(graph));
    }
}
