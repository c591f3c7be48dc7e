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


package org.fireflyframework.bpmn.unit.validation;

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.core.graph.GraphBuilder;
import org.fireflyframework.bpmn.core.validation.StructuralValidator;
import org.fireflyframework.bpmn.model.*;
import org.fireflyframework.bpmn.model.builder.ProcessBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StructuralValidatorTest {

    private GraphBuilder graphBuilder;
    private StructuralValidator validator;

    @BeforeEach
    void setUp() {
        graphBuilder = new GraphBuilder();
        validator = new StructuralValidator();
    }

    private List<WorkflowFailure> validate(WorkflowProcess process) {
        return validator.validate(graphBuilder.build(process).graph());
    }

    private static NodeId id(String value) {
        return NodeId.of(value);
    }

    // ── Events ─────────────────────────────────────────────────────

    @Test
    void validate_startToEnd_hasNoFailures() {
        WorkflowProcess process = ProcessBuilder.process("Minimal")
                .start("S").end("E").flow("S", "E")
                .build();

        assertThat(validate(process)).isEmpty();
    }

    @Test
    void validate_throwingStartEvent_reported() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .element(Event.of("S", EventRole.START, EventDirection.THROW, null))
                .end("E").flow("S", "E")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.StartEventIsThrowing(id("S")));
    }

    @Test
    void validate_startEventWithIncomingFlow_reportsInDegree() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").task("T").end("E")
                .flow("S", "T", "E")
                .flow("T", "S")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.StartEventHasIncomingFlow(id("S"), 1));
    }

    @Test
    void validate_catchingEndEventWithOutgoingFlow_reportsBoth() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S")
                .element(Event.of("E", EventRole.END, EventDirection.CATCH, null))
                .task("T")
                .flow("S", "E", "T")
                .build();

        assertThat(validate(process)).containsExactly(
                new WorkflowFailure.EndEventHasOutgoingFlow(id("E")),
                new WorkflowFailure.EndEventIsCatching(id("E")));
    }

    @Test
    void validate_startWithoutEnd_reportsScope() {
        WorkflowProcess process = ProcessBuilder.process("NoEnd")
                .start("S").task("T").flow("S", "T")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.NoEndEventWithStartEvent(id("NoEnd")));
    }

    @Test
    void validate_cancelEndEventOutsideTransaction_reported() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S")
                .element(Event.of("E", EventRole.END, EventDirection.THROW, new EventTrigger.Cancel()))
                .flow("S", "E")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.CancelEventOutsideTransaction(id("E")));
    }

    @Test
    void validate_cancelEndEventInsideTransaction_accepted() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").end("E")
                .subProcess("Tx").transaction()
                    .start("TS")
                    .element(Event.of("TE", EventRole.END, EventDirection.THROW, new EventTrigger.Cancel()))
                    .flow("TS", "TE")
                    .add()
                .flow("S", "Tx", "E")
                .build();

        assertThat(validate(process)).isEmpty();
    }

    @Test
    void validate_cancelBoundaryOnPlainTask_reported() {
        Task host = Task.generic("T").withBoundaryEvents(List.of(
                Event.boundary("Abort", new EventTrigger.Cancel())));
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").element(host).end("E")
                .flow("S", "T", "E")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.CancelEventOutsideTransaction(id("Abort")));
    }

    // ── Gateways ───────────────────────────────────────────────────

    @Test
    void validate_splitWithSingleBranch_reportsDegrees() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").split("G", GatewayKind.EXCLUSIVE).task("T").end("E")
                .flow("S", "G", "T", "E")
                .build();

        assertThat(validate(process)).containsExactly(
                new WorkflowFailure.SplitGatewayTooFewOutgoingFlows(id("G"), 1, 1));
    }

    @Test
    void validate_mergeWithSingleInput_reportsDegrees() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").merge("M", GatewayKind.EXCLUSIVE).end("E")
                .flow("S", "M", "E")
                .build();

        assertThat(validate(process)).containsExactly(
                new WorkflowFailure.MergeGatewayTooFewIncomingFlows(id("M"), 1, 1));
    }

    @Test
    void validate_eventBasedMerge_reportedAsNotSplit() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").split("G", GatewayKind.PARALLEL).task("A").task("B")
                .merge("M", GatewayKind.EXCLUSIVE_EVENT).end("E")
                .flow("S", "G", "A", "M", "E")
                .flow("G", "B", "M")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.EventGatewayIsNotSplit(id("M")));
    }

    @Test
    void validate_eventGatewayMixingMessageEventsAndReceiveTasks_reported() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").split("G", GatewayKind.EXCLUSIVE_EVENT)
                .element(Event.messageCatch("Msg", "approved"))
                .element(Task.receive("R", "inbox", "rejected"))
                .merge("M", GatewayKind.EXCLUSIVE).end("E")
                .flow("S", "G", "Msg", "M", "E")
                .flow("G", "R", "M")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.EventGatewayMixedTargetTypes(id("G")));
    }

    @Test
    void validate_eventGatewayWithTimerAndMessage_accepted() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").split("G", GatewayKind.EXCLUSIVE_EVENT)
                .element(Event.messageCatch("Msg", "approved"))
                .element(Event.timerCatch("Wait", "PT1H"))
                .merge("M", GatewayKind.EXCLUSIVE).end("E")
                .flow("S", "G", "Msg", "M", "E")
                .flow("G", "Wait", "M")
                .build();

        assertThat(validate(process)).isEmpty();
    }

    // ── Subprocesses ───────────────────────────────────────────────

    @Test
    void validate_emptyAdHocSubProcess_reported() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").end("E")
                .subProcess("Adhoc").adHoc("done").add()
                .flow("S", "Adhoc", "E")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.AdHocSubProcessEmpty(id("Adhoc")));
    }

    @Test
    void validate_adHocSubProcessWithStartEvent_reported() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").end("E")
                .subProcess("Adhoc").adHoc("done").start("AS").task("Work").add()
                .flow("S", "Adhoc", "E")
                .build();

        assertThat(validate(process)).containsExactly(
                new WorkflowFailure.AdHocSubProcessHasStartOrEndEvent(id("Adhoc")),
                new WorkflowFailure.NoEndEventWithStartEvent(id("Adhoc")));
    }

    @Test
    void validate_eventSubProcessWithSequenceFlow_reported() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").end("E")
                .subProcess("Handler").triggeredByEvent()
                    .element(Event.messageCatchStart("HS", "cancel")).end("HE").flow("HS", "HE")
                    .add()
                .flow("S", "Handler", "E")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.EventSubProcessHasFlow(id("Handler")));
    }

    @Test
    void validate_eventSubProcessWithoutStartEvent_reportsCount() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").end("E").flow("S", "E")
                .subProcess("Handler").triggeredByEvent().task("X").add()
                .build();

        assertThat(validate(process)).containsExactly(
                new WorkflowFailure.EventSubProcessStartEventCount(id("Handler"), 0));
    }

    // ── Activities ─────────────────────────────────────────────────

    @Test
    void validate_compensationActivityInSequenceFlow_reported() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").element(Task.generic("Undo").asCompensation()).end("E")
                .flow("S", "Undo", "E")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.CompensationActivityHasFlow(id("Undo")));
    }

    @Test
    void validate_decimalLoopCount_reported() {
        Task looped = Task.generic("T").withLoop(
                LoopCharacteristic.MultiInstanceLoop.sequential(LoopCardinality.expression("1.5")));
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").element(looped).end("E").flow("S", "T", "E")
                .build();

        assertThat(validate(process)).containsExactly(new WorkflowFailure.LoopCountNotInteger(id("T"), "1.5"));
    }

    @Test
    void validate_booleanLoopCount_reported() {
        Task looped = Task.generic("T").withLoop(
                LoopCharacteristic.MultiInstanceLoop.sequential(LoopCardinality.expression("retries > 3")));
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").element(looped).end("E").flow("S", "T", "E")
                .build();

        assertThat(validate(process)).containsExactly(
                new WorkflowFailure.LoopCountNotInteger(id("T"), "retries > 3"));
    }

    @Test
    void validate_integerLoopCounts_accepted() {
        Task byLiteral = Task.generic("A").withLoop(
                LoopCharacteristic.MultiInstanceLoop.sequential(LoopCardinality.count(3)));
        Task byVariable = Task.generic("B").withLoop(
                LoopCharacteristic.MultiInstanceLoop.sequential(LoopCardinality.expression("reviewers.size()")));
        Task byCollection = Task.generic("C").withLoop(
                LoopCharacteristic.MultiInstanceLoop.parallelOver("orders"));
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").element(byLiteral).element(byVariable).element(byCollection).end("E")
                .flow("S", "A", "B", "C", "E")
                .build();

        assertThat(validate(process)).isEmpty();
    }

    @Test
    void validateScope_checksOnlyThatScope() {
        WorkflowProcess process = ProcessBuilder.process("P")
                .start("S").end("E")
                .subProcess("Sub").start("SS").task("T").flow("SS", "T").add()
                .flow("S", "Sub", "E")
                .build();
        var graph = graphBuilder.build(process).graph();

        assertThat(validator.validateScope(graph, 0)).isEmpty();
        assertThat(validator.validateScope(graph, 1))
                .containsExactly(new WorkflowFailure.NoEndEventWithStartEvent(id("Sub")));
    }
}
