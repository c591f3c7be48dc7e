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


package org.fireflyframework.bpmn.integration;

import org.fireflyframework.bpmn.core.conformance.ConformanceChecker;
import org.fireflyframework.bpmn.core.failure.FailureCategory;
import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.core.graph.GraphBuilder;
import org.fireflyframework.bpmn.core.observability.AnalysisLoggerEvents;
import org.fireflyframework.bpmn.core.soundness.SoundnessAnalyzer;
import org.fireflyframework.bpmn.core.topology.ProcessGraphRenderer;
import org.fireflyframework.bpmn.core.validation.StructuralValidator;
import org.fireflyframework.bpmn.model.CallActivity;
import org.fireflyframework.bpmn.model.FlowBlock;
import org.fireflyframework.bpmn.model.FlowCondition;
import org.fireflyframework.bpmn.model.FlowTarget;
import org.fireflyframework.bpmn.model.GatewayKind;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.SequenceFlow;
import org.fireflyframework.bpmn.model.Task;
import org.fireflyframework.bpmn.model.WorkflowProcess;
import org.fireflyframework.bpmn.model.builder.ProcessBuilder;
import org.fireflyframework.bpmn.registry.ProcessRegistry;
import org.fireflyframework.bpmn.service.WorkflowAnalysisService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end analysis of small review processes through {@link WorkflowAnalysisService}.
 */
class WorkflowAnalysisIntegrationTest {

    private ProcessRegistry registry;
    private WorkflowAnalysisService service;

    @BeforeEach
    void setUp() {
        registry = new ProcessRegistry();
        service = new WorkflowAnalysisService(new GraphBuilder(), new StructuralValidator(), new SoundnessAnalyzer(),
                new ConformanceChecker(), registry, new AnalysisLoggerEvents());
    }

    private static WorkflowProcess reference() {
        return ProcessBuilder.process("Review")
                .start("S").split("Fork", GatewayKind.PARALLEL).task("Research").task("Draft")
                .merge("Join", GatewayKind.PARALLEL).end("E")
                .flow("S", "Fork", "Research", "Join", "E")
                .flow("Fork", "Draft", "Join")
                .build();
    }

    @Test
    void referenceProcess_isSoundAndRendered() {
        WorkflowProcess process = reference();

        var report = service.analyze(process);

        assertThat(report.isValid()).isTrue();
        assertThat(report.nodeCount()).isEqualTo(6);
        assertThat(report.edgeCount()).isEqualTo(6);

        var graph = new GraphBuilder().build(process).graph();
        assertThat(ProcessGraphRenderer.toDot(graph, report.failures())).contains("\"Fork\" -> \"Research\";");
    }

    @Test
    void guardedChoiceWithMismatchedMerge_reportsLackOfSync() {
        WorkflowProcess process = ProcessBuilder.process("Approval")
                .start("S").split("Fork", GatewayKind.PARALLEL).task("A").task("B")
                .merge("M", GatewayKind.EXCLUSIVE).end("E")
                .flow("S", "Fork", "A", "M", "E")
                .flow("Fork", "B", "M")
                .build();

        List<WorkflowFailure> failures = service.validate(process);

        assertThat(failures).contains(new WorkflowFailure.LackOfSync(NodeId.of("M")));
        assertThat(failures).allMatch(f -> f.category() == FailureCategory.SOUNDNESS);
    }

    @Test
    void blockWithDefaultBranch_isSound() {
        WorkflowProcess process = ProcessBuilder.process("Triage")
                .start("S").split("G", GatewayKind.EXCLUSIVE).task("Fast").task("Slow")
                .merge("M", GatewayKind.EXCLUSIVE).end("E")
                .flow(FlowTarget.element("S"), FlowTarget.element("G"), FlowTarget.block(new FlowBlock(List.of(
                        SequenceFlow.of("b1", FlowTarget.element("Fast", FlowCondition.expression("urgent")),
                                FlowTarget.element("M")),
                        SequenceFlow.of("b2", FlowTarget.element("Slow", FlowCondition.otherwise()),
                                FlowTarget.element("M"))))))
                .flow("M", "E")
                .build();

        assertThat(service.validate(process)).isEmpty();
    }

    @Test
    void registeredProcesses_resolveCallsAndConformance() {
        registry.register(reference());
        registry.register(ProcessBuilder.process("Billing").start("S").end("E").flow("S", "E").build());
        registry.register(ProcessBuilder.process("Concrete")
                .start("S").split("Fork", GatewayKind.PARALLEL)
                .element(Task.incarnating("Survey", "Research"))
                .element(Task.incarnating("Write", "Draft"))
                .merge("Join", GatewayKind.EXCLUSIVE)
                .element(CallActivity.of("Bill", "Billing"))
                .end("E")
                .flow("S", "Fork", "Survey", "Join", "Bill", "E")
                .flow("Fork", "Write", "Join")
                .build());

        assertThat(service.validate("Concrete"))
                .noneMatch(f -> f instanceof WorkflowFailure.CalledElementNotFound)
                .contains(new WorkflowFailure.LackOfSync(NodeId.of("Join")));

        List<WorkflowFailure> conformance = service.checkConformance("Concrete", "Review");
        assertThat(conformance).singleElement()
                .isInstanceOfSatisfying(WorkflowFailure.ParallelBranchesClosedWithXor.class,
                        f -> assertThat(f.mergeGatewayId()).isEqualTo(NodeId.of("Join")));
    }

    @Test
    void asyncValidation_matchesSyncAcrossScopes() {
        WorkflowProcess process = ProcessBuilder.process("Nested")
                .start("S")
                .subProcess("Pay").start("PS").task("Charge").end("PE").task("Refund").flow("PS", "Charge", "PE").add()
                .subProcess("Ship").start("SS").end("SE").task("Pack").flow("SS", "Pack").add()
                .end("E")
                .flow("S", "Pay", "Ship", "E")
                .build();
        List<WorkflowFailure> expected = service.validate(process);

        assertThat(expected).contains(new WorkflowFailure.DeadNode(NodeId.of("Pay.Refund")));
        StepVerifier.create(service.validateAsync(process))
                .assertNext(failures -> assertThat(failures).containsExactlyElementsOf(expected))
                .verifyComplete();
    }
}
