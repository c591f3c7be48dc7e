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


package org.fireflyframework.bpmn.unit.service;

import org.fireflyframework.bpmn.core.conformance.ConformanceChecker;
import org.fireflyframework.bpmn.core.exception.ProcessAnalysisException;
import org.fireflyframework.bpmn.core.exception.ProcessNotFoundException;
import org.fireflyframework.bpmn.core.exception.ProcessValidationException;
import org.fireflyframework.bpmn.core.failure.FailureCategory;
import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.core.graph.GraphBuilder;
import org.fireflyframework.bpmn.core.observability.AnalysisEvents;
import org.fireflyframework.bpmn.core.observability.AnalysisStage;
import org.fireflyframework.bpmn.core.soundness.SoundnessAnalyzer;
import org.fireflyframework.bpmn.core.validation.StructuralValidator;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.Task;
import org.fireflyframework.bpmn.model.WorkflowProcess;
import org.fireflyframework.bpmn.model.builder.ProcessBuilder;
import org.fireflyframework.bpmn.registry.ProcessRegistry;
import org.fireflyframework.bpmn.service.WorkflowAnalysisService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WorkflowAnalysisServiceTest {

    private ProcessRegistry registry;
    private AnalysisEvents events;
    private WorkflowAnalysisService service;

    @BeforeEach
    void setUp() {
        registry = new ProcessRegistry();
        events = mock(AnalysisEvents.class);
        service = newService(true, true, true);
    }

    private WorkflowAnalysisService newService(boolean soundness, boolean conformance, boolean parallelScopes) {
        return new WorkflowAnalysisService(new GraphBuilder(), new StructuralValidator(), new SoundnessAnalyzer(),
                new ConformanceChecker(), registry, events, soundness, conformance, parallelScopes, 2);
    }

    private static WorkflowProcess linear() {
        return ProcessBuilder.process("Order")
                .start("S").task("A").end("E")
                .flow("S", "A", "E")
                .build();
    }

    private static WorkflowProcess nestedWithOrphans() {
        return ProcessBuilder.process("Nested")
                .start("S")
                .subProcess("Sub").start("IS").task("In").end("IE").task("Orphan").flow("IS", "In", "IE").add()
                .end("E").task("T")
                .flow("S", "Sub", "E")
                .build();
    }

    // ── Validation ────────────────────────────────────────────────

    @Test
    void validate_soundProcess_returnsEmptyList() {
        assertThat(service.validate(linear())).isEmpty();
    }

    @Test
    void validate_deadNodes_reportedScopeByScope() {
        assertThat(service.validate(nestedWithOrphans())).containsExactly(
                new WorkflowFailure.DeadNode(NodeId.of("T")),
                new WorkflowFailure.DeadNode(NodeId.of("Sub.Orphan")));
    }

    @Test
    void validate_isIdempotent() {
        WorkflowProcess process = nestedWithOrphans();

        assertThat(service.validate(process)).isEqualTo(service.validate(process));
    }

    @Test
    void validate_soundnessDisabled_skipsSoundnessFailures() {
        var withoutSoundness = newService(false, true, true);

        assertThat(withoutSoundness.validate(nestedWithOrphans())).isEmpty();
    }

    @Test
    void validateAsync_matchesSynchronousResult() {
        WorkflowProcess process = nestedWithOrphans();
        List<WorkflowFailure> expected = service.validate(process);

        StepVerifier.create(service.validateAsync(process))
                .assertNext(failures -> assertThat(failures).isEqualTo(expected))
                .verifyComplete();
    }

    @Test
    void validateAsync_sequentialMode_matchesSynchronousResult() {
        var sequential = newService(true, true, false);
        WorkflowProcess process = nestedWithOrphans();

        StepVerifier.create(sequential.validateAsync(process))
                .assertNext(failures -> assertThat(failures).isEqualTo(sequential.validate(process)))
                .verifyComplete();
    }

    @Test
    void validateAndThrow_invalidProcess_carriesFailures() {
        assertThatThrownBy(() -> service.validateAndThrow(nestedWithOrphans()))
                .isInstanceOf(ProcessValidationException.class)
                .satisfies(e -> {
                    var ex = (ProcessValidationException) e;
                    assertThat(ex.getProcessId()).isEqualTo("Nested");
                    assertThat(ex.getFailures()).hasSize(2);
                    assertThat(ex.getCode()).isEqualTo("BPMN_PROCESS_INVALID");
                });
        assertThatCode(() -> service.validateAndThrow(linear())).doesNotThrowAnyException();
    }

    @Test
    void analyze_reportsGraphSizeAndCategoryCounts() {
        var report = service.analyze(nestedWithOrphans());

        assertThat(report.processId()).isEqualTo("Nested");
        assertThat(report.isValid()).isFalse();
        assertThat(report.countOf(FailureCategory.SOUNDNESS)).isEqualTo(2);
        assertThat(report.scopeCount()).isEqualTo(2);
        assertThat(report.nodeCount()).isEqualTo(8);
        assertThat(report.edgeCount()).isEqualTo(4);
        assertThat(report.duration()).isNotNegative();
    }

    // ── Events ────────────────────────────────────────────────────

    @Test
    void validate_emitsLifecycleEventsInOrder() {
        service.validate(nestedWithOrphans());

        InOrder order = inOrder(events);
        order.verify(events).onAnalysisStarted(eq("Nested"), anyString());
        order.verify(events).onStageCompleted(eq("Nested"), anyString(), eq(AnalysisStage.BUILD), eq(0), anyLong());
        order.verify(events).onStageCompleted(eq("Nested"), anyString(), eq(AnalysisStage.STRUCTURE), eq(0), anyLong());
        order.verify(events).onStageCompleted(eq("Nested"), anyString(), eq(AnalysisStage.SOUNDNESS), eq(2), anyLong());
        order.verify(events, times(2)).onFailureDetected(eq("Nested"), anyString(), any(WorkflowFailure.class));
        order.verify(events).onAnalysisCompleted(eq("Nested"), anyString(), eq(false), eq(2), anyLong());
        verify(events, never()).onAnalysisError(anyString(), anyString(), any());
    }

    @Test
    void validate_componentThrows_wrapsAndEmitsError() {
        var validator = mock(StructuralValidator.class);
        when(validator.validate(any())).thenThrow(new IllegalStateException("broken"));
        var failing = new WorkflowAnalysisService(new GraphBuilder(), validator, new SoundnessAnalyzer(),
                new ConformanceChecker(), registry, events);

        assertThatThrownBy(() -> failing.validate(linear()))
                .isInstanceOf(ProcessAnalysisException.class)
                .hasCauseInstanceOf(IllegalStateException.class)
                .extracting("code").isEqualTo("BPMN_ANALYSIS_FAILED");
        verify(events).onAnalysisError(eq("Order"), anyString(), any(IllegalStateException.class));
        verify(events, never()).onAnalysisCompleted(anyString(), anyString(), anyBoolean(), anyInt(), anyLong());
    }

    // ── Registry lookups ──────────────────────────────────────────

    @Test
    void validateById_usesRegisteredProcess() {
        registry.register(nestedWithOrphans());

        assertThat(service.validate("Nested")).hasSize(2);
        assertThatThrownBy(() -> service.validate("Missing")).isInstanceOf(ProcessNotFoundException.class);
    }

    @Test
    void validateById_withoutRegistry_throwsIllegalState() {
        var standalone = new WorkflowAnalysisService(new GraphBuilder(), new StructuralValidator(),
                new SoundnessAnalyzer(), new ConformanceChecker(), null, null);

        assertThatThrownBy(() -> standalone.validate("Order")).isInstanceOf(IllegalStateException.class);
        assertThat(standalone.validate(linear())).isEmpty();
    }

    // ── Conformance ───────────────────────────────────────────────

    @Test
    void checkConformance_reportsMissingIncarnationsAndEmitsEvent() {
        registry.register(linear());
        registry.register(ProcessBuilder.process("Reference")
                .start("S").task("Research").end("E").flow("S", "Research", "E").build());

        List<WorkflowFailure> failures = service.checkConformance("Order", "Reference");

        assertThat(failures).containsExactly(new WorkflowFailure.TaskNotIncarnated(NodeId.of("A")));
        verify(events).onConformanceChecked(eq("Order"), eq("Reference"), anyString(), eq(1), anyLong());
        verify(events).onFailureDetected(eq("Order"), anyString(), eq(failures.get(0)));
    }

    @Test
    void checkConformance_incarnatedConcrete_isConformant() {
        WorkflowProcess concrete = ProcessBuilder.process("Concrete")
                .start("S").element(Task.incarnating("Survey", "Research")).end("E")
                .flow("S", "Survey", "E")
                .build();
        WorkflowProcess reference = ProcessBuilder.process("Reference")
                .start("S").task("Research").end("E").flow("S", "Research", "E").build();

        assertThat(service.checkConformance(concrete, reference)).isEmpty();
    }

    @Test
    void checkConformance_disabled_returnsEmpty() {
        var disabled = newService(true, false, true);
        WorkflowProcess reference = ProcessBuilder.process("Reference")
                .start("S").task("Research").end("E").flow("S", "Research", "E").build();

        assertThat(disabled.checkConformance(linear(), reference)).isEmpty();
        verifyNoInteractions(events);
    }
}
