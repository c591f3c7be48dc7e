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


package org.fireflyframework.bpmn.service;

import org.fireflyframework.bpmn.core.conformance.ConformanceChecker;
import org.fireflyframework.bpmn.core.exception.ProcessAnalysisException;
import org.fireflyframework.bpmn.core.exception.ProcessValidationException;
import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import org.fireflyframework.bpmn.core.graph.BuildResult;
import org.fireflyframework.bpmn.core.graph.GraphBuilder;
import org.fireflyframework.bpmn.core.graph.ProcessGraph;
import org.fireflyframework.bpmn.core.graph.Scope;
import org.fireflyframework.bpmn.core.observability.AnalysisEvents;
import org.fireflyframework.bpmn.core.observability.AnalysisStage;
import org.fireflyframework.bpmn.core.report.AnalysisReport;
import org.fireflyframework.bpmn.core.soundness.SoundnessAnalyzer;
import org.fireflyframework.bpmn.core.validation.StructuralValidator;
import org.fireflyframework.bpmn.model.NodeId;
import org.fireflyframework.bpmn.model.WorkflowProcess;
import org.fireflyframework.bpmn.registry.ProcessRegistry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * Entry point for analysing workflow processes.
 *
 * <p>Runs the graph builder, the structural validator and the soundness analyzer
 * over a process and returns the failures in a stable order: build failures first,
 * then structural failures scope by scope, then soundness failures scope by scope.
 * Scopes are visited in declaration order, so {@link #validate} and
 * {@link #validateAsync} produce equal lists for the same input.
 */
@Slf4j
public class WorkflowAnalysisService {

    private final GraphBuilder graphBuilder;
    private final StructuralValidator structuralValidator;
    private final SoundnessAnalyzer soundnessAnalyzer;
    private final ConformanceChecker conformanceChecker;
    private final ProcessRegistry registry;
    private final AnalysisEvents events;
    private final boolean soundnessEnabled;
    private final boolean conformanceEnabled;
    private final boolean parallelScopes;
    private final int maxConcurrency;

    public WorkflowAnalysisService(GraphBuilder graphBuilder, StructuralValidator structuralValidator,
                                   SoundnessAnalyzer soundnessAnalyzer, ConformanceChecker conformanceChecker,
                                   ProcessRegistry registry, AnalysisEvents events) {
        this(graphBuilder, structuralValidator, soundnessAnalyzer, conformanceChecker, registry, events,
                true, true, true, 4);
    }

    public WorkflowAnalysisService(GraphBuilder graphBuilder, StructuralValidator structuralValidator,
                                   SoundnessAnalyzer soundnessAnalyzer, ConformanceChecker conformanceChecker,
                                   ProcessRegistry registry, AnalysisEvents events,
                                   boolean soundnessEnabled, boolean conformanceEnabled,
                                   boolean parallelScopes, int maxConcurrency) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder");
        this.structuralValidator = Objects.requireNonNull(structuralValidator, "structuralValidator");
        this.soundnessAnalyzer = Objects.requireNonNull(soundnessAnalyzer, "soundnessAnalyzer");
        this.conformanceChecker = Objects.requireNonNull(conformanceChecker, "conformanceChecker");
        this.registry = registry;
        this.events = events != null ? events : new AnalysisEvents() {};
        this.soundnessEnabled = soundnessEnabled;
        this.conformanceEnabled = conformanceEnabled;
        this.parallelScopes = parallelScopes;
        this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    // ── Validation ────────────────────────────────────────────────

    public List<WorkflowFailure> validate(WorkflowProcess process) {
        return run(process).failures();
    }

    /**
     * Validates a process previously added to the registry.
     *
     * @throws org.fireflyframework.bpmn.core.exception.ProcessNotFoundException if no such process is registered
     */
    public List<WorkflowFailure> validate(String processId) {
        return validate(requireRegistry().getProcess(processId));
    }

    /**
     * Same result as {@link #validate(WorkflowProcess)}, with each scope analysed on
     * {@link Schedulers#parallel()}. Per-scope results are merged in declaration order.
     */
    public Mono<List<WorkflowFailure>> validateAsync(WorkflowProcess process) {
        if (!parallelScopes) {
            return Mono.fromCallable(() -> validate(process));
        }
        return Mono.defer(() -> {
            String processId = process.id().value();
            String analysisId = newAnalysisId();
            Instant startedAt = Instant.now();
            events.onAnalysisStarted(processId, analysisId);

            BuildResult build = buildGraph(process, processId, analysisId);
            ProcessGraph graph = build.graph();
            long scopePhaseStart = System.nanoTime();

            return Flux.fromIterable(graph.scopes())
                    .flatMapSequential(scope -> Mono.fromCallable(() -> analyzeScope(graph, scope))
                            .subscribeOn(Schedulers.parallel()), maxConcurrency)
                    .collectList()
                    .map(results -> {
                        long elapsedMs = elapsedMs(scopePhaseStart);
                        List<WorkflowFailure> structural = new ArrayList<>();
                        List<WorkflowFailure> soundness = new ArrayList<>();
                        for (ScopeResult result : results) {
                            structural.addAll(result.structural());
                            soundness.addAll(result.soundness());
                        }
                        events.onStageCompleted(processId, analysisId, AnalysisStage.STRUCTURE, structural.size(), elapsedMs);
                        if (soundnessEnabled) {
                            events.onStageCompleted(processId, analysisId, AnalysisStage.SOUNDNESS, soundness.size(), elapsedMs);
                        }
                        List<WorkflowFailure> failures = new ArrayList<>(build.failures());
                        failures.addAll(structural);
                        failures.addAll(soundness);
                        return complete(processId, analysisId, startedAt, failures);
                    })
                    .doOnError(error -> events.onAnalysisError(processId, analysisId, error));
        });
    }

    /**
     * Validates the process and throws if any failure was found.
     *
     * @throws ProcessValidationException carrying every failure, in report order
     */
    public void validateAndThrow(WorkflowProcess process) {
        List<WorkflowFailure> failures = validate(process);
        if (!failures.isEmpty()) {
            throw new ProcessValidationException(process.id().value(), failures);
        }
    }

    public AnalysisReport analyze(WorkflowProcess process) {
        Outcome outcome = run(process);
        ProcessGraph graph = outcome.graph();
        return AnalysisReport.of(process.id().value(), outcome.analysisId(), outcome.failures(),
                graph.nodeCount(), graph.edgeCount(), graph.scopes().size(),
                outcome.startedAt(), Duration.between(outcome.startedAt(), Instant.now()));
    }

    // ── Conformance ───────────────────────────────────────────────

    /**
     * Checks a concrete process against the reference model it incarnates.
     * Build failures of either graph are not repeated here; {@link #validate} reports them.
     */
    public List<WorkflowFailure> checkConformance(WorkflowProcess concrete, WorkflowProcess reference) {
        String concreteId = concrete.id().value();
        String referenceId = reference.id().value();
        if (!conformanceEnabled) {
            log.debug("[bpmn-analysis] Conformance disabled, skipping '{}' against '{}'", concreteId, referenceId);
            return List.of();
        }
        String analysisId = newAnalysisId();
        long start = System.nanoTime();
        try {
            ProcessGraph concreteGraph = graphBuilder.build(concrete, processExists()).graph();
            ProcessGraph referenceGraph = graphBuilder.build(reference, processExists()).graph();
            List<WorkflowFailure> failures = conformanceChecker.check(concreteGraph, referenceGraph);
            failures.forEach(f -> events.onFailureDetected(concreteId, analysisId, f));
            events.onConformanceChecked(concreteId, referenceId, analysisId, failures.size(), elapsedMs(start));
            return List.copyOf(failures);
        } catch (RuntimeException e) {
            events.onAnalysisError(concreteId, analysisId, e);
            throw new ProcessAnalysisException("Conformance check of '" + concreteId + "' against '"
                    + referenceId + "' failed", "BPMN_ANALYSIS_FAILED", e);
        }
    }

    public List<WorkflowFailure> checkConformance(String concreteId, String referenceId) {
        ProcessRegistry processes = requireRegistry();
        return checkConformance(processes.getProcess(concreteId), processes.getProcess(referenceId));
    }

    // ── Internals ─────────────────────────────────────────────────

    private Outcome run(WorkflowProcess process) {
        String processId = process.id().value();
        String analysisId = newAnalysisId();
        Instant startedAt = Instant.now();
        events.onAnalysisStarted(processId, analysisId);
        try {
            BuildResult build = buildGraph(process, processId, analysisId);
            ProcessGraph graph = build.graph();
            List<WorkflowFailure> failures = new ArrayList<>(build.failures());

            long start = System.nanoTime();
            List<WorkflowFailure> structural = structuralValidator.validate(graph);
            events.onStageCompleted(processId, analysisId, AnalysisStage.STRUCTURE, structural.size(), elapsedMs(start));
            failures.addAll(structural);

            if (soundnessEnabled) {
                start = System.nanoTime();
                List<WorkflowFailure> soundness = soundnessAnalyzer.analyze(graph);
                events.onStageCompleted(processId, analysisId, AnalysisStage.SOUNDNESS, soundness.size(), elapsedMs(start));
                failures.addAll(soundness);
            }
            return new Outcome(analysisId, graph, complete(processId, analysisId, startedAt, failures), startedAt);
        } catch (RuntimeException e) {
            events.onAnalysisError(processId, analysisId, e);
            throw new ProcessAnalysisException("Analysis of process '" + processId + "' failed",
                    "BPMN_ANALYSIS_FAILED", e);
        }
    }

    private BuildResult buildGraph(WorkflowProcess process, String processId, String analysisId) {
        long start = System.nanoTime();
        BuildResult build = graphBuilder.build(process, processExists());
        events.onStageCompleted(processId, analysisId, AnalysisStage.BUILD, build.failures().size(), elapsedMs(start));
        return build;
    }

    private ScopeResult analyzeScope(ProcessGraph graph, Scope scope) {
        List<WorkflowFailure> structural = structuralValidator.validateScope(graph, scope.index());
        List<WorkflowFailure> soundness = soundnessEnabled
                ? soundnessAnalyzer.analyzeScope(graph, scope.index())
                : List.of();
        return new ScopeResult(structural, soundness);
    }

    private List<WorkflowFailure> complete(String processId, String analysisId, Instant startedAt,
                                           List<WorkflowFailure> failures) {
        failures.forEach(f -> events.onFailureDetected(processId, analysisId, f));
        long durationMs = Duration.between(startedAt, Instant.now()).toMillis();
        events.onAnalysisCompleted(processId, analysisId, failures.isEmpty(), failures.size(), durationMs);
        return List.copyOf(failures);
    }

    private Predicate<NodeId> processExists() {
        return registry != null ? registry::contains : id -> false;
    }

    private ProcessRegistry requireRegistry() {
        if (registry == null) {
            throw new IllegalStateException("No process registry configured");
        }
        return registry;
    }

    private static String newAnalysisId() {
        return UUID.randomUUID().toString();
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private record ScopeResult(List<WorkflowFailure> structural, List<WorkflowFailure> soundness) {}

    private record Outcome(String analysisId, ProcessGraph graph, List<WorkflowFailure> failures, Instant startedAt) {}
}
