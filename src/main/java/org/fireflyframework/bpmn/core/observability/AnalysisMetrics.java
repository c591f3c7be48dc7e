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

package org.fireflyframework.bpmn.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.bpmn.core.failure.WorkflowFailure;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class AnalysisMetrics implements AnalysisEvents {
    private static final String PREFIX = "firefly.bpmn";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public AnalysisMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onAnalysisStarted(String processId, String analysisId) {
        counter("analyses.started", "process", processId).increment();
    }

    @Override
    public void onStageCompleted(String processId, String analysisId, AnalysisStage stage, int failureCount, long durationMs) {
        timer("stages.duration", "stage", stage.name()).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onFailureDetected(String processId, String analysisId, WorkflowFailure failure) {
        counter("failures", "kind", failure.kind().name(), "category", failure.category().name()).increment();
    }

    @Override
    public void onAnalysisCompleted(String processId, String analysisId, boolean valid, int failureCount, long durationMs) {
        counter("analyses.completed", "process", processId, "valid", String.valueOf(valid)).increment();
        timer("analyses.duration", "process", processId).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onAnalysisError(String processId, String analysisId, Throwable error) {
        counter("analyses.errors", "process", processId).increment();
    }

    @Override
    public void onConformanceChecked(String concreteId, String referenceId, String analysisId, int failureCount, long durationMs) {
        counter("conformance.checks", "reference", referenceId, "conformant", String.valueOf(failureCount == 0)).increment();
        timer("conformance.duration", "reference", referenceId).record(Duration.ofMillis(durationMs));
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
