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


package org.fireflyframework.bpmn.core.report;

import org.fireflyframework.bpmn.core.failure.FailureCategory;
import org.fireflyframework.bpmn.core.failure.FailureKind;
import org.fireflyframework.bpmn.core.failure.WorkflowFailure;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one analysis run over a single process.
 * Captures the ordered failure list together with graph size and timing metadata.
 */
public record AnalysisReport(
        String processId,
        String analysisId,
        List<WorkflowFailure> failures,
        Map<FailureCategory, Integer> countsByCategory,
        int nodeCount,
        int edgeCount,
        int scopeCount,
        Instant startedAt,
        Duration duration
) {

    public AnalysisReport {
        failures = failures != null ? List.copyOf(failures) : List.of();
        countsByCategory = countsByCategory != null ? Map.copyOf(countsByCategory) : Map.of();
    }

    /**
     * Builds a report whose category counts are derived from the failure list.
     */
    public static AnalysisReport of(String processId, String analysisId, List<WorkflowFailure> failures,
                                    int nodeCount, int edgeCount, int scopeCount,
                                    Instant startedAt, Duration duration) {
        Map<FailureCategory, Integer> counts = new EnumMap<>(FailureCategory.class);
        for (WorkflowFailure failure : failures) {
            counts.merge(failure.category(), 1, Integer::sum);
        }
        return new AnalysisReport(processId, analysisId, failures, counts,
                nodeCount, edgeCount, scopeCount, startedAt, duration);
    }

    /**
     * Returns {@code true} if the analysis found no failures at all.
     */
    public boolean isValid() {
        return failures.isEmpty();
    }

    public int failureCount() {
        return failures.size();
    }

    public int countOf(FailureCategory category) {
        return countsByCategory.getOrDefault(category, 0);
    }

    /**
     * Returns the failures of the given kind, in report order.
     */
    public List<WorkflowFailure> failuresOf(FailureKind kind) {
        return failures.stream().filter(f -> f.kind() == kind).toList();
    }

    public List<String> renderedFailures() {
        return failures.stream().map(WorkflowFailure::render).toList();
    }
}
