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

import org.fireflyframework.bpmn.core.failure.WorkflowFailure;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeAnalysisEvents implements AnalysisEvents {
    private final List<AnalysisEvents> delegates;

    public CompositeAnalysisEvents(List<AnalysisEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<AnalysisEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onAnalysisStarted(String processId, String analysisId) { safeForEach(d -> d.onAnalysisStarted(processId, analysisId)); }
    @Override public void onStageCompleted(String processId, String analysisId, AnalysisStage stage, int failureCount, long durationMs) { safeForEach(d -> d.onStageCompleted(processId, analysisId, stage, failureCount, durationMs)); }
    @Override public void onAnalysisCompleted(String processId, String analysisId, boolean valid, int failureCount, long durationMs) { safeForEach(d -> d.onAnalysisCompleted(processId, analysisId, valid, failureCount, durationMs)); }
    @Override public void onAnalysisError(String processId, String analysisId, Throwable error) { safeForEach(d -> d.onAnalysisError(processId, analysisId, error)); }
    @Override public void onFailureDetected(String processId, String analysisId, WorkflowFailure failure) { safeForEach(d -> d.onFailureDetected(processId, analysisId, failure)); }
    @Override public void onConformanceChecked(String concreteId, String referenceId, String analysisId, int failureCount, long durationMs) { safeForEach(d -> d.onConformanceChecked(concreteId, referenceId, analysisId, failureCount, durationMs)); }
}
