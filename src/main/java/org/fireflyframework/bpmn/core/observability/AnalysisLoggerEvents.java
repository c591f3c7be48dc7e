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

@Slf4j
public class AnalysisLoggerEvents implements AnalysisEvents {
    @Override
    public void onAnalysisStarted(String processId, String analysisId) {
        log.info("[bpmn-analysis] started process={} analysisId={}", processId, analysisId);
    }
    @Override
    public void onStageCompleted(String processId, String analysisId, AnalysisStage stage, int failureCount, long durationMs) {
        log.debug("[bpmn-analysis] stage.completed process={} analysisId={} stage={} failures={} durationMs={}", processId, analysisId, stage, failureCount, durationMs);
    }
    @Override
    public void onFailureDetected(String processId, String analysisId, WorkflowFailure failure) {
        log.warn("[bpmn-analysis] failure process={} analysisId={} {}", processId, analysisId, failure.render());
    }
    @Override
    public void onAnalysisCompleted(String processId, String analysisId, boolean valid, int failureCount, long durationMs) {
        log.info("[bpmn-analysis] completed process={} analysisId={} valid={} failures={} durationMs={}", processId, analysisId, valid, failureCount, durationMs);
    }
    @Override
    public void onAnalysisError(String processId, String analysisId, Throwable error) {
        log.error("[bpmn-analysis] error process={} analysisId={} error={}", processId, analysisId, error.getMessage());
    }
    @Override
    public void onConformanceChecked(String concreteId, String referenceId, String analysisId, int failureCount, long durationMs) {
        log.info("[bpmn-analysis] conformance.checked concrete={} reference={} analysisId={} failures={} durationMs={}", concreteId, referenceId, analysisId, failureCount, durationMs);
    }
}
