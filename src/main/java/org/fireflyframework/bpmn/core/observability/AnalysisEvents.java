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

public interface AnalysisEvents {
    // Lifecycle
    default void onAnalysisStarted(String processId, String analysisId) {}
    default void onStageCompleted(String processId, String analysisId, AnalysisStage stage, int failureCount, long durationMs) {}
    default void onAnalysisCompleted(String processId, String analysisId, boolean valid, int failureCount, long durationMs) {}
    default void onAnalysisError(String processId, String analysisId, Throwable error) {}

    // Findings
    default void onFailureDetected(String processId, String analysisId, WorkflowFailure failure) {}

    // Conformance
    default void onConformanceChecked(String concreteId, String referenceId, String analysisId, int failureCount, long durationMs) {}
}
